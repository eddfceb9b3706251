package dev.resumetailor.service;

import dev.resumetailor.config.RecommenderConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a skill category as {@code "Category [Skill, Skill]"} and fits it into a
 * character budget.
 */
@Component
@RequiredArgsConstructor
public class SkillFormatter {

    private static final String FALLBACK_SUFFIX = " [...]";

    private final RecommenderConfig recommenderConfig;

    public String format(String category, List<String> skills) {
        return category + " [" + String.join(", ", skills) + "]";
    }

    /**
     * Format within the configured character limit.
     */
    public String formatWithLimit(String category, List<String> skills) {
        return formatWithLimit(category, skills, recommenderConfig.getSkillCharLimit());
    }

    /**
     * Format and shorten until the result fits {@code limit} characters.
     * <ul>
     *   <li>A single skill is cut and suffixed with "..." when at least 11 characters
     *       remain for it.</li>
     *   <li>With several skills, trailing skills are dropped until it fits; the number
     *       dropped is shown as {@code " +N]"} when there is room.</li>
     *   <li>Otherwise the result is {@code "Category [...]"}.</li>
     * </ul>
     * Never fails; an empty skill list yields an empty string.
     */
    public String formatWithLimit(String category, List<String> skills, int limit) {
        if (skills == null || skills.isEmpty()) {
            return "";
        }

        String formatted = format(category, skills);
        if (formatted.length() <= limit) {
            return formatted;
        }

        if (skills.size() == 1) {
            // room left for the skill once the category, space and brackets are placed
            int available = limit - category.length() - 4;
            if (available > 10) {
                String skill = skills.get(0);
                String truncated = skill.substring(0, Math.min(skill.length(), available - 3)) + "...";
                return category + " [" + truncated + "]";
            }
        } else {
            List<String> working = new ArrayList<>(skills);
            while (!working.isEmpty() && format(category, working).length() > limit) {
                working.remove(working.size() - 1);
            }

            if (!working.isEmpty()) {
                String fitted = format(category, working);
                int remaining = skills.size() - working.size();
                if (remaining > 0 && fitted.length() + 5 <= limit) {
                    return fitted.substring(0, fitted.length() - 1) + " +" + remaining + "]";
                }
                return fitted;
            }
        }

        return category + FALLBACK_SUFFIX;
    }
}
