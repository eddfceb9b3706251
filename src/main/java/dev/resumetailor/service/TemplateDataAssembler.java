package dev.resumetailor.service;

import dev.resumetailor.config.TailorConfig;
import dev.resumetailor.model.ScoredBullet;
import dev.resumetailor.model.SkillLine;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the placeholder map consumed by the document renderer.
 */
@Component
@RequiredArgsConstructor
public class TemplateDataAssembler {

    private final TailorConfig tailorConfig;

    public Map<String, String> assemble(Map<String, List<ScoredBullet>> selection, Map<String, SkillLine> skillLines) {
        Map<String, String> data = new LinkedHashMap<>();

        selection.forEach((role, bullets) -> {
            String prefix = prefixFor(role);
            data.put(prefix + "_TITLE", tailorConfig.getRoleTitles().getOrDefault(role, ""));
            int slots = Math.max(tailorConfig.getBulletSlots(), bullets.size());
            for (int i = 0; i < slots; i++) {
                String text = i < bullets.size() ? bullets.get(i).bullet().getBullet() : "";
                data.put(prefix + "_P" + (i + 1), text);
            }
        });

        for (int i = 1; i <= tailorConfig.getSkillSlots(); i++) {
            SkillLine line = skillLines.get("SKILL_" + i);
            data.put("SKILL_" + i, line != null ? line.text() : "");
        }

        return Collections.unmodifiableMap(data);
    }

    /**
     * Configured prefix for a role, else the role upper-cased without spaces or hyphens.
     */
    public String prefixFor(String role) {
        String configured = tailorConfig.getRolePrefixes().get(role);
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return role.toUpperCase(Locale.ROOT).replace(" ", "").replace("-", "");
    }
}
