package dev.resumetailor.model;

import java.util.List;

/**
 * A recommended skill category with its best matching skills, most relevant first.
 */
public record SkillGroup(String category, List<String> skills) {

    public SkillGroup {
        skills = skills == null ? List.of() : List.copyOf(skills);
    }
}
