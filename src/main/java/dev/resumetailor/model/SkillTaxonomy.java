package dev.resumetailor.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Read-only mapping from skill name to the categories it belongs to.
 * Iteration follows the order the skills were loaded in.
 */
public record SkillTaxonomy(Map<String, Set<String>> skillsToCategories) {

    public SkillTaxonomy {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        if (skillsToCategories != null) {
            skillsToCategories.forEach((skill, categories) -> copy.put(skill,
                    Collections.unmodifiableSet(new LinkedHashSet<>(categories != null ? categories : Set.of()))));
        }
        skillsToCategories = Collections.unmodifiableMap(copy);
    }

    public static SkillTaxonomy of(Map<String, ? extends Collection<String>> mapping) {
        Map<String, Set<String>> converted = new LinkedHashMap<>();
        mapping.forEach((skill, categories) -> converted.put(skill, new LinkedHashSet<>(categories)));
        return new SkillTaxonomy(converted);
    }

    public static SkillTaxonomy empty() {
        return new SkillTaxonomy(Map.of());
    }

    public Set<String> skills() {
        return skillsToCategories.keySet();
    }

    public Set<String> categoriesOf(String skill) {
        return skillsToCategories.getOrDefault(skill, Set.of());
    }

    public boolean isEmpty() {
        return skillsToCategories.isEmpty();
    }
}
