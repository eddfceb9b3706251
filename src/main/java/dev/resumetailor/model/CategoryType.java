package dev.resumetailor.model;

import java.util.List;
import java.util.Locale;

/**
 * Coarse family of a skill category, used to keep the recommended categories varied.
 * Rules are checked in declaration order and the first one whose keyword appears in the
 * category name wins.
 */
public enum CategoryType {
    PROGRAMMING(List.of("programming", "language", "framework")),
    INFRASTRUCTURE(List.of("cloud", "infrastructure", "devops")),
    DATA(List.of("data", "analytics", "machine learning", "ai")),
    TOOLS(List.of("tool", "software", "platform")),
    OTHER(List.of());

    private final List<String> keywords;

    CategoryType(List<String> keywords) {
        this.keywords = keywords;
    }

    public static CategoryType classify(String category) {
        if (category == null) {
            return OTHER;
        }
        String lower = category.toLowerCase(Locale.ROOT);
        for (CategoryType type : values()) {
            if (type.keywords.stream().anyMatch(lower::contains)) {
                return type;
            }
        }
        return OTHER;
    }
}
