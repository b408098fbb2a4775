package io.mnemos.core.cognitive;

import java.util.Locale;

public enum ProjectCategory {
    WORK,
    BOOK,
    RESEARCH,
    CAMPAIGN,
    LEARNING,
    FAMILY,
    HEALTH,
    FINANCE,
    SOCIAL,
    HOBBY,
    TRAVEL,
    HOME,
    GENERAL;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Unknown or blank input maps to {@link #GENERAL}.
     */
    public static ProjectCategory parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return GENERAL;
        }
        for (ProjectCategory category : values()) {
            if (category.value().equalsIgnoreCase(raw.trim())) {
                return category;
            }
        }
        return GENERAL;
    }
}
