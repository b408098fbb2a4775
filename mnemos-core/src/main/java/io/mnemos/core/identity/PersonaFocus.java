package io.mnemos.core.identity;

import java.util.Locale;

public enum PersonaFocus {
    IDENTITY,
    MEMORIES,
    ADAPTATION;

    /**
     * Unknown or blank values fall back to {@link #IDENTITY}.
     */
    public static PersonaFocus parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return IDENTITY;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return IDENTITY;
        }
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
