package io.mnemos.core.cognitive;

import java.util.Locale;

public enum CycleType {
    RESEARCH,
    INTROSPECTION,
    PROJECT_WORK,
    MAINTENANCE,
    LEARNING,
    OUTREACH;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
