package io.mnemos.core.cognitive;

import java.util.Locale;

public enum CycleStatus {
    PLANNING,
    ACTIVE,
    PAUSED,
    COMPLETED,
    ABANDONED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean terminal() {
        return this == COMPLETED || this == ABANDONED;
    }
}
