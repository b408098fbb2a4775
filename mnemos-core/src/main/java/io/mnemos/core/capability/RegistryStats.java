package io.mnemos.core.capability;

import java.time.Instant;
import java.util.Map;

public record RegistryStats(
    int total,
    Map<Integer, Integer> byTier,
    Map<String, Integer> byCategory,
    int enabled,
    int disabled,
    Instant lastRefresh
) {

    public RegistryStats {
        byTier = Map.copyOf(byTier);
        byCategory = Map.copyOf(byCategory);
    }
}
