package io.mnemos.core.graph;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public record GraphStats(Map<String, Long> nodesByType, long relationships) {

    public GraphStats {
        nodesByType = nodesByType == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(nodesByType));
    }

    public long totalNodes() {
        return nodesByType.values().stream().mapToLong(Long::longValue).sum();
    }
}
