package io.mnemos.core.capability;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Difference between two registry snapshots. Errors read {@code "<file>: <reason>"}.
 */
public record RefreshResult(List<String> added, List<String> updated, List<String> removed, List<String> errors) {

    public RefreshResult {
        added = added == null ? List.of() : List.copyOf(added);
        updated = updated == null ? List.of() : List.copyOf(updated);
        removed = removed == null ? List.of() : List.copyOf(removed);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasChanges() {
        return !added.isEmpty() || !updated.isEmpty() || !removed.isEmpty();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("added", added);
        map.put("updated", updated);
        map.put("removed", removed);
        map.put("errors", errors);
        return map;
    }
}
