package io.mnemos.core.graph;

import java.util.Objects;

/**
 * Restricts a vector search to nodes reachable from {@code ownerId} over an outgoing {@code relation}.
 */
public record OwnerScope(String ownerId, RelationType relation) {

    public OwnerScope {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(relation, "relation must not be null");
    }
}
