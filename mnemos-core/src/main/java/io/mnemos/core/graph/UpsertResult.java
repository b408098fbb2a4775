package io.mnemos.core.graph;

import java.util.Objects;

public record UpsertResult(Node node, boolean created) {

    public UpsertResult {
        Objects.requireNonNull(node, "node must not be null");
    }
}
