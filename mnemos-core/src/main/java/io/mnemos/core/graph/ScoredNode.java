package io.mnemos.core.graph;

import java.util.Objects;

public record ScoredNode(Node node, double score) {

    public ScoredNode {
        Objects.requireNonNull(node, "node must not be null");
    }
}
