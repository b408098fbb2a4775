package io.mnemos.core.context;

import io.mnemos.core.graph.Node;
import java.util.Objects;

public record RankedMemory(Node memory, double score) {

    public RankedMemory {
        Objects.requireNonNull(memory, "memory must not be null");
    }

    public String content() {
        return memory.string("content", memory.name());
    }
}
