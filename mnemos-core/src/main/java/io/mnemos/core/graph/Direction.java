package io.mnemos.core.graph;

public enum Direction {
    OUT,
    IN,
    BOTH
}
