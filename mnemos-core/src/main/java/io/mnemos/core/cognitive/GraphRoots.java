package io.mnemos.core.cognitive;

import io.mnemos.core.graph.Node;

public record GraphRoots(Node user, Node assistant) {
}
