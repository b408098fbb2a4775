package io.mnemos.core.cognitive;

import io.mnemos.core.graph.Node;
import io.mnemos.core.graph.RelationType;

public record ProjectMember(Node person, RelationType relation, String role) {
}
