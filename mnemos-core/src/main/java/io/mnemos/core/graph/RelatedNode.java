package io.mnemos.core.graph;

import java.util.Map;
import java.util.Objects;

/**
 * A neighbour reached over one relationship, with the relationship's own type, direction and properties.
 */
public record RelatedNode(
    Node node,
    RelationType relation,
    Direction direction,
    Map<String, PropertyValue> relationProperties
) {

    public RelatedNode {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(relation, "relation must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        relationProperties = relationProperties == null ? Map.of() : Map.copyOf(relationProperties);
    }

    public String relationString(String key) {
        PropertyValue value = relationProperties.get(key);
        return value == null ? null : value.asString();
    }
}
