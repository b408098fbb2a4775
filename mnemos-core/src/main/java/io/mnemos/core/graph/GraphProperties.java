package io.mnemos.core.graph;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

final class GraphProperties {
    private static final Set<String> RESERVED = Set.of("id", "type", "created_at", "updated_at");

    private GraphProperties() {
    }

    static boolean isReserved(String key) {
        return RESERVED.contains(key);
    }

    static void validateNew(NodeType type, String name) {
        if (type == null) {
            throw new ValidationException("Node type is required");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("Node name is required for " + type.label());
        }
    }

    static void validateLink(String fromId, String toId, RelationType type) {
        if (fromId == null || toId == null) {
            throw new ValidationException("Unpersisted nodes cannot be linked");
        }
        if (type == null) {
            throw new ValidationException("Relationship type is required");
        }
    }

    /**
     * Exact-match filters accept scalar values only.
     */
    static Map<String, PropertyValue> filters(Map<String, ?> raw) {
        Map<String, PropertyValue> converted = PropertyValue.ofAll(raw);
        for (Map.Entry<String, PropertyValue> entry : converted.entrySet()) {
            PropertyValue.Kind kind = entry.getValue().kind();
            if (kind == PropertyValue.Kind.LIST || kind == PropertyValue.Kind.MAP) {
                throw new ValidationException("Filter on '" + entry.getKey() + "' must be a scalar");
            }
        }
        return converted;
    }

    static Node merge(Node node, Map<String, ?> changes, Instant now) {
        Map<String, PropertyValue> properties = new LinkedHashMap<>(node.properties());
        String name = node.name();
        if (changes != null) {
            for (Map.Entry<String, ?> entry : changes.entrySet()) {
                String key = entry.getKey();
                if (key == null || isReserved(key)) {
                    continue;
                }
                Object value = entry.getValue();
                if ("name".equals(key)) {
                    if (value != null && !String.valueOf(value).isBlank()) {
                        name = String.valueOf(value).trim();
                    }
                } else if (value == null) {
                    properties.remove(key);
                } else {
                    properties.put(key, PropertyValue.of(value));
                }
            }
        }
        return new Node(node.id(), node.type(), name, properties, node.createdAt(), now);
    }
}
