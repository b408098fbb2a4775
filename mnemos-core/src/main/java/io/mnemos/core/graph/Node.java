package io.mnemos.core.graph;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A typed graph entity. {@code id} is {@code null} until the store persists the node.
 */
public record Node(
    String id,
    NodeType type,
    String name,
    Map<String, PropertyValue> properties,
    Instant createdAt,
    Instant updatedAt
) {
    public static final String EMBEDDING = "embedding";

    public Node {
        Objects.requireNonNull(type, "type must not be null");
        name = name == null ? "" : name;
        properties = properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static Node unpersisted(NodeType type, String name, Map<String, ?> properties) {
        return new Node(null, type, name, PropertyValue.ofAll(properties), null, null);
    }

    public boolean persisted() {
        return id != null;
    }

    public Optional<PropertyValue> property(String key) {
        return Optional.ofNullable(properties.get(key));
    }

    public String string(String key, String fallback) {
        PropertyValue value = properties.get(key);
        return value == null ? fallback : value.asString();
    }

    public double number(String key, double fallback) {
        PropertyValue value = properties.get(key);
        if (value == null) {
            return fallback;
        }
        try {
            return value.asDouble();
        } catch (ValidationException e) {
            return fallback;
        }
    }

    public boolean bool(String key, boolean fallback) {
        PropertyValue value = properties.get(key);
        return value == null ? fallback : value.asBoolean();
    }

    public List<String> strings(String key) {
        PropertyValue value = properties.get(key);
        if (value == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (Object item : value.asList()) {
            out.add(String.valueOf(item));
        }
        return out;
    }

    /**
     * Stored embedding, or {@code null} when the node has none.
     */
    public double[] embedding() {
        PropertyValue value = properties.get(EMBEDDING);
        return value == null ? null : value.asVector();
    }

    public Map<String, Object> plainProperties() {
        return PropertyValue.toPlain(properties);
    }

    /**
     * Flat view for tool output and prompts. Embeddings are left out.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("type", type.label());
        map.put("name", name);
        properties.forEach((key, value) -> {
            if (!EMBEDDING.equals(key)) {
                map.put(key, value.value());
            }
        });
        if (createdAt != null) {
            map.put("created_at", createdAt.toString());
        }
        if (updatedAt != null) {
            map.put("updated_at", updatedAt.toString());
        }
        return map;
    }
}
