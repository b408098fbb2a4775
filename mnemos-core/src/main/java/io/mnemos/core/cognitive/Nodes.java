package io.mnemos.core.cognitive;

import io.mnemos.core.graph.Node;
import io.mnemos.core.graph.NodeType;
import io.mnemos.core.graph.ValidationException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Construction functions per node type. Each returns an unpersisted node whose properties have been
 * checked against the type's schema; the store itself does not validate property shapes.
 */
public final class Nodes {

    private Nodes() {
    }

    public static Node user(String firstName, String lastName, Map<String, ?> extra) {
        String first = required("first_name", firstName);
        String last = lastName == null ? "" : lastName.trim();
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("first_name", first);
        properties.put("last_name", last);
        putAll(properties, extra);
        requireStringList(properties, "job_titles");
        requireStringList(properties, "skills");
        return Node.unpersisted(NodeType.USER, (first + " " + last).trim(), properties);
    }

    public static Node assistant(String name, String model) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("model", model == null ? "" : model);
        properties.put("capabilities", List.of("research", "writing", "analysis", "coding", "conversation", "planning"));
        return Node.unpersisted(NodeType.ASSISTANT, required("name", name), properties);
    }

    public static Node persona(String name, Map<String, ?> attributes) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("core_values", List.of());
        properties.put("interests", List.of());
        properties.put("quirks", List.of());
        properties.put("initialization_complete", false);
        properties.put("conversation_count", 0);
        putAll(properties, attributes);
        requireStringList(properties, "core_values");
        requireStringList(properties, "interests");
        requireStringList(properties, "quirks");
        return Node.unpersisted(NodeType.PERSONA, required("name", name), properties);
    }

    public static Node trait(String name, String description, String traitType, double strength) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("description", description == null ? "" : description);
        properties.put("trait_type", traitType == null || traitType.isBlank() ? "core" : traitType);
        properties.put("strength", unit("strength", strength));
        properties.put("examples", List.of());
        properties.put("triggers", List.of());
        return Node.unpersisted(NodeType.TRAIT, required("name", name), properties);
    }

    public static Node memory(String title, String content, String memoryType, double[] embedding) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("content", required("content", content));
        properties.put("memory_type", memoryType == null || memoryType.isBlank() ? "anecdote" : memoryType);
        properties.put("use_contexts", List.of());
        properties.put("related_topics", List.of());
        properties.put("times_used", 0);
        if (embedding != null && embedding.length > 0) {
            properties.put(Node.EMBEDDING, embedding);
        }
        String name = title == null || title.isBlank() ? truncate(content.trim(), 100) : title;
        return Node.unpersisted(NodeType.MEMORY, name, properties);
    }

    public static Node preference(String name, Object value, String category, double confidence) {
        if (value == null) {
            throw new ValidationException("Preference value is required");
        }
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("value", value);
        properties.put("category", category == null || category.isBlank() ? "general" : category);
        properties.put("confidence", unit("confidence", confidence));
        properties.put("source", "inferred");
        properties.put("observation_count", 1);
        return Node.unpersisted(NodeType.PREFERENCE, required("name", name), properties);
    }

    public static Node person(String name, Map<String, ?> extra) {
        Map<String, Object> properties = new LinkedHashMap<>();
        putAll(properties, extra);
        return Node.unpersisted(NodeType.PERSON, required("name", name), properties);
    }

    public static Node project(String name, String description, ProjectCategory category, boolean lifeArea) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("description", description == null ? "" : description);
        properties.put("category", (category == null ? ProjectCategory.GENERAL : category).value());
        properties.put("status", "active");
        properties.put("is_life_area", lifeArea);
        return Node.unpersisted(NodeType.PROJECT, required("name", name), properties);
    }

    public static Node cycle(String name, String objective, CycleType cycleType, int priority, String context) {
        if (priority < 1 || priority > 10) {
            throw new ValidationException("Cycle priority must be between 1 and 10, got " + priority);
        }
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("objective", required("objective", objective));
        properties.put("cycle_type", (cycleType == null ? CycleType.RESEARCH : cycleType).value());
        properties.put("status", CycleStatus.PLANNING.value());
        properties.put("priority", priority);
        properties.put("estimated_tasks", 0);
        properties.put("tasks_completed", 0);
        properties.put("insights_count", 0);
        if (context != null && !context.isBlank()) {
            properties.put("context", context);
        }
        return Node.unpersisted(NodeType.CYCLE, required("name", name), properties);
    }

    public static Node task(String description, int priority) {
        String text = required("description", description);
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("description", text);
        properties.put("status", "pending");
        properties.put("priority", priority);
        return Node.unpersisted(NodeType.TASK, truncate(text, 100), properties);
    }

    public static Node goal(String name, String description, String timeframe, List<String> successCriteria) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("description", description == null ? "" : description);
        if (timeframe != null && !timeframe.isBlank()) {
            properties.put("timeframe", timeframe);
        }
        properties.put("success_criteria", successCriteria == null ? List.of() : successCriteria);
        return Node.unpersisted(NodeType.GOAL, required("name", name), properties);
    }

    public static Node insight(String insight, String sourceType, double confidence) {
        String text = required("insight", insight);
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("insight", text);
        properties.put("source_type", sourceType == null || sourceType.isBlank() ? "conversation" : sourceType);
        properties.put("confidence", unit("confidence", confidence));
        return Node.unpersisted(NodeType.INSIGHT, truncate(text, 100), properties);
    }

    public static Node topic(String name, String description) {
        Map<String, Object> properties = new LinkedHashMap<>();
        if (description != null && !description.isBlank()) {
            properties.put("description", description);
        }
        return Node.unpersisted(NodeType.TOPIC, required("name", name), properties);
    }

    public static Node document(String title, String content, String sourceUrl, String docType) {
        String text = content == null ? "" : content;
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("title", required("title", title));
        properties.put("content", text);
        if (sourceUrl != null && !sourceUrl.isBlank()) {
            properties.put("source_url", sourceUrl);
        }
        if (docType != null && !docType.isBlank()) {
            properties.put("doc_type", docType);
        }
        properties.put("char_count", text.length());
        properties.put("word_count", text.isBlank() ? 0 : text.trim().split("\\s+").length);
        return Node.unpersisted(NodeType.DOCUMENT, title, properties);
    }

    public static Node chunk(String text, double[] embedding, String sourceId, int chunkIndex, Map<String, ?> extra) {
        String body = required("text", text);
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("text", body);
        if (embedding != null && embedding.length > 0) {
            properties.put(Node.EMBEDDING, embedding);
        }
        if (sourceId != null) {
            properties.put("source_id", sourceId);
        }
        properties.put("chunk_index", chunkIndex);
        properties.put("char_count", body.length());
        putAll(properties, extra);
        String name = body.length() > 50 ? body.substring(0, 50) + "..." : body;
        return Node.unpersisted(NodeType.CHUNK, name, properties);
    }

    static double unit(String field, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ValidationException(field + " must be within [0, 1], got " + value);
        }
        return value;
    }

    private static String required(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        return value;
    }

    private static void requireStringList(Map<String, Object> properties, String key) {
        Object value = properties.get(key);
        if (value != null && !(value instanceof List<?>)) {
            throw new ValidationException(key + " must be a list");
        }
    }

    private static void putAll(Map<String, Object> target, Map<String, ?> extra) {
        if (extra == null) {
            return;
        }
        extra.forEach((key, value) -> {
            if (value != null) {
                target.put(key, value);
            }
        });
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
