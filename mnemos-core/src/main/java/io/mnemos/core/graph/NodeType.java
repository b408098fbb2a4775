package io.mnemos.core.graph;

import java.util.Locale;
import java.util.Optional;

/**
 * Schema tag of a node. The label is what the store persists.
 */
public enum NodeType {
    USER("User"),
    ASSISTANT("Assistant"),
    PERSONA("Persona"),
    PERSON("Person"),
    ORGANIZATION("Organization"),
    PROJECT("Project"),
    CYCLE("Cycle"),
    CHAPTER("Chapter"),
    DRAFT("Draft"),
    TASK("Task"),
    GOAL("Goal"),
    ARTICLE("Article"),
    JOB("Job"),
    TOPIC("Topic"),
    SOURCE("Source"),
    SCHOLARSHIP("Scholarship"),
    CHUNK("Chunk"),
    ENTITY("Entity"),
    DOCUMENT("Document"),
    CONVERSATION("Conversation"),
    MESSAGE("Message"),
    CALL("Call"),
    NOTE("Note"),
    TAG("Tag"),
    INSIGHT("Insight"),
    MEMORY("Memory"),
    TRAIT("Trait"),
    PREFERENCE("Preference");

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<NodeType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (NodeType type : values()) {
            if (type.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static NodeType parse(String label) {
        return fromLabel(label).orElseThrow(() -> new ValidationException("Unknown node type: " + label));
    }
}
