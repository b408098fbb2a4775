package io.mnemos.core.graph;

import java.util.Locale;
import java.util.Optional;

public enum RelationType {
    // identity
    ASSISTS,
    HAS_TRAIT,
    HAS_MEMORY,
    LEARNED_PREFERENCE,
    ADAPTED_FOR,
    // ownership and structure
    OWNS,
    INITIATED,
    PART_OF,
    CONTAINS,
    WORKS_TOWARD,
    DEPENDS_ON,
    DERIVED_FROM,
    INFORMS,
    USES_SOURCE,
    // people
    KNOWS,
    WORKS_AT,
    MEMBER_OF,
    COLLABORATES_ON,
    // knowledge
    INTERESTED_IN,
    ABOUT_TOPIC,
    RELATED_TO,
    HAS_CHUNK,
    MENTIONS,
    REFERENCES,
    SIMILAR_TO,
    TAGGED_WITH,
    HAS_NOTE,
    HAS_MESSAGE;

    public static Optional<RelationType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (RelationType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
