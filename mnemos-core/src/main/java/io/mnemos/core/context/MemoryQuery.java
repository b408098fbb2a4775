package io.mnemos.core.context;

import java.util.Objects;

/**
 * Input to a ranking strategy. {@code embedding} is {@code null} when the query could not be embedded,
 * {@code text} is blank when the caller supplied no query.
 */
public record MemoryQuery(String personaId, String text, double[] embedding, int limit, double minScore) {

    public MemoryQuery {
        Objects.requireNonNull(personaId, "personaId must not be null");
        text = text == null ? "" : text;
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }

    public boolean hasText() {
        return !text.isBlank();
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}
