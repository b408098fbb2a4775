package io.mnemos.core.cognitive;

import java.util.List;

/**
 * Outcome of storing a document. {@code embedded} is false when chunks were stored without vectors.
 */
public record IngestResult(String documentId, List<String> chunkIds, boolean embedded) {

    public IngestResult {
        chunkIds = chunkIds == null ? List.of() : List.copyOf(chunkIds);
    }
}
