package io.mnemos.core.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits text into overlapping windows for embedding. A window prefers to end just after a separator found
 * inside its trailing overlap region.
 */
public final class TextChunker {
    public static final int DEFAULT_SIZE = 500;
    public static final int DEFAULT_OVERLAP = 50;

    private final int chunkSize;
    private final int overlap;
    private final String separator;

    public TextChunker() {
        this(DEFAULT_SIZE, DEFAULT_OVERLAP, "\n");
    }

    public TextChunker(int chunkSize, int overlap, String separator) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("overlap must be in [0, chunkSize)");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
        this.separator = Objects.requireNonNull(separator, "separator must not be null");
    }

    public List<TextChunk> chunk(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<TextChunk> chunks = new ArrayList<>();
        int length = text.length();
        int start = 0;
        int index = 0;
        while (start < length) {
            int end = Math.min(start + chunkSize, length);
            if (end < length && !separator.isEmpty()) {
                int searchFrom = Math.max(start + chunkSize - overlap, start);
                int found = text.lastIndexOf(separator, end - separator.length());
                if (found >= searchFrom && found > start) {
                    end = found + separator.length();
                }
            }

            String piece = text.substring(start, end).strip();
            if (!piece.isEmpty()) {
                chunks.add(new TextChunk(piece, index++, start, end, piece.length()));
            }
            if (end >= length) {
                break;
            }
            // the next window must start past this one's start
            start = Math.max(end - overlap, start + 1);
        }
        return chunks;
    }
}
