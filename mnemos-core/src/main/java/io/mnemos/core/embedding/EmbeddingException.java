package io.mnemos.core.embedding;

import java.io.IOException;

/**
 * The text could not be embedded. Retrieval treats this as a reason to fall back, never as fatal.
 */
public final class EmbeddingException extends IOException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
