package io.mnemos.core.graph;

/**
 * The backing store could not be reached. Never retried by the store itself.
 */
public class StoreUnavailableException extends GraphStoreException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
