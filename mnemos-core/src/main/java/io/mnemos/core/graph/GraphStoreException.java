package io.mnemos.core.graph;

import java.io.IOException;

public class GraphStoreException extends IOException {

    public GraphStoreException(String message) {
        super(message);
    }

    public GraphStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
