package io.mnemos.core.graph;

/**
 * Caller supplied a node, property or relationship that does not fit the schema.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
