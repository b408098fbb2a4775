package io.mnemos.core.capability;

public final class HandlerNotFoundException extends CapabilityException {

    public HandlerNotFoundException(String message) {
        super(message);
    }

    public HandlerNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
