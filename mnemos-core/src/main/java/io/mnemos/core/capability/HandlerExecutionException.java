package io.mnemos.core.capability;

public final class HandlerExecutionException extends CapabilityException {
    private final String toolName;

    public HandlerExecutionException(String toolName, Throwable cause) {
        super("Tool " + toolName + " failed: " + describe(cause), cause);
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
