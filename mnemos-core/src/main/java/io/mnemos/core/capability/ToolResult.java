package io.mnemos.core.capability;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a tool call as handed back to the inference loop. Failures carry an {@code error_type} of
 * {@code handler_not_found}, {@code execution_error} or {@code tool_disabled}.
 */
public record ToolResult(String toolName, boolean success, Object output, String error, String errorType) {
    public static final String HANDLER_NOT_FOUND = "handler_not_found";
    public static final String EXECUTION_ERROR = "execution_error";
    public static final String TOOL_DISABLED = "tool_disabled";

    public static ToolResult success(String toolName, Object output) {
        return new ToolResult(toolName, true, output, null, null);
    }

    public static ToolResult failure(String toolName, String errorType, String error) {
        return new ToolResult(toolName, false, null, error, errorType);
    }

    /**
     * Payload for the tool message: the handler output on success, an error object otherwise.
     */
    public Object payload() {
        if (success) {
            return output;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", error);
        payload.put("error_type", errorType);
        return payload;
    }
}
