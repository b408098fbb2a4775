package io.mnemos.core.provider;

import io.mnemos.core.model.ToolCall;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record LlmResponse(String content, List<ToolCall> toolCalls, Map<String, Object> usage) {
    public static final String ERROR_PREFIX = "Error calling LLM: ";

    public LlmResponse {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        usage = usage == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(usage));
    }

    public static LlmResponse error(String message, Map<String, Object> details) {
        Map<String, Object> usage = new LinkedHashMap<>(details == null ? Map.of() : details);
        usage.put("error", true);
        return new LlmResponse(ERROR_PREFIX + message, List.of(), usage);
    }

    public boolean failed() {
        return Boolean.TRUE.equals(usage.get("error"));
    }
}
