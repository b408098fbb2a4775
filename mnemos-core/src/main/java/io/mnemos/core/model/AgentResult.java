package io.mnemos.core.model;

import java.util.List;
import java.util.Map;

/**
 * One completed turn. {@code contextUsed} describes what retrieval contributed to the system prompt and
 * {@code toolRuns} lists each tool invocation with its outcome.
 */
public record AgentResult(
    String content,
    List<ChatMessage> transcript,
    List<ToolRun> toolRuns,
    Map<String, Object> contextUsed,
    Map<String, Object> usage
) {

    public AgentResult {
        content = content == null ? "" : content;
        transcript = transcript == null ? List.of() : List.copyOf(transcript);
        toolRuns = toolRuns == null ? List.of() : List.copyOf(toolRuns);
        contextUsed = contextUsed == null ? Map.of() : contextUsed;
        usage = usage == null ? Map.of() : usage;
    }

    public boolean usedFallbackContext() {
        return Boolean.TRUE.equals(contextUsed.get("fallback"));
    }

    public record ToolRun(String name, boolean success, String error) {
    }
}
