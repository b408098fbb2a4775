package io.mnemos.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One transcript entry. Assistant messages may carry tool calls; tool messages answer one call by id.
 */
public record ChatMessage(MessageRole role, String content, String toolCallId, List<ToolCall> toolCalls) {

    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
        toolCalls = toolCalls == null || role != MessageRole.ASSISTANT ? List.of() : List.copyOf(toolCalls);
        toolCallId = role == MessageRole.TOOL ? toolCallId : null;
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(MessageRole.SYSTEM, content, null, List.of());
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(MessageRole.USER, content, null, List.of());
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(MessageRole.ASSISTANT, content, null, List.of());
    }

    public static ChatMessage assistantWithToolCalls(String content, List<ToolCall> toolCalls) {
        return new ChatMessage(MessageRole.ASSISTANT, content, null, toolCalls);
    }

    public static ChatMessage tool(String content, String toolCallId) {
        return new ChatMessage(MessageRole.TOOL, content, toolCallId, List.of());
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    /**
     * Content of the latest user message, or an empty string when there is none.
     */
    public static String lastUserContent(List<ChatMessage> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            ChatMessage message = messages.get(i);
            if (message.role() == MessageRole.USER) {
                return message.content();
            }
        }
        return "";
    }
}
