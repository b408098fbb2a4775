package io.mnemos.core.provider;

import io.mnemos.core.model.ChatMessage;
import java.util.List;
import java.util.Map;

/**
 * Offline provider: replies with the latest user message and never calls tools. Selected for models
 * named {@code echo*}.
 */
public final class EchoProvider implements LlmProvider {
    private final String name;

    public EchoProvider(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) {
        Map<String, Object> usage = Map.of("provider", name, "tools_offered", tools == null ? 0 : tools.size());
        return new LlmResponse("[" + name + "] " + ChatMessage.lastUserContent(messages), List.of(), usage);
    }
}
