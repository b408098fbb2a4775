package io.mnemos.core.provider;

import io.mnemos.core.model.ChatMessage;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Placeholder registered for a configured provider that lacks credentials or a base URL. Every turn
 * routed to it fails with the recorded reason, so the agent's error path handles it like any other
 * provider failure.
 */
public final class DisabledProvider implements LlmProvider {
    static final String DEFAULT_REASON = "provider is disabled";

    private final String name;
    private final String reason;

    public DisabledProvider(String name, String reason) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.reason = reason == null || reason.isBlank() ? DEFAULT_REASON : reason;
    }

    public String reason() {
        return reason;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) {
        return LlmResponse.error(
            String.format("provider %s is not configured (%s)", name, reason),
            Map.of("provider", name, "model", model == null ? "" : model, "disabled", true)
        );
    }
}
