package io.mnemos.core.provider;

import java.util.Locale;

/**
 * Picks the provider for a turn: the configured one when named, otherwise by model prefix.
 */
public final class ProviderRouter {
    private final ProviderRegistry registry;

    public ProviderRouter(ProviderRegistry registry) {
        this.registry = registry;
    }

    public LlmProvider resolve(String preferredProvider, String model) {
        if (preferredProvider != null && !preferredProvider.isBlank()) {
            return registry.find(preferredProvider)
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + preferredProvider));
        }

        String normalizedModel = model == null ? "" : model.toLowerCase(Locale.ROOT);
        if (normalizedModel.startsWith("echo")) {
            return require("echo");
        }
        if (normalizedModel.startsWith("openai/") || normalizedModel.startsWith("gpt")) {
            return require("openai");
        }
        return require("openrouter");
    }

    private LlmProvider require(String name) {
        return registry.find(name)
            .orElseThrow(() -> new IllegalArgumentException("Provider " + name + " is not registered"));
    }
}
