package io.mnemos.core.embedding;

import io.mnemos.core.config.ConfigurationException;
import io.mnemos.core.config.model.EmbeddingConfig;
import io.mnemos.core.config.model.ProviderConfig;
import io.mnemos.core.config.model.ProvidersConfig;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the configured {@link EmbeddingProvider}. A provider without credentials becomes a
 * {@link DisabledEmbeddingProvider} so retrieval degrades instead of failing startup.
 */
public final class EmbeddingProviders {
    private static final Logger LOG = LoggerFactory.getLogger(EmbeddingProviders.class);

    private EmbeddingProviders() {
    }

    public static EmbeddingProvider create(EmbeddingConfig config, ProvidersConfig providers) {
        EmbeddingConfig embedding = config == null ? EmbeddingConfig.defaults() : config;
        ProvidersConfig keys = providers == null ? ProvidersConfig.defaults() : providers;
        String provider = embedding.provider() == null || embedding.provider().isBlank()
            ? "local"
            : embedding.provider().trim().toLowerCase(Locale.ROOT).replace('_', '-');

        return switch (provider) {
            case "local" -> new HashingEmbeddingProvider(
                embedding.dimensions() > 0 ? embedding.dimensions() : HashingEmbeddingProvider.DEFAULT_DIMENSIONS
            );
            case "openai" -> http("openai", embedding, keys.openai(),
                "https://api.openai.com/v1", "text-embedding-3-small", 1536);
            case "openrouter" -> http("openrouter", embedding, keys.openrouter(),
                "https://openrouter.ai/api/v1", "qwen/qwen3-embedding-8b", 4096);
            case "hosted-gateway", "gateway" -> gateway(embedding, keys.gateway());
            default -> throw new ConfigurationException("Unknown embedding provider: " + embedding.provider());
        };
    }

    private static EmbeddingProvider gateway(EmbeddingConfig embedding, ProviderConfig provider) {
        String apiBase = firstNonBlank(embedding.apiBase(), provider == null ? null : provider.apiBase());
        if (apiBase == null) {
            throw new ConfigurationException("embedding.apiBase is required for the hosted-gateway provider");
        }
        if (embedding.model() == null || embedding.model().isBlank()) {
            throw new ConfigurationException("embedding.model is required for the hosted-gateway provider");
        }
        return http("hosted-gateway", embedding, provider, apiBase, embedding.model(), 0);
    }

    private static EmbeddingProvider http(
        String name,
        EmbeddingConfig embedding,
        ProviderConfig provider,
        String defaultBase,
        String defaultModel,
        int defaultDimensions
    ) {
        String apiKey = firstNonBlank(embedding.apiKey(), provider == null ? null : provider.apiKey());
        if (apiKey == null) {
            LOG.warn("No API key for embedding provider {}; semantic memory ranking is disabled", name);
            return new DisabledEmbeddingProvider(name, "missing API key for embedding provider " + name);
        }
        String apiBase = firstNonBlank(embedding.apiBase(), provider == null ? null : provider.apiBase());
        Map<String, String> headers = provider == null || provider.extraHeaders() == null
            ? Map.of()
            : provider.extraHeaders();
        return new OpenAiCompatEmbeddingProvider(
            name,
            apiKey,
            apiBase == null ? defaultBase : apiBase,
            embedding.model() == null || embedding.model().isBlank() ? defaultModel : embedding.model(),
            embedding.dimensions() > 0 ? embedding.dimensions() : defaultDimensions,
            headers,
            Duration.ofSeconds(embedding.timeoutSeconds() > 0 ? embedding.timeoutSeconds() : 30)
        );
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first.trim();
        }
        if (second != null && !second.isBlank()) {
            return second.trim();
        }
        return null;
    }
}
