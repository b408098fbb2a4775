package io.mnemos.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Embedding backend. {@code provider} is one of openai, openrouter, hosted-gateway or local; blank
 * model, dimensions and apiBase fall back to the provider's defaults. Keys come from the matching
 * {@code providers} entry unless set here.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbeddingConfig(
    String provider,
    String model,
    int dimensions,
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds
) {

    public static EmbeddingConfig defaults() {
        return new EmbeddingConfig("local", "", 0, "", "", 30);
    }
}
