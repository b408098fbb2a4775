package io.mnemos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MnemosConfig(
    AgentsConfig agents,
    ProvidersConfig providers,
    GraphConfig graph,
    EmbeddingConfig embedding,
    CapabilitiesConfig capabilities,
    RetrievalConfig retrieval
) {

    public static MnemosConfig defaults() {
        return new MnemosConfig(
            AgentsConfig.defaultConfig(),
            ProvidersConfig.defaults(),
            GraphConfig.defaults(),
            EmbeddingConfig.defaults(),
            CapabilitiesConfig.defaults(),
            RetrievalConfig.defaults()
        );
    }
}
