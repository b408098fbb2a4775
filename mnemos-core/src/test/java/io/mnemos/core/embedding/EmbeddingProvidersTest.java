package io.mnemos.core.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemos.core.config.ConfigurationException;
import io.mnemos.core.config.model.EmbeddingConfig;
import io.mnemos.core.config.model.ProviderConfig;
import io.mnemos.core.config.model.ProvidersConfig;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EmbeddingProvidersTest {

    @Test
    void shouldDefaultToLocalHashing() {
        EmbeddingProvider provider = EmbeddingProviders.create(EmbeddingConfig.defaults(), ProvidersConfig.defaults());

        assertThat(provider).isInstanceOf(HashingEmbeddingProvider.class);
        assertThat(provider.dimensions()).isEqualTo(HashingEmbeddingProvider.DEFAULT_DIMENSIONS);
    }

    @Test
    void shouldDisableHttpProviderWithoutKey() {
        EmbeddingConfig config = new EmbeddingConfig("openai", "", 0, "", "", 30);

        EmbeddingProvider provider = EmbeddingProviders.create(config, ProvidersConfig.defaults());

        assertThat(provider).isInstanceOf(DisabledEmbeddingProvider.class);
        assertThat(((DisabledEmbeddingProvider) provider).reason()).contains("missing API key");
    }

    @Test
    void shouldUseProviderKeyAndDefaults() {
        ProvidersConfig providers = new ProvidersConfig(
            ProviderConfig.defaults(),
            new ProviderConfig("sk-openai", "", Map.of()),
            ProviderConfig.defaults()
        );

        EmbeddingProvider provider = EmbeddingProviders.create(new EmbeddingConfig("openai", "", 0, "", "", 30), providers);

        assertThat(provider).isInstanceOf(OpenAiCompatEmbeddingProvider.class);
        assertThat(provider.modelName()).isEqualTo("text-embedding-3-small");
        assertThat(provider.dimensions()).isEqualTo(1536);
    }

    @Test
    void shouldRequireBaseAndModelForGateway() {
        EmbeddingConfig config = new EmbeddingConfig("hosted_gateway", "", 0, "", "key", 30);

        assertThatThrownBy(() -> EmbeddingProviders.create(config, ProvidersConfig.defaults()))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("apiBase");
    }

    @Test
    void shouldRejectUnknownProvider() {
        assertThatThrownBy(() -> EmbeddingProviders.create(
            new EmbeddingConfig("cohere", "", 0, "", "", 30), ProvidersConfig.defaults()))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("cohere");
    }
}
