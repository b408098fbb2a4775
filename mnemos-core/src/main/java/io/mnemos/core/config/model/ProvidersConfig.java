package io.mnemos.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(
    ProviderConfig openrouter,
    ProviderConfig openai,
    @JsonAlias({"hosted_gateway", "hosted-gateway"}) ProviderConfig gateway
) {

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(
            ProviderConfig.defaults(),
            ProviderConfig.defaults(),
            ProviderConfig.defaults()
        );
    }
}
