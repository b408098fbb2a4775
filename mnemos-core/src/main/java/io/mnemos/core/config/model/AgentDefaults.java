package io.mnemos.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentDefaults(
    String provider,
    String model,
    @JsonAlias({"max_tokens"}) int maxTokens,
    double temperature,
    @JsonAlias({"max_tool_iterations"}) int maxToolIterations,
    @JsonAlias({"core_tools_only"}) boolean coreToolsOnly
) {

    public static AgentDefaults defaults() {
        return new AgentDefaults(
            "openrouter",
            "anthropic/claude-sonnet-4.5",
            8192,
            0.7,
            10,
            false
        );
    }
}
