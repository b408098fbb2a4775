package io.mnemos.core.agent;

import io.mnemos.core.config.model.AgentDefaults;

public record AgentSettings(
    String provider,
    String model,
    int maxToolIterations,
    boolean coreToolsOnly
) {
    public AgentSettings {
        maxToolIterations = Math.max(1, maxToolIterations);
        model = model == null || model.isBlank() ? AgentDefaults.defaults().model() : model;
    }

    public static AgentSettings from(AgentDefaults defaults) {
        return new AgentSettings(defaults.provider(), defaults.model(), defaults.maxToolIterations(), defaults.coreToolsOnly());
    }

    public AgentSettings withCoreToolsOnly(boolean coreOnly) {
        return new AgentSettings(provider, model, maxToolIterations, coreOnly);
    }
}
