package io.mnemos.core.context;

import io.mnemos.core.config.model.RetrievalConfig;

/**
 * Target character counts per prompt section. The renderer approximates them with fixed per-field caps
 * rather than truncating the assembled prompt.
 */
public record ContextBudget(int identity, int traits, int memories, int preferences, int project, int user) {

    public ContextBudget {
        if (identity < 0 || traits < 0 || memories < 0 || preferences < 0 || project < 0 || user < 0) {
            throw new IllegalArgumentException("budget sizes must not be negative");
        }
    }

    public static ContextBudget defaults() {
        return new ContextBudget(500, 300, 800, 300, 500, 300);
    }

    public static ContextBudget from(RetrievalConfig.BudgetConfig config) {
        if (config == null) {
            return defaults();
        }
        return new ContextBudget(
            config.identity(),
            config.traits(),
            config.memories(),
            config.preferences(),
            config.project(),
            config.user()
        );
    }

    public int total() {
        return identity + traits + memories + preferences + project + user;
    }
}
