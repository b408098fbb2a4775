package io.mnemos.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RetrievalConfig(
    @JsonAlias({"memory_limit"}) int memoryLimit,
    @JsonAlias({"min_similarity"}) double minSimilarity,
    @JsonAlias({"preference_categories"}) List<String> preferenceCategories,
    BudgetConfig budget
) {

    public RetrievalConfig {
        preferenceCategories = preferenceCategories == null ? List.of() : List.copyOf(preferenceCategories);
    }

    public static RetrievalConfig defaults() {
        return new RetrievalConfig(5, 0.5, List.of("communication", "general", "topic"), BudgetConfig.defaults());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BudgetConfig(
        int identity,
        int traits,
        int memories,
        int preferences,
        int project,
        int user
    ) {

        public static BudgetConfig defaults() {
            return new BudgetConfig(500, 300, 800, 300, 500, 300);
        }
    }
}
