package io.mnemos.core.identity;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Changes proposed by a self-reflection cycle.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PersonaUpdates(
    @JsonAlias({"new_traits"}) List<IdentitySeed.TraitSeed> newTraits,
    @JsonAlias({"trait_updates"}) List<TraitUpdate> traitUpdates,
    @JsonAlias({"new_quirks"}) List<String> newQuirks,
    @JsonAlias({"new_memories"}) List<IdentitySeed.MemorySeed> newMemories,
    @JsonAlias({"preferences_learned"}) List<LearnedPreference> preferencesLearned,
    String reflections,
    @JsonAlias({"style_adjustments"}) String styleAdjustments
) {

    public PersonaUpdates {
        newTraits = newTraits == null ? List.of() : List.copyOf(newTraits);
        traitUpdates = traitUpdates == null ? List.of() : List.copyOf(traitUpdates);
        newQuirks = newQuirks == null ? List.of() : List.copyOf(newQuirks);
        newMemories = newMemories == null ? List.of() : List.copyOf(newMemories);
        preferencesLearned = preferencesLearned == null ? List.of() : List.copyOf(preferencesLearned);
    }

    public static PersonaUpdates empty() {
        return new PersonaUpdates(null, null, null, null, null, null, null);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TraitUpdate(String name, @JsonAlias({"strength_change"}) double strengthChange) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LearnedPreference(String name, Object value, String category, Double confidence) {
    }
}
