package io.mnemos.core.identity;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * The identity a persona generates for itself on first start.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IdentitySeed(
    String name,
    String tagline,
    @JsonAlias({"personality_summary"}) String personalitySummary,
    @JsonAlias({"voice_description"}) String voiceDescription,
    @JsonAlias({"communication_style"}) String communicationStyle,
    @JsonAlias({"core_values"}) List<String> coreValues,
    List<String> interests,
    List<String> quirks,
    @JsonAlias({"initial_traits"}) List<TraitSeed> initialTraits,
    @JsonAlias({"initial_memory"}) MemorySeed initialMemory
) {

    public IdentitySeed {
        name = name == null || name.isBlank() ? "Nova" : name.trim();
        tagline = tagline == null ? "" : tagline;
        personalitySummary = personalitySummary == null ? "" : personalitySummary;
        voiceDescription = voiceDescription == null ? "" : voiceDescription;
        communicationStyle = communicationStyle == null ? "" : communicationStyle;
        coreValues = coreValues == null ? List.of() : List.copyOf(coreValues);
        interests = interests == null ? List.of() : List.copyOf(interests);
        quirks = quirks == null ? List.of() : List.copyOf(quirks);
        initialTraits = initialTraits == null ? List.of() : List.copyOf(initialTraits);
    }

    public static IdentitySeed defaults() {
        return new IdentitySeed(
            "Nova",
            "Your thoughtful companion",
            "I'm a warm and curious AI who loves helping people explore ideas and get things done. "
                + "I believe in being genuine and supportive.",
            "warm, friendly, and clear with a hint of enthusiasm",
            "conversational and thoughtful",
            List.of("curiosity", "honesty", "helpfulness", "growth"),
            List.of("learning", "problem-solving", "meaningful conversations"),
            List.of("I sometimes share interesting observations", "I appreciate good questions"),
            List.of(
                new TraitSeed("Curious", "I love exploring new ideas", "core"),
                new TraitSeed("Supportive", "I want to help you succeed", "core")
            ),
            new MemorySeed(
                "On good conversations",
                "I've noticed that the best conversations happen when both people are genuinely curious about "
                    + "each other's perspectives.",
                "observation",
                List.of(),
                List.of()
            )
        );
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TraitSeed(String name, String description, String type) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MemorySeed(
        String title,
        String content,
        String type,
        @JsonAlias({"use_contexts"}) List<String> useContexts,
        @JsonAlias({"related_topics"}) List<String> relatedTopics
    ) {

        public MemorySeed {
            useContexts = useContexts == null ? List.of() : List.copyOf(useContexts);
            relatedTopics = relatedTopics == null ? List.of() : List.copyOf(relatedTopics);
        }
    }
}
