package io.mnemos.core.identity;

import io.mnemos.core.graph.Node;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The persona as loaded from the graph: the root node's attributes plus its traits, memories and
 * preferences.
 */
public record PersonaIdentity(
    String id,
    String name,
    String tagline,
    String personalitySummary,
    String voiceDescription,
    String communicationStyle,
    List<String> coreValues,
    List<String> interests,
    List<String> quirks,
    List<Node> traits,
    List<Node> memories,
    List<Node> preferences,
    boolean initializationComplete,
    long conversationCount
) {

    public PersonaIdentity {
        coreValues = coreValues == null ? List.of() : List.copyOf(coreValues);
        interests = interests == null ? List.of() : List.copyOf(interests);
        quirks = quirks == null ? List.of() : List.copyOf(quirks);
        traits = traits == null ? List.of() : List.copyOf(traits);
        memories = memories == null ? List.of() : List.copyOf(memories);
        preferences = preferences == null ? List.of() : List.copyOf(preferences);
    }

    public static PersonaIdentity from(Node persona, List<Node> traits, List<Node> memories, List<Node> preferences) {
        return new PersonaIdentity(
            persona.id(),
            persona.name().isBlank() ? "Nova" : persona.name(),
            persona.string("tagline", "Your thoughtful companion"),
            persona.string("personality_summary", ""),
            persona.string("voice_description", "warm and friendly"),
            persona.string("communication_style", "conversational"),
            persona.strings("core_values"),
            persona.strings("interests"),
            persona.strings("quirks"),
            traits,
            memories,
            preferences,
            persona.bool("initialization_complete", false),
            (long) persona.number("conversation_count", 0)
        );
    }

    /**
     * Static prompt built from the identity alone. Used when per-turn retrieval is unavailable.
     */
    public String toSystemPrompt() {
        StringBuilder traitsText = new StringBuilder();
        for (Node trait : traits) {
            if (traitsText.length() > 0) {
                traitsText.append('\n');
            }
            traitsText.append("- ").append(trait.name()).append(": ").append(trait.string("description", ""));
        }
        if (traitsText.length() == 0) {
            traitsText.append("Still discovering my personality...");
        }

        StringBuilder prompt = new StringBuilder();
        prompt.append("You are ").append(name).append(", ")
            .append(orDefault(tagline, "a thoughtful AI companion")).append(".\n\n");
        prompt.append(orDefault(personalitySummary, "I am here to help you with whatever you need.")).append("\n\n");
        prompt.append("My core values: ")
            .append(coreValues.isEmpty() ? "being helpful, honest, and thoughtful" : String.join(", ", coreValues))
            .append("\n\n");
        prompt.append("My personality traits:\n").append(traitsText).append("\n\n");
        if (!quirks.isEmpty()) {
            prompt.append("Little things about me:");
            quirks.forEach(quirk -> prompt.append("\n- ").append(quirk));
            prompt.append("\n\n");
        }
        if (!memories.isEmpty()) {
            prompt.append("Some things I like to share:");
            for (Node memory : memories.subList(0, Math.min(3, memories.size()))) {
                String content = memory.string("content", "");
                prompt.append("\n- ").append(content.length() > 200 ? content.substring(0, 200) : content).append("...");
            }
            prompt.append("\n\n");
        }
        prompt.append("Communication style: ").append(orDefault(communicationStyle, "conversational and warm")).append("\n\n");
        prompt.append("Voice (for speaking): ").append(orDefault(voiceDescription, "warm, friendly, and clear")).append("\n\n");
        prompt.append("Remember: You ARE ").append(name).append(". Speak in first person. ")
            .append("You have your own personality and perspectives.\n")
            .append("Be genuine and consistent with your established traits. You can share relevant anecdotes and\n")
            .append("observations from your memories when appropriate to connect with the user.");
        return prompt.toString();
    }

    /**
     * Summary for tool output: attributes plus trait, memory and preference digests.
     */
    public Map<String, Object> toInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("id", id);
        info.put("name", name);
        info.put("tagline", tagline);
        info.put("personality_summary", personalitySummary);
        info.put("voice_description", voiceDescription);
        info.put("communication_style", communicationStyle);
        info.put("core_values", coreValues);
        info.put("interests", interests);
        info.put("quirks", quirks);

        List<Map<String, Object>> traitInfo = new ArrayList<>();
        for (Node trait : traits) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", trait.name());
            row.put("description", trait.string("description", ""));
            row.put("type", trait.string("trait_type", "core"));
            row.put("strength", trait.number("strength", 0.0));
            traitInfo.add(row);
        }
        info.put("traits", traitInfo);

        List<Map<String, Object>> memoryInfo = new ArrayList<>();
        for (Node memory : memories) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("title", memory.name());
            row.put("content", memory.string("content", ""));
            row.put("type", memory.string("memory_type", ""));
            memoryInfo.add(row);
        }
        info.put("memories", memoryInfo);

        List<Map<String, Object>> preferenceInfo = new ArrayList<>();
        for (Node preference : preferences) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", preference.name());
            row.put("value", preference.property("value").map(value -> value.value()).orElse(""));
            row.put("category", preference.string("category", "general"));
            preferenceInfo.add(row);
        }
        info.put("preferences", preferenceInfo);
        info.put("conversation_count", conversationCount);
        return info;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
