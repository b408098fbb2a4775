package io.mnemos.core.context;

import io.mnemos.core.graph.Node;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything retrieved for one turn. {@code projectContext} and {@code userContext} may be {@code null}.
 */
public record RetrievedContext(
    Map<String, Object> coreIdentity,
    List<Node> traits,
    List<RankedMemory> memories,
    List<Node> preferences,
    Map<String, Object> projectContext,
    Map<String, Object> userContext,
    Instant retrievedAt,
    String queryUsed,
    int memoriesConsidered,
    String strategy,
    ContextBudget budget
) {
    static final int MAX_TRAITS = 5;
    static final int MAX_MEMORIES = 3;
    static final int MAX_PREFERENCES = 5;
    static final int MEMORY_CHARS = 200;
    static final int PROJECT_CHARS = 200;

    public RetrievedContext {
        coreIdentity = coreIdentity == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(coreIdentity));
        traits = traits == null ? List.of() : List.copyOf(traits);
        memories = memories == null ? List.of() : List.copyOf(memories);
        preferences = preferences == null ? List.of() : List.copyOf(preferences);
        projectContext = projectContext == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(projectContext));
        userContext = userContext == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(userContext));
        budget = budget == null ? ContextBudget.defaults() : budget;
    }

    /**
     * Renders the persona system prompt. Sections with nothing to show are left out entirely.
     */
    public String toSystemPrompt() {
        List<String> sections = new ArrayList<>();
        String name = text(coreIdentity.get("name"), "Assistant");
        String tagline = text(coreIdentity.get("tagline"), "your helpful companion");
        sections.add("You are " + name + ", " + tagline + ".");

        String summary = text(coreIdentity.get("personality_summary"), "");
        if (!summary.isBlank()) {
            sections.add(summary);
        }

        List<String> values = strings(coreIdentity.get("core_values"));
        if (!values.isEmpty()) {
            sections.add("Core values: " + String.join(", ", values));
        }

        sections.add("Communication style: " + text(coreIdentity.get("communication_style"), "conversational"));

        if (!traits.isEmpty()) {
            StringBuilder block = new StringBuilder("Personality traits:");
            for (Node trait : traits.subList(0, Math.min(MAX_TRAITS, traits.size()))) {
                block.append("\n- ").append(trait.name()).append(": ").append(trait.string("description", ""));
            }
            sections.add(block.toString());
        }

        if (!memories.isEmpty()) {
            StringBuilder block = new StringBuilder("Relevant memories/observations:");
            for (RankedMemory memory : memories.subList(0, Math.min(MAX_MEMORIES, memories.size()))) {
                block.append("\n- ").append(truncate(memory.content(), MEMORY_CHARS));
            }
            sections.add(block.toString());
        }

        if (!preferences.isEmpty()) {
            StringBuilder block = new StringBuilder("User preferences:");
            for (Node preference : preferences.subList(0, Math.min(MAX_PREFERENCES, preferences.size()))) {
                block.append("\n- ").append(preference.name()).append(": ").append(preference.string("value", ""));
            }
            sections.add(block.toString());
        }

        if (userContext != null && !userContext.isEmpty()) {
            sections.add("You are assisting " + text(userContext.get("name"), "the user") + ".");
        }

        if (projectContext != null && !projectContext.isEmpty()) {
            String description = truncate(text(projectContext.get("description"), ""), PROJECT_CHARS);
            sections.add("Current project: " + text(projectContext.get("name"), "Unknown") + "\n" + description);
        }

        sections.add("\nRemember: You ARE " + name + ". Speak authentically as yourself.");
        return String.join("\n\n", sections);
    }

    public Map<String, Object> metadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("memories_retrieved", memories.size());
        metadata.put("memories_considered", memoriesConsidered);
        metadata.put("preferences_loaded", preferences.size());
        metadata.put("traits_loaded", traits.size());
        metadata.put("retrieval_timestamp", retrievedAt == null ? null : retrievedAt.toString());
        metadata.put("query_used", queryUsed);
        metadata.put("strategy", strategy);
        return metadata;
    }

    private static String text(Object value, String fallback) {
        if (value == null) {
            return fallback;
        }
        String text = String.valueOf(value);
        return text.isBlank() ? fallback : text;
    }

    private static List<String> strings(Object value) {
        if (!(value instanceof Collection<?> items)) {
            return value == null || String.valueOf(value).isBlank() ? List.of() : List.of(String.valueOf(value));
        }
        List<String> out = new ArrayList<>();
        for (Object item : items) {
            if (item != null && !String.valueOf(item).isBlank()) {
                out.add(String.valueOf(item));
            }
        }
        return out;
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
