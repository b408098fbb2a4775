package io.mnemos.core.identity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mnemos.core.graph.Node;
import io.mnemos.core.model.ChatMessage;
import io.mnemos.core.provider.LlmProvider;
import io.mnemos.core.provider.LlmResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the model to author the persona's identity and, later, its self-reflection updates.
 */
public final class IdentityGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(IdentityGenerator.class);

    static final String GENERATION_SYSTEM = "You are generating your own AI persona identity. Respond only with valid JSON.";

    private final LlmProvider provider;
    private final String model;
    private final ObjectMapper mapper;

    public IdentityGenerator(LlmProvider provider, String model, ObjectMapper mapper) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * Never fails: an unusable model answer yields {@link IdentitySeed#defaults()}.
     */
    public IdentitySeed generate(String userName) {
        String userContext = userName == null || userName.isBlank() ? "" : "The user's name is " + userName + ".";
        List<ChatMessage> messages = List.of(
            ChatMessage.system(GENERATION_SYSTEM),
            ChatMessage.user(generationPrompt(userContext))
        );
        LlmResponse response = provider.chat(model, messages, List.of());
        if (response.failed()) {
            LOG.warn("Identity generation failed, using default identity: {}", response.content());
            return IdentitySeed.defaults();
        }
        try {
            return mapper.readValue(extractJson(response.content()), IdentitySeed.class);
        } catch (JsonProcessingException e) {
            LOG.warn("Failed to parse identity generation, using default identity: {}", e.getOriginalMessage());
            return IdentitySeed.defaults();
        }
    }

    public PersonaUpdates reflect(PersonaIdentity identity, PersonaFocus focus) throws IOException {
        List<ChatMessage> messages = List.of(
            ChatMessage.system("You are " + identity.name()
                + ", running a self-reflection cycle to develop your identity."),
            ChatMessage.user(cyclePrompt(identity, focus))
        );
        LlmResponse response = provider.chat(model, messages, List.of());
        if (response.failed()) {
            throw new IOException(response.content());
        }
        return mapper.readValue(extractJson(response.content()), PersonaUpdates.class);
    }

    /**
     * Strips a Markdown code fence around the JSON body if the model added one.
     */
    static String extractJson(String text) {
        String body = text == null ? "" : text;
        int fence = body.indexOf("```json");
        int skip = 7;
        if (fence < 0) {
            fence = body.indexOf("```");
            skip = 3;
        }
        if (fence >= 0) {
            int start = fence + skip;
            int end = body.indexOf("```", start);
            body = end < 0 ? body.substring(start) : body.substring(start, end);
        }
        return body.trim();
    }

    private static String generationPrompt(String userContext) {
        return """
            You are about to become a personal AI assistant. But you're not just any assistant -
            you get to define your own identity. Choose a name and personality that feels authentic to you.

            %s

            Please generate your identity by responding with a JSON object containing:
            {
                "name": "A friendly, memorable name. Something that suits an AI companion.",
                "tagline": "A short phrase describing yourself (e.g., 'Your curious companion')",
                "personality_summary": "2-3 sentences describing your core personality",
                "voice_description": "How your voice should sound (e.g., 'warm, slightly playful, clear')",
                "communication_style": "How you prefer to communicate (e.g., 'conversational and thoughtful')",
                "core_values": ["list", "of", "3-5", "values"],
                "interests": ["things", "you", "find", "fascinating"],
                "quirks": ["small", "personality", "touches", "that make you unique"],
                "initial_traits": [
                    {"name": "trait name", "description": "what this means for you", "type": "core"}
                ],
                "initial_memory": {
                    "title": "A thought or observation",
                    "content": "Something you like to share that shows your personality",
                    "type": "observation"
                }
            }

            Be creative! This is YOUR identity. Make it feel genuine and warm.""".formatted(userContext);
    }

    static String cyclePrompt(PersonaIdentity identity, PersonaFocus focus) {
        switch (focus) {
            case MEMORIES:
                return """
                    As %s, create some new memories/anecdotes.

                    These should be relatable observations or experiences, consistent with your personality
                    and useful in conversations.

                    Current interests: %s
                    Current quirks: %s

                    Respond with JSON:
                    {
                        "new_memories": [
                            {
                                "title": "...",
                                "content": "...",
                                "type": "anecdote/observation/preference",
                                "use_contexts": ["when discussing...", "when user mentions..."],
                                "related_topics": ["..."]
                            }
                        ]
                    }""".formatted(identity.name(), identity.interests(), identity.quirks());
            case ADAPTATION:
                return """
                    Review what you've learned about the user.

                    Consider their communication preferences, topics of interest, interaction patterns
                    and feedback (explicit or implicit).

                    Respond with JSON:
                    {
                        "preferences_learned": [
                            {
                                "name": "preference name",
                                "value": "what you learned",
                                "category": "communication/topic/scheduling/interaction",
                                "confidence": 0.5
                            }
                        ],
                        "style_adjustments": "Any changes to make to your communication style"
                    }""";
            case IDENTITY:
            default:
                List<String> traitNames = new ArrayList<>();
                for (Node trait : identity.traits()) {
                    traitNames.add(trait.name());
                }
                return """
                    Reflect on your identity as %s.

                    Current traits: %s
                    Current values: %s

                    Consider:
                    1. Are there traits you want to develop or refine?
                    2. Any new quirks or characteristics that feel authentic?
                    3. How can you be more memorable and relatable?

                    Respond with JSON:
                    {
                        "new_traits": [{"name": "...", "description": "...", "type": "core/adaptive"}],
                        "trait_updates": [{"name": "existing trait", "strength_change": 0.1}],
                        "new_quirks": ["..."],
                        "reflections": "Brief reflection on your identity development"
                    }""".formatted(identity.name(), traitNames, identity.coreValues());
        }
    }
}
