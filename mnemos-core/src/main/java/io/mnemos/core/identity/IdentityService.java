package io.mnemos.core.identity;

import io.mnemos.core.cognitive.Nodes;
import io.mnemos.core.embedding.EmbeddingException;
import io.mnemos.core.embedding.EmbeddingProvider;
import io.mnemos.core.graph.Direction;
import io.mnemos.core.graph.GraphStore;
import io.mnemos.core.graph.Node;
import io.mnemos.core.graph.NodeType;
import io.mnemos.core.graph.RelatedNode;
import io.mnemos.core.graph.RelationType;
import io.mnemos.core.graph.UpsertResult;
import io.mnemos.core.graph.ValidationException;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the persona aggregate: the Persona root with its traits, memories and learned preferences.
 * Every mutation drops the cached identity here and calls {@code onIdentityChanged} so cached retrieval
 * state is dropped too.
 */
public final class IdentityService {
    private static final Logger LOG = LoggerFactory.getLogger(IdentityService.class);

    static final double INITIAL_TRAIT_STRENGTH = 0.8;
    static final double LEARNED_TRAIT_STRENGTH = 0.6;
    private static final int RELATED_LIMIT = 100;

    private final GraphStore store;
    private final IdentityGenerator generator;
    private final EmbeddingProvider embeddings;
    private final Runnable onIdentityChanged;
    private final Clock clock;
    private volatile PersonaIdentity current;

    public IdentityService(
        GraphStore store,
        IdentityGenerator generator,
        EmbeddingProvider embeddings,
        Runnable onIdentityChanged,
        Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.embeddings = Objects.requireNonNull(embeddings, "embeddings must not be null");
        this.onIdentityChanged = onIdentityChanged == null ? () -> { } : onIdentityChanged;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Loads the persona, generating and persisting one on first start.
     */
    public synchronized PersonaIdentity initialize(String userId) throws IOException {
        Optional<PersonaIdentity> existing = load();
        if (existing.isPresent()) {
            return existing.get();
        }
        String userName = null;
        if (userId != null) {
            userName = store.getNode(userId).map(Node::name).orElse(null);
        }
        IdentitySeed seed = generator.generate(userName);
        PersonaIdentity created = persist(seed, userId);
        LOG.info("Created persona '{}'", created.name());
        changed();
        return created;
    }

    public Optional<PersonaIdentity> load() throws IOException {
        List<Node> personas = store.findNodes(NodeType.PERSONA, Map.of(), 1);
        if (personas.isEmpty()) {
            current = null;
            return Optional.empty();
        }
        Node persona = personas.get(0);
        PersonaIdentity identity = PersonaIdentity.from(
            persona,
            related(persona.id(), RelationType.HAS_TRAIT, NodeType.TRAIT),
            related(persona.id(), RelationType.HAS_MEMORY, NodeType.MEMORY),
            related(persona.id(), RelationType.LEARNED_PREFERENCE, NodeType.PREFERENCE)
        );
        current = identity;
        return Optional.of(identity);
    }

    /**
     * The last loaded identity, loading it if nothing is cached yet.
     */
    public Optional<PersonaIdentity> current() throws IOException {
        PersonaIdentity cached = current;
        return cached != null ? Optional.of(cached) : load();
    }

    public boolean recordConversation() throws IOException {
        Optional<PersonaIdentity> identity = current();
        if (identity.isEmpty()) {
            return false;
        }
        boolean counted = store.incrementProperty(identity.get().id(), "conversation_count", 1);
        current = null;
        return counted;
    }

    /**
     * Creates the preference on first observation and bumps {@code observation_count} on each re-observation.
     */
    public Node upsertPreference(String name, Object value, String category, double confidence) throws IOException {
        String personaId = requirePersona().id();
        Node candidate = Nodes.preference(name, value, category, confidence);

        Map<String, Object> observed = new LinkedHashMap<>();
        observed.put("value", value);
        observed.put("confidence", confidence);
        UpsertResult result = store.createOrMatch(NodeType.PREFERENCE, "name", candidate.name(), candidate.name(), observed);
        String id = result.node().id();
        if (result.created()) {
            store.updateNode(id, candidate.plainProperties());
            store.createRelationship(personaId, id, RelationType.LEARNED_PREFERENCE);
        } else {
            store.incrementProperty(id, "observation_count", 1);
            if (!linked(personaId, id, RelationType.LEARNED_PREFERENCE)) {
                store.createRelationship(personaId, id, RelationType.LEARNED_PREFERENCE);
            }
        }
        changed();
        return store.getNode(id).orElse(result.node());
    }

    public Node addTrait(String name, String description, String traitType, double strength) throws IOException {
        String personaId = requirePersona().id();
        Node trait = Nodes.trait(name, description, traitType, strength);
        String id = store.createNode(trait);
        store.createRelationship(personaId, id, RelationType.HAS_TRAIT);
        changed();
        return store.getNode(id).orElse(trait);
    }

    /**
     * Stores a memory with its embedding. An embedding failure stores the memory without a vector; retrieval
     * backfills it later.
     */
    public Node addMemory(String title, String content, String memoryType, List<String> useContexts,
        List<String> relatedTopics) throws IOException {
        String personaId = requirePersona().id();
        String id = storeMemory(personaId, title, content, memoryType, useContexts, relatedTopics);
        changed();
        return store.getNode(id).orElseThrow();
    }

    public PersonaCycleResult runPersonaCycle(PersonaFocus focus) throws IOException {
        PersonaIdentity identity = current().orElse(null);
        if (identity == null) {
            identity = initialize(null);
        }
        PersonaUpdates updates;
        try {
            updates = generator.reflect(identity, focus);
        } catch (IOException e) {
            LOG.warn("Persona cycle '{}' failed: {}", focus.value(), e.getMessage());
            return PersonaCycleResult.failed(focus, e.getMessage());
        }
        applyUpdates(updates);
        return PersonaCycleResult.completed(focus, updates);
    }

    public synchronized void applyUpdates(PersonaUpdates updates) throws IOException {
        PersonaIdentity identity = load().orElseThrow(() -> new ValidationException("Persona not initialized"));
        String personaId = identity.id();

        for (IdentitySeed.TraitSeed seed : updates.newTraits()) {
            if (seed.name() == null || seed.name().isBlank()) {
                continue;
            }
            String type = seed.type() == null || seed.type().isBlank() ? "adaptive" : seed.type();
            String id = store.createNode(Nodes.trait(seed.name(), seed.description(), type, LEARNED_TRAIT_STRENGTH));
            store.createRelationship(personaId, id, RelationType.HAS_TRAIT);
        }

        for (PersonaUpdates.TraitUpdate update : updates.traitUpdates()) {
            for (Node trait : related(personaId, RelationType.HAS_TRAIT, NodeType.TRAIT)) {
                if (trait.name().equalsIgnoreCase(String.valueOf(update.name()))) {
                    double strength = clamp(trait.number("strength", 0.5) + update.strengthChange());
                    store.updateNode(trait.id(), Map.of("strength", strength));
                }
            }
        }

        for (IdentitySeed.MemorySeed memory : updates.newMemories()) {
            if (memory.content() == null || memory.content().isBlank()) {
                continue;
            }
            storeMemory(personaId, memory.title(), memory.content(),
                memory.type() == null ? "observation" : memory.type(), memory.useContexts(), memory.relatedTopics());
        }

        for (PersonaUpdates.LearnedPreference preference : updates.preferencesLearned()) {
            if (preference.name() == null || preference.name().isBlank() || preference.value() == null) {
                continue;
            }
            double confidence = preference.confidence() == null ? 0.5 : clamp(preference.confidence());
            upsertPreference(preference.name(), preference.value(), preference.category(), confidence);
        }

        Map<String, Object> personaChanges = new LinkedHashMap<>();
        if (!updates.newQuirks().isEmpty()) {
            List<String> quirks = new ArrayList<>(identity.quirks());
            quirks.addAll(updates.newQuirks());
            personaChanges.put("quirks", quirks);
        }
        personaChanges.put("last_persona_cycle", clock.instant().toString());
        store.updateNode(personaId, personaChanges);

        changed();
        load();
    }

    private void changed() {
        current = null;
        onIdentityChanged.run();
    }

    public Map<String, Object> personaInfo() throws IOException {
        Optional<PersonaIdentity> identity = load();
        if (identity.isEmpty()) {
            return Map.of("error", "Persona not initialized");
        }
        return identity.get().toInfo();
    }

    private PersonaIdentity persist(IdentitySeed seed, String userId) throws IOException {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("tagline", seed.tagline());
        attributes.put("personality_summary", seed.personalitySummary());
        attributes.put("voice_description", seed.voiceDescription());
        attributes.put("communication_style", seed.communicationStyle());
        attributes.put("core_values", seed.coreValues());
        attributes.put("interests", seed.interests());
        attributes.put("quirks", seed.quirks());
        attributes.put("initialization_complete", true);
        attributes.put("conversation_count", 0);
        String personaId = store.createNode(Nodes.persona(seed.name(), attributes));

        for (IdentitySeed.TraitSeed trait : seed.initialTraits()) {
            if (trait.name() == null || trait.name().isBlank()) {
                continue;
            }
            String id = store.createNode(Nodes.trait(trait.name(), trait.description(), trait.type(), INITIAL_TRAIT_STRENGTH));
            store.createRelationship(personaId, id, RelationType.HAS_TRAIT);
        }
        IdentitySeed.MemorySeed memory = seed.initialMemory();
        if (memory != null && memory.content() != null && !memory.content().isBlank()) {
            storeMemory(personaId, memory.title(), memory.content(),
                memory.type() == null ? "observation" : memory.type(), memory.useContexts(), memory.relatedTopics());
        }
        if (userId != null && store.getNode(userId).isPresent()) {
            store.createRelationship(personaId, userId, RelationType.ADAPTED_FOR);
        }
        return load().orElseThrow(() -> new IOException("Persona was not readable after creation"));
    }

    private String storeMemory(String personaId, String title, String content, String memoryType,
        List<String> useContexts, List<String> relatedTopics) throws IOException {
        double[] vector = null;
        try {
            vector = embeddings.embed(content);
        } catch (EmbeddingException e) {
            LOG.warn("Storing memory '{}' without embedding: {}", title, e.getMessage());
        }
        Node memory = Nodes.memory(title, content, memoryType, vector);
        Map<String, Object> properties = new LinkedHashMap<>(memory.plainProperties());
        properties.put("use_contexts", useContexts == null ? List.of() : useContexts);
        properties.put("related_topics", relatedTopics == null ? List.of() : relatedTopics);
        String id = store.createNode(NodeType.MEMORY, memory.name(), properties);
        store.createRelationship(personaId, id, RelationType.HAS_MEMORY);
        return id;
    }

    private PersonaIdentity requirePersona() throws IOException {
        return current().orElseThrow(() -> new ValidationException("Persona not initialized"));
    }

    private boolean linked(String fromId, String toId, RelationType type) throws IOException {
        for (RelatedNode related : store.getRelated(fromId, type, Direction.OUT, null, RELATED_LIMIT)) {
            if (related.node().id().equals(toId)) {
                return true;
            }
        }
        return false;
    }

    private List<Node> related(String personaId, RelationType type, NodeType targetType) throws IOException {
        List<Node> nodes = new ArrayList<>();
        for (RelatedNode related : store.getRelated(personaId, type, Direction.OUT, targetType, RELATED_LIMIT)) {
            nodes.add(related.node());
        }
        return nodes;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
