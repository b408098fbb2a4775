package io.mnemos.core.context;

import io.mnemos.core.config.model.RetrievalConfig;
import io.mnemos.core.embedding.EmbeddingException;
import io.mnemos.core.embedding.EmbeddingProvider;
import io.mnemos.core.graph.Direction;
import io.mnemos.core.graph.GraphStore;
import io.mnemos.core.graph.Node;
import io.mnemos.core.graph.NodeType;
import io.mnemos.core.graph.RelatedNode;
import io.mnemos.core.graph.RelationType;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles the persona's context for one turn: identity, traits, ranked memories, preferences and
 * optional user and project context.
 *
 * <p>Memories are ranked by walking {@link #strategies()} in order until one reports success. A blank query
 * skips straight to the last strategy. The persona node is cached after the first load; writers that change
 * the identity call {@link #invalidate()}.
 */
public final class ContextRetrievalEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ContextRetrievalEngine.class);
    private static final int MAX_TRAITS = 10;
    private static final int MAX_PREFERENCES = 10;
    private static final int SCAN_LIMIT = 500;
    private static final int QUERY_ECHO_CHARS = 100;

    private final GraphStore store;
    private final EmbeddingProvider embeddings;
    private final List<MemoryRankingStrategy> strategies;
    private final RetrievalConfig config;
    private final Clock clock;
    private volatile Node cachedPersona;

    public ContextRetrievalEngine(GraphStore store, EmbeddingProvider embeddings, RetrievalConfig config, Clock clock) {
        this(
            store,
            embeddings,
            List.of(new IndexedVectorRanking(store), new FullScanRanking(store, embeddings), new RecencyRanking(store)),
            config,
            clock
        );
    }

    public ContextRetrievalEngine(
        GraphStore store,
        EmbeddingProvider embeddings,
        List<MemoryRankingStrategy> strategies,
        RetrievalConfig config,
        Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.embeddings = Objects.requireNonNull(embeddings, "embeddings must not be null");
        this.strategies = List.copyOf(Objects.requireNonNull(strategies, "strategies must not be null"));
        if (this.strategies.isEmpty()) {
            throw new IllegalArgumentException("at least one ranking strategy is required");
        }
        this.config = config == null ? RetrievalConfig.defaults() : config;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public List<MemoryRankingStrategy> strategies() {
        return strategies;
    }

    public RetrievedContext retrieve(String query) throws IOException {
        return retrieve(query, null, config.preferenceCategories(), ContextBudget.from(config.budget()), config.memoryLimit());
    }

    public RetrievedContext retrieve(String query, Map<String, Object> projectContext) throws IOException {
        return retrieve(
            query,
            projectContext,
            config.preferenceCategories(),
            ContextBudget.from(config.budget()),
            config.memoryLimit()
        );
    }

    /**
     * Store failures while loading the identity propagate; failures inside memory ranking degrade to the
     * next strategy.
     */
    public RetrievedContext retrieve(
        String query,
        Map<String, Object> projectContext,
        List<String> preferenceCategories,
        ContextBudget budget,
        int memoryLimit
    ) throws IOException {
        String text = query == null ? "" : query;
        Optional<Node> persona = persona();

        List<Node> traits = List.of();
        List<Node> preferences = List.of();
        RankingOutcome ranking = RankingOutcome.hit("none", List.of(), 0);
        if (persona.isPresent()) {
            String personaId = persona.get().id();
            traits = traits(personaId);
            ranking = rankMemories(personaId, text, Math.max(1, memoryLimit));
            preferences = preferences(personaId, preferenceCategories);
        }

        return new RetrievedContext(
            persona.map(Node::toMap).orElse(Map.of()),
            traits,
            ranking.memories(),
            preferences,
            projectContext,
            userContext(),
            clock.instant(),
            text.isBlank() ? null : truncate(text, QUERY_ECHO_CHARS),
            ranking.considered(),
            ranking.strategy(),
            budget
        );
    }

    /**
     * Drops the cached identity so the next retrieval reloads it.
     */
    public void invalidate() {
        cachedPersona = null;
    }

    Optional<Node> persona() throws IOException {
        Node cached = cachedPersona;
        if (cached != null) {
            return Optional.of(cached);
        }
        List<Node> found = store.findNodes(NodeType.PERSONA, Map.of(), 1);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        cachedPersona = found.get(0);
        return Optional.of(found.get(0));
    }

    private RankingOutcome rankMemories(String personaId, String text, int limit) {
        double[] embedding = null;
        List<MemoryRankingStrategy> cascade = strategies;
        if (text.isBlank()) {
            cascade = List.of(strategies.get(strategies.size() - 1));
        } else {
            try {
                embedding = embeddings.embed(text);
            } catch (EmbeddingException e) {
                LOG.warn("Query embedding failed, falling back to recent memories: {}", e.getMessage());
            }
        }

        MemoryQuery memoryQuery = new MemoryQuery(personaId, text, embedding, limit, config.minSimilarity());
        for (MemoryRankingStrategy strategy : cascade) {
            try {
                RankingOutcome outcome = strategy.rank(memoryQuery);
                if (outcome.ok()) {
                    return outcome;
                }
                LOG.debug("Memory strategy {} had no result, trying next", strategy.name());
            } catch (IOException | RuntimeException e) {
                LOG.debug("Memory strategy {} failed, trying next", strategy.name(), e);
            }
        }
        LOG.warn("No memory strategy produced a result for persona {}", personaId);
        return RankingOutcome.hit("none", List.of(), 0);
    }

    private List<Node> traits(String personaId) throws IOException {
        List<Node> traits = nodes(store.getRelated(personaId, RelationType.HAS_TRAIT, Direction.OUT, NodeType.TRAIT, SCAN_LIMIT));
        traits.sort(Comparator.comparingDouble((Node trait) -> trait.number("strength", 0.0)).reversed());
        return traits.subList(0, Math.min(MAX_TRAITS, traits.size()));
    }

    private List<Node> preferences(String personaId, List<String> categories) throws IOException {
        Set<String> wanted = Set.copyOf(categories == null || categories.isEmpty()
            ? config.preferenceCategories()
            : categories);
        List<Node> preferences = new ArrayList<>();
        for (Node preference : nodes(store.getRelated(
            personaId, RelationType.LEARNED_PREFERENCE, Direction.OUT, NodeType.PREFERENCE, SCAN_LIMIT))) {
            if (wanted.contains(preference.string("category", "general"))) {
                preferences.add(preference);
            }
        }
        preferences.sort(Comparator.comparingDouble((Node preference) -> preference.number("confidence", 0.0)).reversed());
        return preferences.subList(0, Math.min(MAX_PREFERENCES, preferences.size()));
    }

    private Map<String, Object> userContext() throws IOException {
        List<Node> users = store.findNodes(NodeType.USER, Map.of(), 1);
        return users.isEmpty() ? null : users.get(0).toMap();
    }

    private static List<Node> nodes(List<RelatedNode> related) {
        List<Node> nodes = new ArrayList<>(related.size());
        for (RelatedNode entry : related) {
            nodes.add(entry.node());
        }
        return nodes;
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
