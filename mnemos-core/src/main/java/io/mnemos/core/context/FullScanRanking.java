package io.mnemos.core.context;

import io.mnemos.core.embedding.EmbeddingException;
import io.mnemos.core.embedding.EmbeddingProvider;
import io.mnemos.core.graph.Direction;
import io.mnemos.core.graph.GraphSearch;
import io.mnemos.core.graph.GraphStore;
import io.mnemos.core.graph.Node;
import io.mnemos.core.graph.NodeType;
import io.mnemos.core.graph.RelatedNode;
import io.mnemos.core.graph.RelationType;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads every memory of the persona and ranks by cosine similarity in process. Memories without a stored
 * embedding are embedded on demand and the vector is written back to the node. A memory that cannot be
 * embedded scores zero but stays in the candidate set.
 */
public final class FullScanRanking implements MemoryRankingStrategy {
    public static final String NAME = "full_scan";
    static final int MAX_MEMORIES = 10_000;

    private static final Logger LOG = LoggerFactory.getLogger(FullScanRanking.class);

    private final GraphStore store;
    private final EmbeddingProvider embeddings;

    public FullScanRanking(GraphStore store, EmbeddingProvider embeddings) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.embeddings = Objects.requireNonNull(embeddings, "embeddings must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RankingOutcome rank(MemoryQuery query) throws IOException {
        if (!query.hasEmbedding()) {
            return RankingOutcome.miss(NAME);
        }
        List<RelatedNode> related = store.getRelated(
            query.personaId(), RelationType.HAS_MEMORY, Direction.OUT, NodeType.MEMORY, MAX_MEMORIES
        );
        if (related.isEmpty()) {
            return RankingOutcome.hit(NAME, List.of(), 0);
        }

        List<RankedMemory> scored = new ArrayList<>(related.size());
        for (RelatedNode entry : related) {
            Node memory = entry.node();
            double[] vector = memory.embedding();
            if (vector == null) {
                vector = backfill(memory);
            }
            double score = vector == null ? 0.0 : GraphSearch.cosine(query.embedding(), vector);
            scored.add(new RankedMemory(memory, score));
        }
        scored.sort(Comparator.comparingDouble(RankedMemory::score).reversed());
        List<RankedMemory> top = scored.subList(0, Math.min(query.limit(), scored.size()));
        return RankingOutcome.hit(NAME, top, related.size());
    }

    private double[] backfill(Node memory) {
        double[] vector;
        try {
            vector = embeddings.embed(memory.string("content", memory.name()));
        } catch (EmbeddingException e) {
            LOG.warn("Could not embed memory {}: {}", memory.id(), e.getMessage());
            return null;
        }
        try {
            store.updateNode(memory.id(), Map.of(Node.EMBEDDING, vector));
        } catch (IOException e) {
            LOG.warn("Could not store embedding for memory {}: {}", memory.id(), e.getMessage());
        }
        return vector;
    }
}
