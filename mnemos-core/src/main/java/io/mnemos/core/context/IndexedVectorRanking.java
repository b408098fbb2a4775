package io.mnemos.core.context;

import io.mnemos.core.graph.Direction;
import io.mnemos.core.graph.GraphStore;
import io.mnemos.core.graph.NodeType;
import io.mnemos.core.graph.OwnerScope;
import io.mnemos.core.graph.RelationType;
import io.mnemos.core.graph.ScoredNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Asks the store's vector index for the persona's closest memories. Misses when the store has no index for
 * memories or nothing clears the similarity threshold.
 */
public final class IndexedVectorRanking implements MemoryRankingStrategy {
    public static final String NAME = "vector_index";

    private final GraphStore store;

    public IndexedVectorRanking(GraphStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RankingOutcome rank(MemoryQuery query) throws IOException {
        if (!query.hasEmbedding() || !store.hasVectorIndex(NodeType.MEMORY)) {
            return RankingOutcome.miss(NAME);
        }
        List<ScoredNode> hits = store.vectorSearch(
            query.embedding(),
            NodeType.MEMORY,
            new OwnerScope(query.personaId(), RelationType.HAS_MEMORY),
            query.limit(),
            query.minScore()
        );
        if (hits.isEmpty()) {
            return RankingOutcome.miss(NAME);
        }
        List<RankedMemory> ranked = new ArrayList<>(hits.size());
        for (ScoredNode hit : hits) {
            ranked.add(new RankedMemory(hit.node(), hit.score()));
        }
        int total = store.countRelated(query.personaId(), RelationType.HAS_MEMORY, Direction.OUT, NodeType.MEMORY);
        return RankingOutcome.hit(NAME, ranked, total);
    }
}
