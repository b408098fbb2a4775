package io.mnemos.core.context;

import io.mnemos.core.graph.Direction;
import io.mnemos.core.graph.GraphStore;
import io.mnemos.core.graph.Node;
import io.mnemos.core.graph.NodeType;
import io.mnemos.core.graph.RelatedNode;
import io.mnemos.core.graph.RelationType;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Last resort: the most recently created memories, unranked. Always answers.
 */
public final class RecencyRanking implements MemoryRankingStrategy {
    public static final String NAME = "recency";

    private final GraphStore store;

    public RecencyRanking(GraphStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RankingOutcome rank(MemoryQuery query) throws IOException {
        List<RelatedNode> related = store.getRelated(
            query.personaId(), RelationType.HAS_MEMORY, Direction.OUT, NodeType.MEMORY, FullScanRanking.MAX_MEMORIES
        );
        List<Node> memories = new ArrayList<>(related.size());
        for (RelatedNode entry : related) {
            memories.add(entry.node());
        }
        memories.sort(Comparator.comparing((Node node) -> node.createdAt() == null ? Instant.EPOCH : node.createdAt())
            .reversed());

        List<RankedMemory> recent = new ArrayList<>();
        for (Node memory : memories.subList(0, Math.min(query.limit(), memories.size()))) {
            recent.add(new RankedMemory(memory, 0.0));
        }
        return RankingOutcome.hit(NAME, recent, 0);
    }
}
