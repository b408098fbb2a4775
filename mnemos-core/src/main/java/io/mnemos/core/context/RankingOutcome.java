package io.mnemos.core.context;

import java.util.List;

/**
 * Result of one ranking strategy. A strategy that cannot answer reports {@code ok == false} and the engine
 * moves on to the next one.
 */
public record RankingOutcome(String strategy, boolean ok, List<RankedMemory> memories, int considered) {

    public RankingOutcome {
        memories = memories == null ? List.of() : List.copyOf(memories);
    }

    public static RankingOutcome hit(String strategy, List<RankedMemory> memories, int considered) {
        return new RankingOutcome(strategy, true, memories, considered);
    }

    public static RankingOutcome miss(String strategy) {
        return new RankingOutcome(strategy, false, List.of(), 0);
    }
}
