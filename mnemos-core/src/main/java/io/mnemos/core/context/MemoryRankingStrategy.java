package io.mnemos.core.context;

import java.io.IOException;

/**
 * One step of the memory fallback cascade. Implementations return a miss rather than throwing when they
 * simply have nothing to offer; exceptions are logged by the engine and treated as a miss.
 */
public interface MemoryRankingStrategy {

    String name();

    RankingOutcome rank(MemoryQuery query) throws IOException;
}
