package io.mnemos.cli;

import io.mnemos.core.agent.AgentRuntime;
import io.mnemos.core.capability.CapabilityRegistry;
import io.mnemos.core.cognitive.CognitiveGraph;
import io.mnemos.core.cognitive.DocumentIngestor;
import io.mnemos.core.config.ConfigService;
import io.mnemos.core.embedding.EmbeddingProvider;
import io.mnemos.core.identity.IdentityService;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    AgentRuntime runtime,
    CognitiveGraph graph,
    IdentityService identity,
    CapabilityRegistry registry,
    DocumentIngestor ingestor,
    EmbeddingProvider embeddings
) {
}
