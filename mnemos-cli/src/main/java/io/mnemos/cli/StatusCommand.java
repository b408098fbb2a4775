package io.mnemos.cli;

import io.mnemos.core.capability.RegistryStats;
import io.mnemos.core.config.model.MnemosConfig;
import io.mnemos.core.embedding.EmbeddingProvider;
import io.mnemos.core.graph.GraphStats;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show runtime, graph and configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MnemosConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Default provider: " + config.agents().defaults().provider());
            System.out.println("Default model: " + config.agents().defaults().model());
            System.out.println("OpenRouter configured: " + config.providers().openrouter().configured());
            System.out.println("OpenAI configured: " + config.providers().openai().configured());
            System.out.println("Gateway configured: " + config.providers().gateway().configured());
            System.out.println("Graph store: " + config.graph().uri());

            EmbeddingProvider embeddings = context.embeddings();
            System.out.println("Embeddings: " + embeddings.name() + " (" + embeddings.modelName() + ", "
                + embeddings.dimensions() + " dims)");

            GraphStats stats = context.graph().store().stats();
            System.out.println("Graph nodes: " + stats.totalNodes() + ", relationships: " + stats.relationships());
            stats.nodesByType().forEach((label, count) -> System.out.println("  " + label + ": " + count));

            RegistryStats tools = context.registry().stats();
            System.out.println("Capabilities: " + context.registry().root());
            System.out.println("Tools: " + tools.total() + " (" + tools.enabled() + " enabled, "
                + tools.disabled() + " disabled)");
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
