package io.mnemos.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mnemos.cli.ChatCommand;
import io.mnemos.cli.CliContext;
import io.mnemos.cli.IngestCommand;
import io.mnemos.cli.InitCommand;
import io.mnemos.cli.MnemosCliCommand;
import io.mnemos.cli.OnboardCommand;
import io.mnemos.cli.PersonaCommand;
import io.mnemos.cli.SearchCommand;
import io.mnemos.cli.StatusCommand;
import io.mnemos.cli.ToolsCommand;
import io.mnemos.core.agent.AgentRuntime;
import io.mnemos.core.capability.CapabilityRegistry;
import io.mnemos.core.cognitive.CognitiveGraph;
import io.mnemos.core.cognitive.DocumentIngestor;
import io.mnemos.core.config.CapabilityBootstrap;
import io.mnemos.core.config.ConfigPaths;
import io.mnemos.core.config.ConfigService;
import io.mnemos.core.config.ConfigurationException;
import io.mnemos.core.config.model.AgentDefaults;
import io.mnemos.core.config.model.MnemosConfig;
import io.mnemos.core.config.model.ProviderConfig;
import io.mnemos.core.context.ContextRetrievalEngine;
import io.mnemos.core.embedding.EmbeddingProvider;
import io.mnemos.core.embedding.EmbeddingProviders;
import io.mnemos.core.graph.GraphStore;
import io.mnemos.core.graph.GraphStores;
import io.mnemos.core.identity.IdentityGenerator;
import io.mnemos.core.identity.IdentityService;
import io.mnemos.core.provider.DisabledProvider;
import io.mnemos.core.provider.EchoProvider;
import io.mnemos.core.provider.LlmProvider;
import io.mnemos.core.provider.OpenAiCompatProvider;
import io.mnemos.core.provider.ProviderRegistry;
import io.mnemos.core.provider.ProviderRouter;
import io.mnemos.core.tool.CoreHandlers;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class MnemosApplication {
    private static final Logger LOG = LoggerFactory.getLogger(MnemosApplication.class);

    private MnemosApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        MnemosConfig config = loadConfig(configService, configPath);

        CliContext context;
        try {
            context = wire(configService, configPath, config, Clock.systemUTC());
        } catch (ConfigurationException | IOException e) {
            System.err.println("Startup failed: " + e.getMessage());
            System.exit(2);
            return;
        }

        CommandLine commandLine = new CommandLine(new MnemosCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("chat", new ChatCommand(context));
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("tools", new ToolsCommand(context));
        commandLine.addSubcommand("persona", new PersonaCommand(context));
        commandLine.addSubcommand("ingest", new IngestCommand(context));
        commandLine.addSubcommand("search", new SearchCommand(context));
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    static CliContext wire(ConfigService configService, Path configPath, MnemosConfig config, Clock clock)
        throws IOException {
        ProviderRegistry providerRegistry = new ProviderRegistry();
        AgentDefaults defaults = config.agents().defaults();
        providerRegistry.register(buildOpenAiCompatProvider("openrouter", config.providers().openrouter(),
            "https://openrouter.ai/api/v1", defaults));
        providerRegistry.register(buildOpenAiCompatProvider("openai", config.providers().openai(),
            "https://api.openai.com/v1", defaults));
        providerRegistry.register(buildOpenAiCompatProvider("gateway", config.providers().gateway(), null, defaults));
        providerRegistry.register(new EchoProvider("echo"));
        ProviderRouter router = new ProviderRouter(providerRegistry);

        GraphStore store = GraphStores.open(config.graph(), clock);
        EmbeddingProvider embeddings = EmbeddingProviders.create(config.embedding(), config.providers());
        LOG.info("Embeddings: {} ({})", embeddings.name(), embeddings.modelName());

        CognitiveGraph graph = new CognitiveGraph(store, clock);
        ContextRetrievalEngine retrieval = new ContextRetrievalEngine(store, embeddings, config.retrieval(), clock);

        Path capabilities = ConfigPaths.resolve(config.capabilities().directory(), ConfigPaths.home().resolve("capabilities"));
        CapabilityBootstrap.ensureCapabilityDirectory(capabilities);
        CapabilityRegistry registry = CapabilityRegistry.open(capabilities, clock);

        IdentityGenerator generator = new IdentityGenerator(
            router.resolve(defaults.provider(), defaults.model()),
            defaults.model(),
            new ObjectMapper()
        );
        IdentityService identity = new IdentityService(store, generator, embeddings, retrieval::invalidate, clock);
        DocumentIngestor ingestor = new DocumentIngestor(store, embeddings);
        new CoreHandlers(graph, registry, identity, ingestor).registerAll();

        AgentRuntime runtime = new AgentRuntime(router, retrieval, registry, identity);
        return new CliContext(configService, configPath, runtime, graph, identity, registry, ingestor, embeddings);
    }

    private static MnemosConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
            return MnemosConfig.defaults();
        }
    }

    private static LlmProvider buildOpenAiCompatProvider(
        String name,
        ProviderConfig providerConfig,
        String defaultBase,
        AgentDefaults defaults
    ) {
        if (providerConfig == null || !providerConfig.configured()) {
            return new DisabledProvider(name, "missing API key");
        }
        String apiBase = providerConfig.apiBase() == null || providerConfig.apiBase().isBlank()
            ? defaultBase
            : providerConfig.apiBase();
        if (apiBase == null) {
            return new DisabledProvider(name, "missing apiBase");
        }
        Map<String, String> headers = providerConfig.extraHeaders() == null ? Map.of() : providerConfig.extraHeaders();
        return new OpenAiCompatProvider(name, providerConfig.apiKey(), apiBase, headers, 3, defaults.maxTokens(),
            defaults.temperature());
    }
}
