package io.mnemos.cli;

import io.mnemos.core.agent.AgentSettings;
import io.mnemos.core.config.model.AgentDefaults;
import io.mnemos.core.config.model.MnemosConfig;
import io.mnemos.core.graph.Node;
import io.mnemos.core.model.AgentResult;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "chat", description = "Send a message to the persona")
public final class ChatCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Message to send")
    String message;

    @Option(names = "--project", description = "Project name to include as context")
    String project;

    @Option(names = "--core-tools-only", description = "Offer only tier 0 and 1 tools")
    boolean coreToolsOnly;

    @Option(names = {"-m", "--model"}, description = "Model override")
    String model;

    @Option(names = {"-p", "--provider"}, description = "Provider override")
    String provider;

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MnemosConfig config = context.configService().load(context.configPath());
            AgentDefaults defaults = config.agents().defaults();
            AgentSettings settings = new AgentSettings(
                provider != null ? provider : defaults.provider(),
                model != null ? model : defaults.model(),
                defaults.maxToolIterations(),
                coreToolsOnly || defaults.coreToolsOnly()
            );

            Map<String, Object> projectContext = null;
            if (project != null && !project.isBlank()) {
                Optional<Node> match = context.graph().findProjectByName(project);
                if (match.isEmpty()) {
                    System.err.println("Project not found: " + project);
                } else {
                    projectContext = match.get().toMap();
                }
            }

            AgentResult result = context.runtime().run(message, settings, projectContext);
            System.out.println(result.content());
            if (result.usedFallbackContext()) {
                System.err.println("(context retrieval unavailable: " + result.contextUsed().get("error") + ")");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }
    }
}
