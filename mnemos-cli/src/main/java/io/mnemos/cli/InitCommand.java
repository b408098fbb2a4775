package io.mnemos.cli;

import io.mnemos.core.cognitive.GraphRoots;
import io.mnemos.core.config.model.MnemosConfig;
import io.mnemos.core.identity.PersonaIdentity;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "init", description = "Create the user and assistant roots and initialize the persona")
public final class InitCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--first-name", required = true, description = "User first name")
    String firstName;

    @Option(names = "--last-name", description = "User last name")
    String lastName;

    @Option(names = "--assistant-name", defaultValue = "Mnemos", description = "Assistant node name")
    String assistantName;

    public InitCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MnemosConfig config = context.configService().load(context.configPath());
            GraphRoots roots = context.graph().initializeGraph(
                firstName,
                lastName,
                assistantName,
                config.agents().defaults().model()
            );
            System.out.println("User: " + roots.user().name() + " (" + roots.user().id() + ")");
            System.out.println("Assistant: " + roots.assistant().name() + " (" + roots.assistant().id() + ")");

            PersonaIdentity persona = context.identity().initialize(roots.user().id());
            System.out.println("Persona: " + persona.name() + " - " + persona.tagline());
            return 0;
        } catch (Exception e) {
            System.err.println("Init failed: " + e.getMessage());
            return 1;
        }
    }
}
