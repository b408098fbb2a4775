package io.mnemos.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mnemos.core.identity.PersonaCycleResult;
import io.mnemos.core.identity.PersonaFocus;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "persona", description = "Show the persona or run a self-reflection cycle")
public final class PersonaCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final CliContext context;

    @Option(names = "--cycle", description = "Run a persona cycle: identity, memories or adaptation")
    String cycle;

    public PersonaCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (cycle != null) {
                PersonaCycleResult result = context.identity().runPersonaCycle(PersonaFocus.parse(cycle));
                if (!result.completed()) {
                    System.err.println("Persona cycle failed: " + result.error());
                    return 1;
                }
                System.out.println("Persona cycle '" + result.focus().value() + "' completed");
                System.out.println(JSON.writerWithDefaultPrettyPrinter().writeValueAsString(result.updates()));
                return 0;
            }
            System.out.println(JSON.writerWithDefaultPrettyPrinter().writeValueAsString(context.identity().personaInfo()));
            return 0;
        } catch (Exception e) {
            System.err.println("Persona command failed: " + e.getMessage());
            return 1;
        }
    }
}
