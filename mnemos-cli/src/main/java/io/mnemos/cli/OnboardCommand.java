package io.mnemos.cli;

import io.mnemos.core.capability.RefreshResult;
import io.mnemos.core.config.OnboardResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Write the config file and seed the capability directory")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace the existing config with defaults")
    boolean overwrite;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        OnboardResult result;
        try {
            result = context.configService().onboard(context.configPath(), overwrite);
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }

        String action = result.createdConfig() ? "Created" : result.overwrittenConfig() ? "Reset" : "Merged";
        System.out.println(action + " config at " + result.configPath());
        System.out.println("Capability directory: " + result.capabilitiesPath()
            + " (" + result.seededDefinitions().size() + " definitions seeded)");
        result.seededDefinitions().forEach(seeded -> System.out.println("  + " + seeded));

        if (result.capabilitiesPath().equals(context.registry().root())) {
            RefreshResult refresh = context.registry().refresh();
            System.out.println("Registry: " + refresh.added().size() + " added, " + refresh.updated().size()
                + " updated, " + refresh.removed().size() + " removed");
            refresh.errors().forEach(error -> System.err.println("  ! " + error));
        }
        System.out.println("Next: mnemos init --first-name <name> --last-name <name>");
        return 0;
    }
}
