package io.mnemos.cli;

import io.mnemos.core.capability.RefreshResult;
import io.mnemos.core.capability.ToolDefinition;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "tools", description = "List capability tools, optionally reloading them from disk")
public final class ToolsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--refresh", description = "Reload definitions before listing")
    boolean refresh;

    @Option(names = "--category", description = "Only list tools in this category")
    String category;

    @Option(names = "--all", description = "Include disabled tools")
    boolean all;

    public ToolsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (refresh) {
                RefreshResult changes = context.registry().refresh();
                System.out.println("Added: " + changes.added());
                System.out.println("Updated: " + changes.updated());
                System.out.println("Removed: " + changes.removed());
                changes.errors().forEach(error -> System.err.println("Error: " + error));
            }
            List<ToolDefinition> tools = context.registry().list(null, category, !all);
            if (tools.isEmpty()) {
                System.out.println("No tools found");
                return 0;
            }
            for (ToolDefinition tool : tools) {
                System.out.println(tool.name() + " [tier " + tool.tier() + ", " + tool.category() + "]"
                    + (tool.active() ? "" : " (disabled)"));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Tools command failed: " + e.getMessage());
            return 1;
        }
    }
}
