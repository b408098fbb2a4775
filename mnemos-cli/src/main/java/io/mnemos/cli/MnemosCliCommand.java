package io.mnemos.cli;

import picocli.CommandLine.Command;

@Command(name = "mnemos", mixinStandardHelpOptions = true, description = "Mnemos cognitive memory runtime")
public final class MnemosCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
