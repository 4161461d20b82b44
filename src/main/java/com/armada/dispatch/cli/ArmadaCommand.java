package com.armada.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Armada.
 * Routes to subcommands: run, quota, health.
 */
@Command(
        name = "armada",
        mixinStandardHelpOptions = true,
        version = "Armada 0.1.0",
        description = "Orchestrates fleets of AI coding agents over a shared workspace",
        subcommands = {
                RunCommand.class,
                QuotaCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ArmadaCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
