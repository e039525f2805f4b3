package com.composeops.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for ComposeOps.
 * Routes to subcommands: serve, operations, status, health.
 */
@Command(
        name = "composeops",
        mixinStandardHelpOptions = true,
        version = "ComposeOps 0.1.0",
        description = "Tracks docker compose operations and streams their logs",
        subcommands = {
                ServeCommand.class,
                OperationsCommand.class,
                StatusCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ComposeOpsCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
