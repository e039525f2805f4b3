package com.composeops.dispatch.cli;

import com.composeops.dispatch.api.OperationSummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.net.ConnectException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: composeops operations
 * <p>
 * Lists tracked operations, newest first.
 */
@Command(name = "operations", mixinStandardHelpOptions = true, description = "List tracked operations")
@Component
public class OperationsCommand implements Callable<Integer> {

    @Option(names = {"--status", "-s"}, description = "Only operations with this status (pending, running, completed, failed, cancelled)")
    private String status;

    @Option(names = {"--limit", "-n"}, description = "Number of results (default: ${DEFAULT-VALUE})", defaultValue = "20")
    private int limit;

    private final ComposeOpsClient client;

    public OperationsCommand(ComposeOpsClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        List<OperationSummary> operations;
        try {
            operations = client.listOperations(status, limit);
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to ComposeOps server at " + client.serverUrl());
            ConsoleOutput.info("Start the server first: composeops serve");
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } catch (Exception e) {
            ConsoleOutput.error("Listing operations failed: " + e.getMessage());
            return 1;
        }

        if (operations.isEmpty()) {
            ConsoleOutput.info("No operations found.");
            return 0;
        }

        ConsoleOutput.info("Operations (" + operations.size() + "):");
        System.out.println();
        System.out.printf("  %-36s %-16s %-10s %-5s %s%n", "OPERATION ID", "TYPE", "STATUS", "PROG", "PROJECT");
        System.out.println("  " + "-".repeat(86));
        for (var op : operations) {
            System.out.printf("  %-36s %-16s %-10s %3d%% %s%n",
                    op.id(), op.type(), op.status(), op.progress(),
                    ConsoleOutput.truncate(op.projectName() != null ? op.projectName() : op.projectPath(), 24));
        }
        return 0;
    }
}
