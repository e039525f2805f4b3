package com.composeops.dispatch.cli;

import com.composeops.dispatch.api.OperationDetail;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.ConnectException;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: composeops status &lt;operation-id&gt;
 * <p>
 * Shows one operation. With {@code --watch}, opens an SSE connection, subscribes to the
 * operation's progress and follows its log until the stream ends.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check operation status")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Operation ID")
    private String operationId;

    @Option(names = {"--watch", "-w"}, description = "Watch for live updates via SSE")
    private boolean watch;

    private final ComposeOpsClient client;

    public StatusCommand(ComposeOpsClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            Optional<OperationDetail> operation = client.getOperation(operationId);
            if (operation.isEmpty()) {
                ConsoleOutput.error("Operation not found: " + operationId);
                return 1;
            }
            print(operation.get());
            if (watch && !isTerminal(operation.get().status())) {
                return watch();
            }
            return 0;
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to ComposeOps server at " + client.serverUrl());
            ConsoleOutput.info("Start the server first: composeops serve");
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Watch interrupted.");
            return 1;
        } catch (Exception e) {
            ConsoleOutput.error("Status failed: " + e.getMessage());
            return 1;
        }
    }

    private int watch() throws Exception {
        System.out.println();
        ConsoleOutput.info("Watching operation " + operationId + "...");
        final boolean[] failed = {false};
        client.watchOperation(operationId, (event, data) -> {
            switch (event) {
                case "ReceiveLogs" -> ConsoleOutput.logLine(data);
                case "LogError" -> {
                    failed[0] = true;
                    ConsoleOutput.watchEvent(event, data);
                }
                default -> ConsoleOutput.watchEvent(event, data);
            }
        });
        System.out.println();
        ConsoleOutput.info("Stream ended.");
        return failed[0] ? 1 : 0;
    }

    private static void print(OperationDetail op) {
        System.out.println();
        System.out.println("OPERATION " + op.id());
        System.out.println("Type: " + op.type());
        System.out.println("Project: " + (op.projectName() != null ? op.projectName() : "-")
                + (op.projectPath() != null ? " (" + op.projectPath() + ")" : ""));
        System.out.println("Status: " + ConsoleOutput.status(op.status()) + " " + op.progress() + "%");
        System.out.println("Started: " + op.startedAt()
                + (op.completedAt() != null ? " | Completed: " + op.completedAt() : ""));
        if (op.initiatedBy() != null) {
            System.out.println("Initiated by: " + op.initiatedBy());
        }
        if (op.errorMessage() != null) {
            ConsoleOutput.error(op.errorMessage());
        }
        if (op.logs() != null && !op.logs().isEmpty()) {
            System.out.println();
            op.logs().lines().forEach(ConsoleOutput::logLine);
        }
    }

    private static boolean isTerminal(String status) {
        return "completed".equals(status) || "failed".equals(status) || "cancelled".equals(status);
    }
}
