package com.composeops.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.net.ConnectException;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: composeops health
 * <p>
 * Queries the server's health endpoint and displays each component with colored output.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final ComposeOpsClient client;

    public HealthCommand(ComposeOpsClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ComposeOpsClient.HealthReport report;
        try {
            report = client.health();
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to ComposeOps server at " + client.serverUrl());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } catch (Exception e) {
            ConsoleOutput.error("Health check failed: " + e.getMessage());
            return 1;
        }

        Iterator<Map.Entry<String, JsonNode>> components = report.body().path("components").fields();
        while (components.hasNext()) {
            var component = components.next();
            String status = component.getValue().path("status").asText("UNKNOWN");
            String label = component.getKey() + ": " + component.getValue().path("detail").asText("");
            switch (status) {
                case "UP" -> ConsoleOutput.success(label);
                case "DEGRADED" -> ConsoleOutput.info(label);
                default -> ConsoleOutput.error(label);
            }
        }

        System.out.println("──────────────────────────────────");
        if (report.healthy()) {
            ConsoleOutput.success("Overall: all systems operational");
            return 0;
        }
        ConsoleOutput.error("Overall: one or more components degraded or down");
        return 1;
    }
}
