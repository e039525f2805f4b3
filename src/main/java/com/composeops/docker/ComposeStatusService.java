package com.composeops.docker;

import com.composeops.core.model.ServiceState;
import com.composeops.core.state.StateAggregator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads service states of a compose project from {@code docker compose ps} and derives the
 * project's aggregate state.
 */
@Service
public class ComposeStatusService {

    private static final Logger log = LoggerFactory.getLogger(ComposeStatusService.class);

    private static final List<String> PS_ARGS = List.of("ps", "--all", "--format", "json");

    private final ProcessRunner runner;
    private final ObjectMapper objectMapper;

    public ComposeStatusService(ProcessRunner runner, ObjectMapper objectMapper) {
        this.runner = runner;
        this.objectMapper = objectMapper;
    }

    /**
     * @throws ComposeProjectNotFoundException if the project directory or compose file is missing
     * @throws ComposeCommandException         if {@code docker compose ps} fails
     */
    public ProjectStatus status(String projectPath) {
        List<ServiceState> services = services(projectPath);
        var state = StateAggregator.aggregate(services);
        log.debug("Project {} is {} ({} service(s))", projectPath, state, services.size());
        return new ProjectStatus(projectPath, state, services);
    }

    public List<ServiceState> services(String projectPath) {
        ComposeProject project = ComposeProject.resolve(projectPath);
        CommandResult result = runner.run(project.directory(), project.args(PS_ARGS));
        if (!result.success()) {
            String error = result.error() != null ? result.error() : "exit code " + result.exitCode();
            throw new ComposeCommandException("docker compose ps failed: " + error);
        }
        return parse(result.output());
    }

    /**
     * Parses {@code ps --format json} output. Newer compose releases print one object per line,
     * older ones a single JSON array.
     */
    List<ServiceState> parse(String output) {
        if (output == null || output.isBlank()) {
            return List.of();
        }
        var services = new ArrayList<ServiceState>();
        try {
            String trimmed = output.trim();
            if (trimmed.startsWith("[")) {
                for (JsonNode node : objectMapper.readTree(trimmed)) {
                    services.add(toServiceState(node));
                }
            } else {
                for (String line : trimmed.split("\\R")) {
                    if (!line.isBlank()) {
                        services.add(toServiceState(objectMapper.readTree(line)));
                    }
                }
            }
        } catch (JsonProcessingException e) {
            throw new ComposeCommandException("Unexpected docker compose ps output", e);
        }
        return services;
    }

    private static ServiceState toServiceState(JsonNode node) {
        String name = node.path("Service").asText("");
        if (name.isEmpty()) {
            name = node.path("Name").asText("");
        }
        String state = node.path("State").asText("unknown");
        return new ServiceState(name, state);
    }
}
