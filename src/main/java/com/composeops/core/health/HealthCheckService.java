package com.composeops.core.health;

import com.composeops.core.connection.ConnectionHub;
import com.composeops.core.operations.OperationRegistry;
import com.composeops.core.streaming.StreamCoordinator;
import com.github.dockerjava.api.DockerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DockerClient dockerClient;
    private final StreamCoordinator streamCoordinator;
    private final ConnectionHub connectionHub;
    private final OperationRegistry operationRegistry;

    public HealthCheckService(
            @Autowired(required = false) DockerClient dockerClient,
            StreamCoordinator streamCoordinator,
            ConnectionHub connectionHub,
            OperationRegistry operationRegistry) {
        this.dockerClient = dockerClient;
        this.streamCoordinator = streamCoordinator;
        this.connectionHub = connectionHub;
        this.operationRegistry = operationRegistry;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDocker());
        results.add(checkStreams());
        results.add(checkOperations());
        return results;
    }

    private HealthStatus checkDocker() {
        if (dockerClient == null) {
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "No DockerClient configured", Map.of());
        }
        try {
            dockerClient.pingCmd().exec();
            return new HealthStatus("docker", HealthStatus.Status.UP,
                    "Docker daemon reachable", Map.of());
        } catch (Exception e) {
            log.warn("Docker health check failed: {}", e.getMessage());
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "Docker error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkStreams() {
        var metadata = Map.of(
                "activeStreams", String.valueOf(streamCoordinator.activeSessionCount()),
                "connections", String.valueOf(connectionHub.activeConnections()));
        if (!streamCoordinator.isAcceptingWork()) {
            return new HealthStatus("streams", HealthStatus.Status.DOWN,
                    "Stream executor shut down", metadata);
        }
        return new HealthStatus("streams", HealthStatus.Status.UP,
                "Accepting log streams", metadata);
    }

    private HealthStatus checkOperations() {
        return new HealthStatus("operations", HealthStatus.Status.UP,
                "Operation registry available",
                Map.of("active", String.valueOf(operationRegistry.activeCount()),
                        "tracked", String.valueOf(operationRegistry.size())));
    }
}
