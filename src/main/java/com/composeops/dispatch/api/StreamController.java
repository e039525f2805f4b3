package com.composeops.dispatch.api;

import com.composeops.core.events.GroupBroadcaster;
import com.composeops.core.operations.OperationRegistry;
import com.composeops.core.streaming.OperationLogSource;
import com.composeops.core.streaming.StreamCoordinator;
import com.composeops.core.streaming.StreamingProperties;
import com.composeops.docker.DockerLogSources;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

/**
 * SSE connection endpoint plus the per-connection stream and subscription controls.
 * Output of a started stream arrives on the connection's SSE channel, not in the response.
 */
@RestController
@RequestMapping("/api/v1")
public class StreamController {

    private final SseConnectionService sseConnectionService;
    private final StreamCoordinator streamCoordinator;
    private final GroupBroadcaster broadcaster;
    private final OperationRegistry operationRegistry;
    private final DockerLogSources logSources;
    private final StreamingProperties streamingProperties;

    public StreamController(SseConnectionService sseConnectionService,
                            StreamCoordinator streamCoordinator,
                            GroupBroadcaster broadcaster,
                            OperationRegistry operationRegistry,
                            DockerLogSources logSources,
                            StreamingProperties streamingProperties) {
        this.sseConnectionService = sseConnectionService;
        this.streamCoordinator = streamCoordinator;
        this.broadcaster = broadcaster;
        this.operationRegistry = operationRegistry;
        this.logSources = logSources;
        this.streamingProperties = streamingProperties;
    }

    /**
     * GET /api/v1/events/stream: Open an SSE connection. The first event is
     * {@code connected} with the connection id.
     */
    @GetMapping(value = "/events/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter connect() {
        return sseConnectionService.openConnection();
    }

    @PostMapping("/connections/{connectionId}/streams/compose")
    public ResponseEntity<Map<String, String>> streamComposeLogs(@PathVariable String connectionId,
                                                                 @RequestBody ComposeLogStreamRequest request) {
        requireNonNegative(request.tail());
        var source = logSources.compose(request.projectPath(), request.service(), request.tail(), request.follow());
        return started(connectionId, streamCoordinator.startStream(connectionId, source));
    }

    @PostMapping("/connections/{connectionId}/streams/containers/{containerId}")
    public ResponseEntity<Map<String, String>> streamContainerLogs(
            @PathVariable String connectionId,
            @PathVariable String containerId,
            @RequestParam(required = false) Integer tail,
            @RequestParam(defaultValue = "false") boolean follow) {
        requireNonNegative(tail);
        var source = logSources.container(containerId, tail, follow);
        return started(connectionId, streamCoordinator.startStream(connectionId, source));
    }

    @PostMapping("/connections/{connectionId}/streams/operations/{operationId}")
    public ResponseEntity<Map<String, String>> streamOperationLogs(@PathVariable String connectionId,
                                                                   @PathVariable String operationId) {
        operationRegistry.get(operationId);
        var source = new OperationLogSource(operationRegistry, operationId,
                streamingProperties.getOperationLogPollInterval());
        return started(connectionId, streamCoordinator.startStream(connectionId, source));
    }

    @DeleteMapping("/connections/{connectionId}/streams")
    public Map<String, Boolean> stopStream(@PathVariable String connectionId) {
        return Map.of("stopped", streamCoordinator.stopStream(connectionId));
    }

    @PutMapping("/connections/{connectionId}/subscriptions/{operationId}")
    public ResponseEntity<Void> subscribe(@PathVariable String connectionId, @PathVariable String operationId) {
        operationRegistry.get(operationId);
        broadcaster.subscribe(connectionId, operationId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/connections/{connectionId}/subscriptions/{operationId}")
    public ResponseEntity<Void> unsubscribe(@PathVariable String connectionId, @PathVariable String operationId) {
        broadcaster.unsubscribe(connectionId, operationId);
        return ResponseEntity.noContent().build();
    }

    private static ResponseEntity<Map<String, String>> started(String connectionId, String sessionId) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("connection_id", connectionId, "session_id", sessionId));
    }

    private static void requireNonNegative(Integer tail) {
        if (tail != null && tail < 0) {
            throw new IllegalArgumentException("Tail must not be negative, got " + tail);
        }
    }
}
