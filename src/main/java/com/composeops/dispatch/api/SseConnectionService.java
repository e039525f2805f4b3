package com.composeops.dispatch.api;

import com.composeops.core.connection.ConnectionHub;
import com.composeops.core.streaming.StreamingProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Opens SSE connections and ties their lifecycle to the {@link ConnectionHub}.
 * <p>
 * Each emitter becomes one connection. The first event is {@code connected} carrying the
 * connection id the client uses for stream and subscription requests. Completion, timeout
 * and error all lead to {@link ConnectionHub#disconnect(String)}, which stops the
 * connection's stream and drops its subscriptions.
 * <p>
 * Heartbeats are sent as SSE comments (lines starting with ':'), which EventSource clients
 * ignore, to keep idle connections open through proxies.
 */
@Service
public class SseConnectionService {

    private static final Logger log = LoggerFactory.getLogger(SseConnectionService.class);

    static final String CONNECTED_EVENT = "connected";

    private final ConnectionHub connectionHub;
    private final StreamingProperties properties;

    private final ConcurrentHashMap<String, SseEmitter> emitters = new ConcurrentHashMap<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    public SseConnectionService(ConnectionHub connectionHub, StreamingProperties properties) {
        this.connectionHub = connectionHub;
        this.properties = properties;
    }

    @PostConstruct
    void startHeartbeat() {
        long intervalMs = properties.getHeartbeatInterval().toMillis();
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("SSE heartbeat scheduler started (interval={}ms)", intervalMs);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    /**
     * Creates an emitter registered as a new connection.
     */
    public SseEmitter openConnection() {
        SseEmitter emitter = new SseEmitter(properties.getEmitterTimeout().toMillis());
        String connectionId = connectionHub.connect(new SseEventChannel(emitter));
        emitters.put(connectionId, emitter);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for connection {}", connectionId);
            cleanup(connectionId);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for connection {}", connectionId);
            cleanup(connectionId);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for connection {}: {}", connectionId, ex.getMessage());
            cleanup(connectionId);
        });

        try {
            emitter.send(SseEmitter.event()
                    .name(CONNECTED_EVENT)
                    .data(Map.of("connectionId", connectionId)));
        } catch (IOException e) {
            log.warn("Failed to send connected event for {}: {}", connectionId, e.getMessage());
            cleanup(connectionId);
        }

        log.info("SSE connection {} opened (timeout={}ms)", connectionId, properties.getEmitterTimeout().toMillis());
        return emitter;
    }

    public int activeEmitterCount() {
        return emitters.size();
    }

    void sendHeartbeats() {
        if (emitters.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", emitters.size());
        emitters.forEach((connectionId, emitter) -> {
            try {
                emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                log.debug("Heartbeat failed for connection {}: {}", connectionId, e.getMessage());
                cleanup(connectionId);
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for connection {} (emitter not active)", connectionId);
                cleanup(connectionId);
            }
        });
    }

    private void cleanup(String connectionId) {
        if (emitters.remove(connectionId) != null) {
            connectionHub.disconnect(connectionId);
        }
    }
}
