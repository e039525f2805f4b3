package com.composeops.core.streaming;

import com.composeops.core.connection.ConnectionNotFoundException;
import com.composeops.core.connection.ConnectionRegistry;
import com.composeops.core.connection.EventChannel;
import com.composeops.core.logging.MdcContext;
import com.composeops.core.metrics.ComposeOpsMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs at most one log stream per connection.
 * <p>
 * Starting a stream replaces (and cancels) the connection's current one. Each session runs on
 * its own worker thread and ends with exactly one terminal event, {@code StreamComplete} or
 * {@code LogError}, unless it is cancelled, in which case it ends silently. Failures inside a
 * source are contained in its session.
 */
@Service
public class StreamCoordinator {

    private static final Logger log = LoggerFactory.getLogger(StreamCoordinator.class);

    private final ConcurrentHashMap<String, StreamSession> sessions = new ConcurrentHashMap<>();

    private final ConnectionRegistry connections;
    private final ComposeOpsMetrics metrics;
    private final StreamingProperties properties;

    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "log-stream-" + threadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public StreamCoordinator(ConnectionRegistry connections, ComposeOpsMetrics metrics,
                             StreamingProperties properties) {
        this.connections = connections;
        this.metrics = metrics;
        this.properties = properties;
        metrics.bindActiveStreams(sessions::size);
    }

    /**
     * Starts streaming {@code source} to the connection, cancelling any stream it already has.
     *
     * @return the new session id
     * @throws ConnectionNotFoundException if the connection is not registered
     */
    public String startStream(String connectionId, LogSource source) {
        EventChannel channel = connections.require(connectionId);
        var session = new StreamSession(UUID.randomUUID().toString(), connectionId, channel, source);

        StreamSession previous = sessions.put(connectionId, session);
        if (previous != null) {
            previous.cancel();
            log.info("Replaced stream {} on connection {}", previous.id(), connectionId);
        }
        // lost a race with disconnect
        if (!connections.isConnected(connectionId)) {
            sessions.remove(connectionId, session);
            session.cancel();
            throw new ConnectionNotFoundException(connectionId);
        }

        metrics.recordStreamStarted(source.describe());
        try {
            executor.execute(() -> run(session));
        } catch (RejectedExecutionException e) {
            log.warn("Stream executor rejected session {} on connection {}", session.id(), connectionId);
            sessions.remove(connectionId, session);
            finish(session, fail(session, StreamEvents.DEFAULT_ERROR_MESSAGE));
            return session.id();
        }
        log.info("Started {} stream {} on connection {}", source.describe(), session.id(), connectionId);
        return session.id();
    }

    /**
     * Cancels and removes the connection's active stream, if any. No event is sent for the
     * cancelled session after this returns.
     *
     * @return true if a session was stopped
     */
    public boolean stopStream(String connectionId) {
        if (connectionId == null) {
            return false;
        }
        StreamSession session = sessions.remove(connectionId);
        if (session == null) {
            return false;
        }
        session.cancel();
        log.info("Stopped stream {} on connection {}", session.id(), connectionId);
        return true;
    }

    /**
     * Transport hook for a dropped connection. Same effect as {@link #stopStream(String)}.
     */
    public void onDisconnect(String connectionId) {
        stopStream(connectionId);
    }

    public Optional<String> activeSessionId(String connectionId) {
        StreamSession session = connectionId != null ? sessions.get(connectionId) : null;
        return session != null ? Optional.of(session.id()) : Optional.empty();
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    public boolean isAcceptingWork() {
        return !executor.isShutdown();
    }

    @PreDestroy
    void shutdown() {
        sessions.keySet().forEach(this::stopStream);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(properties.getShutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Stream coordinator stopped");
    }

    private void run(StreamSession session) {
        MdcContext.setStream(session.connectionId(), session.id());
        String outcome = "cancelled";
        try {
            session.token().throwIfCancellationRequested();
            session.source().stream(session::emitChunk, session.token());
            if (complete(session)) {
                outcome = "completed";
            } else if (!session.isCancelled()) {
                outcome = "failed";
            }
        } catch (StreamCancelledException e) {
            log.info("Stream {} cancelled", session.id());
        } catch (StreamFailureException e) {
            log.warn("Stream {} failed: {}", session.id(), e.getMessage());
            outcome = fail(session, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!session.isCancelled()) {
                log.warn("Stream {} interrupted", session.id());
                outcome = fail(session, StreamEvents.DEFAULT_ERROR_MESSAGE);
            }
        } catch (Exception e) {
            if (!session.isCancelled()) {
                log.error("Stream {} failed unexpectedly", session.id(), e);
                outcome = fail(session, StreamEvents.DEFAULT_ERROR_MESSAGE);
            }
        } catch (Error e) {
            log.error("Stream {} aborted", session.id(), e);
            fail(session, StreamEvents.DEFAULT_ERROR_MESSAGE);
            outcome = "failed";
            throw e;
        } finally {
            sessions.remove(session.connectionId(), session);
            finish(session, outcome);
            MdcContext.clear();
        }
    }

    private boolean complete(StreamSession session) {
        try {
            return session.complete();
        } catch (IOException e) {
            log.debug("Could not deliver StreamComplete for {}: {}", session.id(), e.getMessage());
            return false;
        }
    }

    private String fail(StreamSession session, String message) {
        try {
            return session.fail(message) ? "failed" : "cancelled";
        } catch (IOException e) {
            log.debug("Could not deliver LogError for {}: {}", session.id(), e.getMessage());
            return "failed";
        }
    }

    private void finish(StreamSession session, String outcome) {
        metrics.recordStreamEnded(outcome);
        log.debug("Stream {} on connection {} ended ({})", session.id(), session.connectionId(), outcome);
    }
}
