package com.composeops.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for operation tracking and log streaming.
 */
@Service
public class ComposeOpsMetrics {

    private final MeterRegistry registry;

    public ComposeOpsMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOperationCreated(String type) {
        Counter.builder("composeops.operations.created")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    public void recordTransition(String status) {
        Counter.builder("composeops.operations.transitions")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Records wall-clock time from creation to a terminal status.
     */
    public void recordOperationDuration(String type, String status, Duration elapsed) {
        Timer.builder("composeops.operations.duration")
                .tag("type", type)
                .tag("status", status)
                .register(registry)
                .record(elapsed);
    }

    public void recordEvictions(int count) {
        Counter.builder("composeops.operations.evicted")
                .description("Terminal operations removed by the retention sweep")
                .register(registry)
                .increment(count);
    }

    // --- Streaming ---

    public void recordStreamStarted(String source) {
        Counter.builder("composeops.streams.started")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "completed", "failed" or "cancelled"
     */
    public void recordStreamEnded(String outcome) {
        Counter.builder("composeops.streams.ended")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Binds a gauge reporting the number of live stream sessions.
     */
    public void bindActiveStreams(Supplier<Number> activeSessions) {
        Gauge.builder("composeops.streams.active", activeSessions)
                .description("Stream sessions currently bound to a connection")
                .register(registry);
    }

    public void recordBroadcastFailure() {
        Counter.builder("composeops.broadcast.delivery_failures")
                .description("Operation progress payloads that could not be delivered to a connection")
                .register(registry)
                .increment();
    }
}
