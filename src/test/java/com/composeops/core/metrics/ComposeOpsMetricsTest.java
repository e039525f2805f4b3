package com.composeops.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ComposeOpsMetricsTest {

    private SimpleMeterRegistry registry;
    private ComposeOpsMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ComposeOpsMetrics(registry);
    }

    @Test
    @DisplayName("recordTransition counts per status")
    void recordTransition() {
        metrics.recordTransition("running");
        metrics.recordTransition("running");
        metrics.recordTransition("failed");

        assertEquals(2.0, registry.find("composeops.operations.transitions").tag("status", "running").counter().count());
        assertEquals(1.0, registry.find("composeops.operations.transitions").tag("status", "failed").counter().count());
    }

    @Test
    @DisplayName("recordOperationDuration creates a timer tagged by type and status")
    void recordOperationDuration() {
        metrics.recordOperationDuration("compose_up", "completed", Duration.ofSeconds(3));

        var timer = registry.find("composeops.operations.duration")
                .tag("type", "compose_up").tag("status", "completed").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("stream lifecycle counters are tagged")
    void streamCounters() {
        metrics.recordStreamStarted("compose");
        metrics.recordStreamEnded("cancelled");

        assertEquals(1.0, registry.find("composeops.streams.started").tag("source", "compose").counter().count());
        assertEquals(1.0, registry.find("composeops.streams.ended").tag("outcome", "cancelled").counter().count());
    }

    @Test
    @DisplayName("active streams gauge follows its supplier")
    void activeStreamsGauge() {
        var active = new AtomicInteger(2);
        metrics.bindActiveStreams(active::get);
        assertEquals(2.0, registry.find("composeops.streams.active").gauge().value());

        active.set(0);
        assertEquals(0.0, registry.find("composeops.streams.active").gauge().value());
    }
}
