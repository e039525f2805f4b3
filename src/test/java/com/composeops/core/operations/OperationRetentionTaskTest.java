package com.composeops.core.operations;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class OperationRetentionTaskTest {

    @Test
    void sweepEvictsOperationsOlderThanRetention() {
        var registry = mock(OperationRegistry.class);
        var properties = new OperationProperties();
        properties.setRetention(Duration.ofHours(6));
        Instant now = Instant.parse("2026-03-01T12:00:00Z");
        var task = new OperationRetentionTask(registry, properties, Clock.fixed(now, ZoneOffset.UTC));

        task.sweep();

        verify(registry).evictCompletedBefore(Instant.parse("2026-03-01T06:00:00Z"));
    }

    @Test
    void sweepSurvivesRegistryFailure() {
        var registry = mock(OperationRegistry.class);
        when(registry.evictCompletedBefore(any())).thenThrow(new IllegalStateException("boom"));
        var task = new OperationRetentionTask(registry, new OperationProperties(), Clock.systemUTC());

        task.sweep();

        verify(registry).evictCompletedBefore(any());
    }
}
