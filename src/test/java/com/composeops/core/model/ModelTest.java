package com.composeops.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("OperationStatus")
    class OperationStatusTests {

        @Test
        @DisplayName("pending may start, end or be cancelled")
        void pendingTransitions() {
            assertTrue(OperationStatus.PENDING.canTransitionTo(OperationStatus.RUNNING));
            assertTrue(OperationStatus.PENDING.canTransitionTo(OperationStatus.COMPLETED));
            assertTrue(OperationStatus.PENDING.canTransitionTo(OperationStatus.FAILED));
            assertTrue(OperationStatus.PENDING.canTransitionTo(OperationStatus.CANCELLED));
            assertFalse(OperationStatus.PENDING.canTransitionTo(OperationStatus.PENDING));
        }

        @Test
        @DisplayName("running may report progress again but never return to pending")
        void runningTransitions() {
            assertTrue(OperationStatus.RUNNING.canTransitionTo(OperationStatus.RUNNING));
            assertTrue(OperationStatus.RUNNING.canTransitionTo(OperationStatus.COMPLETED));
            assertFalse(OperationStatus.RUNNING.canTransitionTo(OperationStatus.PENDING));
            assertFalse(OperationStatus.RUNNING.canTransitionTo(null));
        }

        @ParameterizedTest
        @EnumSource(value = OperationStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
        @DisplayName("terminal statuses are final")
        void terminalIsFinal(OperationStatus terminal) {
            assertTrue(terminal.isTerminal());
            for (OperationStatus next : OperationStatus.values()) {
                assertFalse(terminal.canTransitionTo(next), terminal + " -> " + next);
            }
        }

        @Test
        @DisplayName("parses wire values case-insensitively")
        void parsesWireValues() {
            assertEquals(Optional.of(OperationStatus.RUNNING), OperationStatus.fromValue(" Running "));
            assertEquals(Optional.of(OperationStatus.CANCELLED), OperationStatus.fromValue("cancelled"));
            assertTrue(OperationStatus.fromValue("done").isEmpty());
            assertTrue(OperationStatus.fromValue(null).isEmpty());
        }
    }

    @Nested
    @DisplayName("OperationType")
    class OperationTypeTests {

        @Test
        @DisplayName("accepts wire value, enum name and short form")
        void parsesAllForms() {
            assertEquals(Optional.of(OperationType.COMPOSE_UP), OperationType.fromValue("compose_up"));
            assertEquals(Optional.of(OperationType.COMPOSE_UP), OperationType.fromValue("COMPOSE_UP"));
            assertEquals(Optional.of(OperationType.COMPOSE_UP), OperationType.fromValue("up"));
            assertEquals(Optional.of(OperationType.COMPOSE_RESTART), OperationType.fromValue("Restart"));
        }

        @Test
        @DisplayName("rejects unknown kinds")
        void rejectsUnknown() {
            assertTrue(OperationType.fromValue("compose_destroy").isEmpty());
            assertTrue(OperationType.fromValue("").isEmpty());
        }
    }

    @Nested
    @DisplayName("OperationFilter")
    class OperationFilterTests {

        @Test
        @DisplayName("withers only replace their own field")
        void withers() {
            Instant from = Instant.parse("2026-01-01T00:00:00Z");
            Instant to = Instant.parse("2026-01-02T00:00:00Z");
            var filter = OperationFilter.all()
                    .withStatus(OperationStatus.FAILED)
                    .withInitiatedBy("alice")
                    .withRange(from, to)
                    .withLimit(5);

            assertEquals(new OperationFilter(OperationStatus.FAILED, "alice", from, to, 5), filter);
        }
    }
}
