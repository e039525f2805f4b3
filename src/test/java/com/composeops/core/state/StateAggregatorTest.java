package com.composeops.core.state;

import com.composeops.core.model.EntityState;
import com.composeops.core.model.ServiceState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StateAggregatorTest {

    private static List<ServiceState> services(String... states) {
        var result = new ArrayList<ServiceState>();
        for (int i = 0; i < states.length; i++) {
            result.add(new ServiceState("svc-" + i, states[i]));
        }
        return result;
    }

    @Nested
    @DisplayName("aggregate")
    class AggregateTests {

        @Test
        @DisplayName("no services is DOWN")
        void emptyIsDown() {
            assertEquals(EntityState.DOWN, StateAggregator.aggregate(List.of()));
            assertEquals(EntityState.DOWN, StateAggregator.aggregate(null));
        }

        @Test
        @DisplayName("all running is RUNNING regardless of case")
        void allRunning() {
            assertEquals(EntityState.RUNNING, StateAggregator.aggregate(services("running")));
            assertEquals(EntityState.RUNNING, StateAggregator.aggregate(services("Running", "RUNNING", " running ")));
        }

        @Test
        @DisplayName("some running is DEGRADED whatever the others are")
        void partialRunningIsDegraded() {
            assertEquals(EntityState.DEGRADED, StateAggregator.aggregate(services("running", "exited")));
            assertEquals(EntityState.DEGRADED, StateAggregator.aggregate(services("restarting", "running")));
            assertEquals(EntityState.DEGRADED, StateAggregator.aggregate(services("running", "garbage", "created")));
        }

        @Test
        @DisplayName("restarting beats exited and created")
        void restartingPriority() {
            assertEquals(EntityState.RESTARTING, StateAggregator.aggregate(services("Restarting")));
            assertEquals(EntityState.RESTARTING, StateAggregator.aggregate(services("exited", "restarting", "created")));
        }

        @Test
        @DisplayName("exited beats created")
        void exitedBeatsCreated() {
            assertEquals(EntityState.EXITED, StateAggregator.aggregate(services("Exited", "Created")));
        }

        @Test
        @DisplayName("created alone is CREATED")
        void createdOnly() {
            assertEquals(EntityState.CREATED, StateAggregator.aggregate(services("created", "paused")));
        }

        @Test
        @DisplayName("anything else is STOPPED")
        void fallbackIsStopped() {
            assertEquals(EntityState.STOPPED, StateAggregator.aggregate(services("paused", "dead")));
            assertEquals(EntityState.STOPPED, StateAggregator.aggregate(services("garbage")));
        }

        @Test
        @DisplayName("null raw state counts toward the total only")
        void nullRawState() {
            assertEquals(EntityState.DEGRADED,
                    StateAggregator.aggregate(Arrays.asList(new ServiceState("a", "running"), new ServiceState("b", null))));
        }
    }

    @Nested
    @DisplayName("string mapping")
    class StringMappingTests {

        @ParameterizedTest
        @EnumSource(value = EntityState.class, mode = EnumSource.Mode.EXCLUDE, names = "UNKNOWN")
        @DisplayName("named states survive the string form")
        void namedStatesRoundTrip(EntityState state) {
            assertEquals(state, StateAggregator.fromStateString(StateAggregator.toStateString(state)));
        }

        @Test
        @DisplayName("canonical form is lowercase")
        void lowercaseForm() {
            assertEquals("degraded", StateAggregator.toStateString(EntityState.DEGRADED));
        }

        @Test
        @DisplayName("UNKNOWN renders as the literal Unknown")
        void unknownLiteral() {
            assertEquals("Unknown", StateAggregator.toStateString(EntityState.UNKNOWN));
        }

        @ParameterizedTest
        @ValueSource(strings = {"garbage", "", "unknown", "paused"})
        @DisplayName("unrecognised strings are UNKNOWN")
        void unrecognised(String raw) {
            assertEquals(EntityState.UNKNOWN, StateAggregator.fromStateString(raw));
        }
    }
}
