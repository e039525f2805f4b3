package com.composeops.core.streaming;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void freshTokenIsNotCancelled() {
        var token = new CancellationToken();

        assertFalse(token.isCancelled());
        assertDoesNotThrow(token::throwIfCancellationRequested);
    }

    @Test
    void cancelRunsCallbacksOnce() {
        var token = new CancellationToken();
        var calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        assertTrue(token.cancel());
        assertFalse(token.cancel());

        assertEquals(1, calls.get());
        assertTrue(token.isCancelled());
        assertThrows(StreamCancelledException.class, token::throwIfCancellationRequested);
    }

    @Test
    void callbackRegisteredAfterCancelRunsImmediately() {
        var token = new CancellationToken();
        token.cancel();
        var calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void failingCallbackDoesNotStopTheOthers() {
        var token = new CancellationToken();
        var calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(calls::incrementAndGet);

        token.cancel();

        assertEquals(1, calls.get());
    }
}
