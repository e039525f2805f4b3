package com.composeops.core.streaming;

import com.composeops.core.operations.LogSlice;
import com.composeops.core.operations.OperationNotFoundException;
import com.composeops.core.operations.OperationRegistry;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Replays an operation's log entries, then follows new ones until the operation is terminal
 * and everything has been sent.
 */
public class OperationLogSource implements LogSource {

    private final OperationRegistry registry;
    private final String operationId;
    private final Duration pollInterval;

    public OperationLogSource(OperationRegistry registry, String operationId, Duration pollInterval) {
        this.registry = registry;
        this.operationId = operationId;
        this.pollInterval = pollInterval;
    }

    @Override
    public void stream(Consumer<String> chunks, CancellationToken token) throws InterruptedException {
        int next = 0;
        while (true) {
            token.throwIfCancellationRequested();
            LogSlice slice;
            try {
                slice = registry.awaitLog(operationId, next, pollInterval);
            } catch (OperationNotFoundException e) {
                throw new StreamFailureException("Operation " + operationId + " is no longer available");
            }
            if (slice.drained()) {
                return;
            }
            for (String entry : slice.entries()) {
                chunks.accept(entry);
            }
            next = slice.nextIndex();
        }
    }

    @Override
    public String describe() {
        return "operation";
    }
}
