package com.composeops.core.streaming;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Cooperative cancellation signal threaded through a log source.
 * <p>
 * Sources check {@link #throwIfCancellationRequested()} before each unit of output and may
 * register {@link #onCancel(Runnable)} callbacks to unblock reads (destroy a process, close a
 * docker log stream). Callbacks run once, on the thread that cancels, or immediately when
 * registered after cancellation.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private volatile boolean cancelled;
    private final List<Runnable> callbacks = new ArrayList<>();

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancellationRequested() {
        if (cancelled) {
            throw new StreamCancelledException("Stream cancelled");
        }
    }

    /**
     * Requests cancellation. Only the first call has any effect.
     *
     * @return true if this call cancelled the token
     */
    public boolean cancel() {
        List<Runnable> toRun;
        synchronized (callbacks) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            toRun = List.copyOf(callbacks);
            callbacks.clear();
        }
        toRun.forEach(CancellationToken::runSafely);
        return true;
    }

    public void onCancel(Runnable callback) {
        synchronized (callbacks) {
            if (!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        runSafely(callback);
    }

    private static void runSafely(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }
}
