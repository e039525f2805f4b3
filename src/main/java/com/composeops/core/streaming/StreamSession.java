package com.composeops.core.streaming;

import com.composeops.core.connection.EventChannel;

import java.io.IOException;

/**
 * Live binding between one connection and one log source.
 * <p>
 * All emissions go through the session monitor. Once {@link #cancel()} returns no further
 * event is sent, and at most one terminal event is ever sent.
 */
public final class StreamSession {

    private final String id;
    private final String connectionId;
    private final EventChannel channel;
    private final LogSource source;
    private final CancellationToken token = new CancellationToken();

    private boolean cancelled;
    private boolean terminated;

    StreamSession(String id, String connectionId, EventChannel channel, LogSource source) {
        this.id = id;
        this.connectionId = connectionId;
        this.channel = channel;
        this.source = source;
    }

    public String id() {
        return id;
    }

    public String connectionId() {
        return connectionId;
    }

    LogSource source() {
        return source;
    }

    CancellationToken token() {
        return token;
    }

    /**
     * Sends one {@code ReceiveLogs} chunk.
     *
     * @throws StreamCancelledException if the session was cancelled
     * @throws StreamFailureException   if the chunk could not be delivered
     */
    void emitChunk(String chunk) {
        synchronized (this) {
            if (cancelled) {
                throw new StreamCancelledException("Stream " + id + " cancelled");
            }
            try {
                channel.send(StreamEvents.RECEIVE_LOGS, chunk);
            } catch (IOException e) {
                throw new StreamFailureException("Failed to deliver log output", e);
            }
        }
    }

    /**
     * Sends {@code StreamComplete} unless the session was cancelled or already terminated.
     *
     * @return true if the terminal event was sent by this call
     */
    boolean complete() throws IOException {
        return terminate(StreamEvents.STREAM_COMPLETE, null);
    }

    /**
     * Sends {@code LogError(message)} unless the session was cancelled or already terminated.
     *
     * @return true if the terminal event was sent by this call
     */
    boolean fail(String message) throws IOException {
        return terminate(StreamEvents.LOG_ERROR, message);
    }

    /**
     * Marks the session cancelled and fires the token's callbacks. Idempotent.
     */
    void cancel() {
        synchronized (this) {
            cancelled = true;
        }
        token.cancel();
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    private boolean terminate(String eventName, String data) throws IOException {
        synchronized (this) {
            if (cancelled || terminated) {
                return false;
            }
            terminated = true;
            channel.send(eventName, data);
            return true;
        }
    }
}
