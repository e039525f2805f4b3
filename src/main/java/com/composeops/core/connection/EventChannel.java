package com.composeops.core.connection;

import java.io.IOException;

/**
 * Outbound side of one client connection. Implementations turn named events into wire
 * messages (SSE frames, websocket messages, ...).
 */
@FunctionalInterface
public interface EventChannel {

    /**
     * Pushes one event to the client.
     *
     * @param eventName event name, e.g. {@code "ReceiveLogs"}
     * @param data      payload; {@code null} for events that carry none
     * @throws IOException when the connection can no longer be written to
     */
    void send(String eventName, Object data) throws IOException;
}
