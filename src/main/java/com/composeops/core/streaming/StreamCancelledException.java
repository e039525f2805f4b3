package com.composeops.core.streaming;

/**
 * Raised at a cooperative checkpoint once a stream has been asked to stop. Never surfaced
 * to clients; the session ends without a terminal event.
 */
public class StreamCancelledException extends RuntimeException {

    public StreamCancelledException(String message) {
        super(message);
    }
}
