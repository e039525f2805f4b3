package com.composeops.core.streaming;

/**
 * Failure while producing stream output. The message is sent to the client verbatim as the
 * {@code LogError} payload, so it should be short and free of internals.
 */
public class StreamFailureException extends RuntimeException {

    public StreamFailureException(String message) {
        super(message);
    }

    public StreamFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
