package com.composeops.core.streaming;

/**
 * Event names emitted to a connection during a log stream.
 */
public final class StreamEvents {

    /** One chunk of log output. */
    public static final String RECEIVE_LOGS = "ReceiveLogs";

    /** Terminal: the stream failed. */
    public static final String LOG_ERROR = "LogError";

    /** Terminal: the stream ended gracefully. */
    public static final String STREAM_COMPLETE = "StreamComplete";

    /** LogError text for failures that carry no client-facing message. */
    public static final String DEFAULT_ERROR_MESSAGE = "Error streaming logs";

    private StreamEvents() {}
}
