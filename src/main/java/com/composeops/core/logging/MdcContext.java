package com.composeops.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing ComposeOps-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String OPERATION_ID = "operationId";
    public static final String CONNECTION_ID = "connectionId";
    public static final String STREAM_SESSION_ID = "streamSessionId";

    private MdcContext() {}

    public static void setOperation(String operationId) {
        MDC.put(OPERATION_ID, operationId);
    }

    public static void setConnection(String connectionId) {
        MDC.put(CONNECTION_ID, connectionId);
    }

    public static void setStream(String connectionId, String sessionId) {
        MDC.put(CONNECTION_ID, connectionId);
        MDC.put(STREAM_SESSION_ID, sessionId);
    }

    public static void clear() {
        MDC.remove(OPERATION_ID);
        MDC.remove(CONNECTION_ID);
        MDC.remove(STREAM_SESSION_ID);
    }
}
