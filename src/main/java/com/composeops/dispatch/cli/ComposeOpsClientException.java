package com.composeops.dispatch.cli;

/**
 * The server answered with an unexpected HTTP status.
 */
public class ComposeOpsClientException extends RuntimeException {

    private final int statusCode;

    public ComposeOpsClientException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
