package com.composeops.docker;

/**
 * A compose CLI command failed or produced output that could not be understood.
 */
public class ComposeCommandException extends RuntimeException {

    public ComposeCommandException(String message) {
        super(message);
    }

    public ComposeCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
