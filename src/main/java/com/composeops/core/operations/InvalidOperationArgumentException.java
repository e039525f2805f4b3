package com.composeops.core.operations;

/**
 * Thrown for a malformed operation type, status, progress value or list filter.
 */
public class InvalidOperationArgumentException extends IllegalArgumentException {

    public InvalidOperationArgumentException(String message) {
        super(message);
    }
}
