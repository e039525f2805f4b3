package com.composeops.core.operations;

import com.composeops.core.model.OperationStatus;

/**
 * Thrown when a requested status is not reachable from an operation's current status.
 */
public class InvalidTransitionException extends IllegalStateException {

    private final String operationId;
    private final OperationStatus from;
    private final OperationStatus to;

    public InvalidTransitionException(String operationId, OperationStatus from, OperationStatus to) {
        super("Operation " + operationId + " cannot move from " + from.value() + " to "
                + (to != null ? to.value() : "null"));
        this.operationId = operationId;
        this.from = from;
        this.to = to;
    }

    public String getOperationId() {
        return operationId;
    }

    public OperationStatus getFrom() {
        return from;
    }

    public OperationStatus getTo() {
        return to;
    }
}
