package com.composeops.core.events;

import com.composeops.core.model.Operation;

/**
 * Payload pushed to subscribers of an operation each time its status or progress changes.
 *
 * @param operationId  the operation that changed
 * @param type         operation kind wire value, e.g. "compose_up"
 * @param status       status wire value after the change, e.g. "running"
 * @param progress     0-100
 * @param projectName  compose project name (nullable)
 * @param errorMessage failure detail (nullable)
 * @param logs         log text carried with the update (nullable)
 */
public record OperationProgress(
    String operationId,
    String type,
    String status,
    int progress,
    String projectName,
    String errorMessage,
    String logs
) {

    /** Event name used on the wire. */
    public static final String EVENT_NAME = "OperationProgress";

    public static OperationProgress from(Operation operation) {
        return new OperationProgress(
                operation.id(),
                operation.type().value(),
                operation.status().value(),
                operation.progress(),
                operation.projectName(),
                operation.errorMessage(),
                null
        );
    }
}
