package com.composeops.core.model;

import java.time.Instant;

/**
 * Immutable snapshot of a tracked operation, as handed out by the operation registry.
 *
 * @param id           opaque unique id
 * @param type         operation kind
 * @param status       lifecycle status at snapshot time
 * @param progress     0-100
 * @param projectName  compose project name (nullable)
 * @param projectPath  compose project directory (nullable)
 * @param initiatedBy  principal that started the operation (nullable)
 * @param startedAt    creation time
 * @param completedAt  time the operation reached a terminal status (nullable)
 * @param errorMessage failure detail (nullable)
 * @param logs         accumulated log text, entries joined by newlines (null in list summaries)
 */
public record Operation(
    String id,
    OperationType type,
    OperationStatus status,
    int progress,
    String projectName,
    String projectPath,
    String initiatedBy,
    Instant startedAt,
    Instant completedAt,
    String errorMessage,
    String logs
) {

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
