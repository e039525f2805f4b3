package com.composeops.core.operations;

import com.composeops.core.model.Operation;
import com.composeops.core.model.OperationStatus;
import com.composeops.core.model.OperationType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one operation. Every access goes through the record's monitor, which is
 * also what log followers wait on.
 */
final class OperationRecord {

    private final String id;
    private final OperationType type;
    private final String projectName;
    private final String projectPath;
    private final String initiatedBy;
    private final Instant startedAt;

    private OperationStatus status = OperationStatus.PENDING;
    private int progress;
    private Instant completedAt;
    private String errorMessage;
    private final List<String> logEntries = new ArrayList<>();

    OperationRecord(String id, OperationType type, String projectName, String projectPath,
                    String initiatedBy, Instant startedAt) {
        this.id = id;
        this.type = type;
        this.projectName = projectName;
        this.projectPath = projectPath;
        this.initiatedBy = initiatedBy;
        this.startedAt = startedAt;
    }

    String id() {
        return id;
    }

    OperationType type() {
        return type;
    }

    Instant startedAt() {
        return startedAt;
    }

    synchronized OperationStatus status() {
        return status;
    }

    synchronized Instant completedAt() {
        return completedAt;
    }

    /**
     * Applies a transition. Callers hold the monitor so they can publish the resulting
     * snapshot before any other transition on this record.
     */
    void apply(OperationStatus next, Integer newProgress, String newErrorMessage, Instant now) {
        status = next;
        if (newProgress != null) {
            progress = newProgress;
        }
        if (newErrorMessage != null) {
            errorMessage = newErrorMessage;
        }
        if (next.isTerminal()) {
            completedAt = now;
        }
        notifyAll();
    }

    synchronized void appendLog(String text) {
        logEntries.add(text);
        notifyAll();
    }

    synchronized LogSlice readLog(int fromIndex) {
        int start = Math.max(0, Math.min(fromIndex, logEntries.size()));
        List<String> entries = List.copyOf(logEntries.subList(start, logEntries.size()));
        return new LogSlice(entries, logEntries.size(), status.isTerminal());
    }

    /**
     * Waits until entries past {@code fromIndex} exist, the operation is terminal, or the
     * timeout elapses, then reads.
     */
    synchronized LogSlice awaitLog(int fromIndex, long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (logEntries.size() <= fromIndex && !status.isTerminal()) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                break;
            }
            wait(remaining);
        }
        return readLog(fromIndex);
    }

    synchronized Operation snapshot(boolean includeLogs) {
        return new Operation(
                id,
                type,
                status,
                progress,
                projectName,
                projectPath,
                initiatedBy,
                startedAt,
                completedAt,
                errorMessage,
                includeLogs ? String.join("\n", logEntries) : null
        );
    }

    boolean matchesInitiator(String principal) {
        return principal == null || principal.equals(initiatedBy);
    }
}
