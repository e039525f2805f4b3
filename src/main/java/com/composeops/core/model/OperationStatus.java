package com.composeops.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle status of a tracked operation.
 * <p>
 * {@code PENDING -> RUNNING -> {COMPLETED, FAILED, CANCELLED}}. A pending operation may also
 * end directly (rejected before it started, or cancelled while queued). {@code RUNNING -> RUNNING}
 * is allowed so progress can be reported. Terminal states are final.
 */
public enum OperationStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    OperationStatus(String value) {
        this.value = value;
    }

    /** Wire value, e.g. {@code "running"}. */
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(OperationStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        return switch (this) {
            case PENDING -> next != PENDING;
            case RUNNING -> next != PENDING;
            default -> false;
        };
    }

    public static Optional<OperationStatus> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (OperationStatus status : values()) {
            if (status.value.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
