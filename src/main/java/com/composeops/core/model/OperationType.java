package com.composeops.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of long-running compose action being tracked.
 */
public enum OperationType {
    COMPOSE_UP("compose_up"),
    COMPOSE_DOWN("compose_down"),
    COMPOSE_BUILD("compose_build"),
    COMPOSE_PULL("compose_pull"),
    COMPOSE_RESTART("compose_restart"),
    COMPOSE_START("compose_start"),
    COMPOSE_STOP("compose_stop");

    private static final String PREFIX = "compose_";

    private final String value;

    OperationType(String value) {
        this.value = value;
    }

    /** Wire value, e.g. {@code "compose_up"}. */
    public String value() {
        return value;
    }

    /**
     * Parses a wire value ({@code compose_up}), an enum name ({@code COMPOSE_UP}) or the
     * short form ({@code up}), ignoring case.
     */
    public static Optional<OperationType> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (OperationType type : values()) {
            if (type.value.equals(normalized) || type.value.equals(PREFIX + normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
