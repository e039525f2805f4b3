package com.composeops.core.model;

/**
 * Aggregate state of a multi-service deployment (a compose project).
 * <p>
 * {@link #UNKNOWN} marks input that could not be parsed; aggregation never produces it.
 */
public enum EntityState {
    DOWN,
    RUNNING,
    DEGRADED,
    RESTARTING,
    EXITED,
    STOPPED,
    CREATED,
    UNKNOWN
}
