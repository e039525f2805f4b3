package com.composeops.core.model;

/**
 * State of a single compose service as reported by the process runner.
 *
 * @param name     service name
 * @param rawState raw state string, e.g. "running", "exited" (case varies by source)
 */
public record ServiceState(
    String name,
    String rawState
) {}
