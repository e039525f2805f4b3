package com.composeops.docker;

import com.composeops.core.model.EntityState;
import com.composeops.core.model.ServiceState;

import java.util.List;

/**
 * Aggregate state of a compose project with the per-service states it was derived from.
 */
public record ProjectStatus(
    String projectPath,
    EntityState state,
    List<ServiceState> services
) {}
