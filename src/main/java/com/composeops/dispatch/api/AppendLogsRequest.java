package com.composeops.dispatch.api;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/operations/{id}/logs. Either field may be used; entries
 * in {@code lines} are appended after {@code text}.
 */
public record AppendLogsRequest(
    String text,
    List<String> lines
) {}
