package com.composeops.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/connections/{cid}/streams/compose.
 *
 * @param projectPath compose project directory
 * @param service     single service to read; nullable for all services
 * @param tail        lines of history; nullable for all
 * @param follow      keep following; nullable for the server default
 */
public record ComposeLogStreamRequest(
    @JsonProperty("project_path") String projectPath,
    String service,
    Integer tail,
    Boolean follow
) {}
