package com.composeops.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/operations.
 *
 * @param type        operation kind, e.g. "compose_up" or "up"
 * @param projectPath compose project directory; nullable
 * @param projectName compose project name; nullable
 * @param initiatedBy principal that started the operation; ignored when the request carries an authenticated principal
 */
public record CreateOperationRequest(
    String type,
    @JsonProperty("project_path") String projectPath,
    @JsonProperty("project_name") String projectName,
    @JsonProperty("initiated_by") String initiatedBy
) {}
