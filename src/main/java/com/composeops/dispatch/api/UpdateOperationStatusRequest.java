package com.composeops.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for PUT /api/v1/operations/{id}/status.
 *
 * @param status       target status wire value, e.g. "running"
 * @param progress     0-100; nullable, keeps the current progress
 * @param errorMessage failure detail; nullable
 */
public record UpdateOperationStatusRequest(
    String status,
    Integer progress,
    @JsonProperty("error_message") String errorMessage
) {}
