package com.composeops.dispatch.api;

import com.composeops.core.model.Operation;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Operation with its full log text.
 */
public record OperationDetail(
    String id,
    String type,
    String status,
    int progress,
    @JsonProperty("project_name") String projectName,
    @JsonProperty("project_path") String projectPath,
    @JsonProperty("initiated_by") String initiatedBy,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt,
    @JsonProperty("error_message") String errorMessage,
    String logs
) {

    static OperationDetail from(Operation operation) {
        return new OperationDetail(
                operation.id(),
                operation.type().value(),
                operation.status().value(),
                operation.progress(),
                operation.projectName(),
                operation.projectPath(),
                operation.initiatedBy(),
                operation.startedAt(),
                operation.completedAt(),
                operation.errorMessage(),
                operation.logs() != null ? operation.logs() : ""
        );
    }
}
