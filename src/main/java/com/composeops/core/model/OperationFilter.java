package com.composeops.core.model;

import java.time.Instant;

/**
 * Criteria for listing operations. Null fields do not filter.
 *
 * @param status      only operations in this status
 * @param initiatedBy only operations started by this principal
 * @param startedFrom only operations started at or after this instant
 * @param startedTo   only operations started at or before this instant
 * @param limit       maximum number of results (null means the configured default)
 */
public record OperationFilter(
    OperationStatus status,
    String initiatedBy,
    Instant startedFrom,
    Instant startedTo,
    Integer limit
) {

    public static OperationFilter all() {
        return new OperationFilter(null, null, null, null, null);
    }

    public OperationFilter withStatus(OperationStatus status) {
        return new OperationFilter(status, initiatedBy, startedFrom, startedTo, limit);
    }

    public OperationFilter withInitiatedBy(String initiatedBy) {
        return new OperationFilter(status, initiatedBy, startedFrom, startedTo, limit);
    }

    public OperationFilter withRange(Instant from, Instant to) {
        return new OperationFilter(status, initiatedBy, from, to, limit);
    }

    public OperationFilter withLimit(Integer limit) {
        return new OperationFilter(status, initiatedBy, startedFrom, startedTo, limit);
    }
}
