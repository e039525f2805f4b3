package com.composeops.core.operations;

import com.composeops.core.events.GroupBroadcaster;
import com.composeops.core.events.OperationProgress;
import com.composeops.core.logging.MdcContext;
import com.composeops.core.metrics.ComposeOpsMetrics;
import com.composeops.core.model.Operation;
import com.composeops.core.model.OperationFilter;
import com.composeops.core.model.OperationStatus;
import com.composeops.core.model.OperationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single source of truth for the lifecycle of long-running compose operations.
 * <p>
 * Operations live in a concurrent map; each one is mutated under its own monitor, so
 * transitions on one id are atomic and ordered while unrelated ids never contend. Every
 * transition queues an {@link OperationProgress} for the operation's subscribers from inside
 * that critical section, so updates reach each subscriber in transition order. Sending happens
 * on broadcaster threads and never under the record monitor.
 * Reads return immutable {@link Operation} snapshots.
 */
@Service
public class OperationRegistry {

    private static final Logger log = LoggerFactory.getLogger(OperationRegistry.class);

    private static final Comparator<Operation> NEWEST_FIRST =
            Comparator.comparing(Operation::startedAt).reversed();

    private final ConcurrentHashMap<String, OperationRecord> operations = new ConcurrentHashMap<>();

    private final GroupBroadcaster broadcaster;
    private final ComposeOpsMetrics metrics;
    private final OperationProperties properties;
    private final Clock clock;

    @Autowired
    public OperationRegistry(GroupBroadcaster broadcaster, ComposeOpsMetrics metrics,
                             OperationProperties properties) {
        this(broadcaster, metrics, properties, Clock.systemUTC());
    }

    OperationRegistry(GroupBroadcaster broadcaster, ComposeOpsMetrics metrics,
                      OperationProperties properties, Clock clock) {
        this.broadcaster = broadcaster;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Creates a pending operation from a type name such as {@code "compose_up"} or {@code "up"}.
     *
     * @throws InvalidOperationArgumentException if the type is not a known operation kind
     */
    public Operation create(String type, String projectPath, String projectName, String initiatedBy) {
        OperationType parsed = OperationType.fromValue(type)
                .orElseThrow(() -> new InvalidOperationArgumentException("Unknown operation type: " + type));
        return create(parsed, projectPath, projectName, initiatedBy);
    }

    public Operation create(OperationType type, String projectPath, String projectName, String initiatedBy) {
        if (type == null) {
            throw new InvalidOperationArgumentException("Operation type is required");
        }
        String id = UUID.randomUUID().toString();
        var record = new OperationRecord(id, type, projectName, projectPath, initiatedBy, clock.instant());
        operations.put(id, record);
        metrics.recordOperationCreated(type.value());

        MdcContext.setOperation(id);
        try {
            log.info("Created operation {} (type={}, project={}, initiatedBy={})",
                    id, type.value(), projectName, initiatedBy);
        } finally {
            MdcContext.clear();
        }
        return record.snapshot(true);
    }

    /**
     * Moves an operation to a new status, optionally updating progress and error message,
     * and notifies its subscribers.
     *
     * @throws OperationNotFoundException        if the id is unknown
     * @throws InvalidTransitionException        if the status is unreachable from the current one
     * @throws InvalidOperationArgumentException if progress is outside 0-100
     */
    public Operation transition(String id, OperationStatus newStatus, Integer progress, String errorMessage) {
        if (newStatus == null) {
            throw new InvalidOperationArgumentException("Target status is required");
        }
        if (progress != null && (progress < 0 || progress > 100)) {
            throw new InvalidOperationArgumentException("Progress must be between 0 and 100, got " + progress);
        }
        OperationRecord record = require(id);

        Operation snapshot;
        synchronized (record) {
            OperationStatus current = record.status();
            if (!current.canTransitionTo(newStatus)) {
                log.warn("Rejected transition of operation {} from {} to {}", id, current.value(), newStatus.value());
                throw new InvalidTransitionException(id, current, newStatus);
            }
            Instant now = clock.instant();
            record.apply(newStatus, progress, errorMessage, now);
            snapshot = record.snapshot(false);
            broadcaster.publish(id, OperationProgress.from(snapshot));
        }

        metrics.recordTransition(newStatus.value());
        if (newStatus.isTerminal()) {
            metrics.recordOperationDuration(snapshot.type().value(), newStatus.value(),
                    Duration.between(snapshot.startedAt(), snapshot.completedAt()));
        }
        log.info("Operation {} -> {} (progress={})", id, newStatus.value(), snapshot.progress());
        return snapshot;
    }

    public Operation transition(String id, OperationStatus newStatus) {
        return transition(id, newStatus, null, null);
    }

    /**
     * Cancels a pending or running operation.
     *
     * @throws InvalidTransitionException if the operation already finished
     */
    public Operation cancel(String id) {
        return transition(id, OperationStatus.CANCELLED, null, null);
    }

    /**
     * Appends one log entry. Output arriving after the operation finished is still kept.
     *
     * @throws OperationNotFoundException if the id is unknown
     */
    public void appendLog(String id, String text) {
        OperationRecord record = require(id);
        if (text == null) {
            return;
        }
        record.appendLog(text);
        if (record.status().isTerminal()) {
            log.debug("Retained late log output for terminal operation {}", id);
        }
    }

    /**
     * @throws OperationNotFoundException if the id is unknown
     */
    public Operation get(String id) {
        return require(id).snapshot(true);
    }

    public Optional<Operation> find(String id) {
        OperationRecord record = id != null ? operations.get(id) : null;
        return record != null ? Optional.of(record.snapshot(true)) : Optional.empty();
    }

    /**
     * Lists operations matching the filter, newest first. Summaries carry no log text.
     *
     * @throws InvalidOperationArgumentException if the limit is below 1 or the range is inverted
     */
    public List<Operation> list(OperationFilter filter) {
        OperationFilter effective = filter != null ? filter : OperationFilter.all();
        int limit = resolveLimit(effective.limit());
        if (effective.startedFrom() != null && effective.startedTo() != null
                && effective.startedFrom().isAfter(effective.startedTo())) {
            throw new InvalidOperationArgumentException("Range start must not be after range end");
        }

        return operations.values().stream()
                .filter(r -> r.matchesInitiator(effective.initiatedBy()))
                .map(r -> r.snapshot(false))
                .filter(op -> effective.status() == null || op.status() == effective.status())
                .filter(op -> effective.startedFrom() == null || !op.startedAt().isBefore(effective.startedFrom()))
                .filter(op -> effective.startedTo() == null || !op.startedAt().isAfter(effective.startedTo()))
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .toList();
    }

    /**
     * Reads log entries after {@code fromIndex} without blocking.
     */
    public LogSlice readLog(String id, int fromIndex) {
        return require(id).readLog(fromIndex);
    }

    /**
     * Reads log entries after {@code fromIndex}, waiting up to {@code maxWait} for new output
     * while the operation is still active.
     */
    public LogSlice awaitLog(String id, int fromIndex, Duration maxWait) throws InterruptedException {
        return require(id).awaitLog(fromIndex, maxWait.toMillis());
    }

    /**
     * Number of operations that are pending or running.
     */
    public long activeCount() {
        return operations.values().stream()
                .filter(r -> !r.status().isTerminal())
                .count();
    }

    /**
     * Removes terminal operations that completed before the cutoff. A record is only removed
     * while its monitor is held and it is still the mapped value, so concurrent readers see
     * either the full snapshot or nothing.
     *
     * @return number of operations evicted
     */
    public int evictCompletedBefore(Instant cutoff) {
        int evicted = 0;
        for (OperationRecord record : operations.values()) {
            synchronized (record) {
                Instant completedAt = record.completedAt();
                if (record.status().isTerminal() && completedAt != null && completedAt.isBefore(cutoff)
                        && operations.remove(record.id(), record)) {
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            metrics.recordEvictions(evicted);
            log.info("Evicted {} operation(s) completed before {}", evicted, cutoff);
        }
        return evicted;
    }

    public int size() {
        return operations.size();
    }

    private int resolveLimit(Integer requested) {
        if (requested == null) {
            return properties.getDefaultListLimit();
        }
        if (requested < 1) {
            throw new InvalidOperationArgumentException("Limit must be at least 1, got " + requested);
        }
        return Math.min(requested, properties.getMaxListLimit());
    }

    private OperationRecord require(String id) {
        OperationRecord record = id != null ? operations.get(id) : null;
        if (record == null) {
            throw new OperationNotFoundException(id);
        }
        return record;
    }
}
