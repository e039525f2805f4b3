package com.composeops.core.operations;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Periodically evicts terminal operations older than the configured retention.
 */
@Component
public class OperationRetentionTask {

    private static final Logger log = LoggerFactory.getLogger(OperationRetentionTask.class);

    private final OperationRegistry registry;
    private final OperationProperties properties;
    private final Clock clock;

    @Autowired
    public OperationRetentionTask(OperationRegistry registry, OperationProperties properties) {
        this(registry, properties, Clock.systemUTC());
    }

    OperationRetentionTask(OperationRegistry registry, OperationProperties properties, Clock clock) {
        this.registry = registry;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "#{@operationProperties.evictionInterval.toMillis()}",
            initialDelayString = "#{@operationProperties.evictionInterval.toMillis()}")
    public void sweep() {
        Instant cutoff = clock.instant().minus(properties.getRetention());
        log.debug("Running operation retention sweep (cutoff={})", cutoff);
        try {
            registry.evictCompletedBefore(cutoff);
        } catch (RuntimeException e) {
            log.error("Operation retention sweep failed", e);
        }
    }
}
