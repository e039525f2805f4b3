package com.composeops.core.operations;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "composeops.operations")
public class OperationProperties {

    /** Terminal operations completed longer ago than this are evicted. */
    private Duration retention = Duration.ofHours(24);

    /** How often the retention sweep runs. */
    private Duration evictionInterval = Duration.ofMinutes(10);

    private int defaultListLimit = 100;
    private int maxListLimit = 1000;

    public Duration getRetention() {
        return retention;
    }

    public void setRetention(Duration retention) {
        this.retention = retention;
    }

    public Duration getEvictionInterval() {
        return evictionInterval;
    }

    public void setEvictionInterval(Duration evictionInterval) {
        this.evictionInterval = evictionInterval;
    }

    public int getDefaultListLimit() {
        return defaultListLimit;
    }

    public void setDefaultListLimit(int defaultListLimit) {
        this.defaultListLimit = defaultListLimit;
    }

    public int getMaxListLimit() {
        return maxListLimit;
    }

    public void setMaxListLimit(int maxListLimit) {
        this.maxListLimit = maxListLimit;
    }
}
