package com.composeops.core.streaming;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "composeops.streaming")
public class StreamingProperties {

    /** Lifetime of an SSE connection before the server closes it. */
    private Duration emitterTimeout = Duration.ofMinutes(30);

    /** Interval between SSE heartbeat comments. */
    private Duration heartbeatInterval = Duration.ofSeconds(30);

    /**
     * Follow compose project logs until stopped. When false the project's current logs are
     * fetched once and the stream completes.
     */
    private boolean followComposeLogs = true;

    /** Lines of history read when a request names no tail. */
    private int defaultTail = 100;

    /** Upper bound on how long an operation log follower waits before re-checking cancellation. */
    private Duration operationLogPollInterval = Duration.ofMillis(250);

    /** How long shutdown waits for stream workers to finish after cancelling them. */
    private Duration shutdownGrace = Duration.ofSeconds(5);

    public Duration getEmitterTimeout() {
        return emitterTimeout;
    }

    public void setEmitterTimeout(Duration emitterTimeout) {
        this.emitterTimeout = emitterTimeout;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public void setHeartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = heartbeatInterval;
    }

    public boolean isFollowComposeLogs() {
        return followComposeLogs;
    }

    public void setFollowComposeLogs(boolean followComposeLogs) {
        this.followComposeLogs = followComposeLogs;
    }

    public int getDefaultTail() {
        return defaultTail;
    }

    public void setDefaultTail(int defaultTail) {
        this.defaultTail = defaultTail;
    }

    public Duration getOperationLogPollInterval() {
        return operationLogPollInterval;
    }

    public void setOperationLogPollInterval(Duration operationLogPollInterval) {
        this.operationLogPollInterval = operationLogPollInterval;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public void setShutdownGrace(Duration shutdownGrace) {
        this.shutdownGrace = shutdownGrace;
    }
}
