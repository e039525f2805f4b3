package com.composeops.docker;

import com.composeops.core.streaming.CancellationToken;

import java.util.List;
import java.util.function.Consumer;

/**
 * Reads the log output of a single container.
 */
public interface ContainerLogReader {

    /**
     * Reads the last {@code tailLines} lines and returns.
     *
     * @throws com.composeops.core.streaming.StreamFailureException if the logs cannot be read
     */
    List<String> readLogs(String containerId, int tailLines, boolean withTimestamps) throws InterruptedException;

    /**
     * Reads the last {@code tailLines} lines, then keeps delivering new lines until the
     * container stops or the token is cancelled.
     */
    void followLogs(String containerId, int tailLines, boolean withTimestamps,
                    Consumer<String> lines, CancellationToken token) throws InterruptedException;
}
