package com.composeops.docker;

import com.composeops.core.streaming.CancellationToken;
import com.composeops.core.streaming.LogSource;

import java.util.List;
import java.util.function.Consumer;

/**
 * The last N lines of one container, one chunk per line, optionally followed.
 */
public class ContainerLogSource implements LogSource {

    private final ContainerLogReader reader;
    private final String containerId;
    private final int tail;
    private final boolean timestamps;
    private final boolean follow;

    public ContainerLogSource(ContainerLogReader reader, String containerId, int tail,
                              boolean timestamps, boolean follow) {
        this.reader = reader;
        this.containerId = containerId;
        this.tail = tail;
        this.timestamps = timestamps;
        this.follow = follow;
    }

    @Override
    public void stream(Consumer<String> chunks, CancellationToken token) throws InterruptedException {
        if (follow) {
            reader.followLogs(containerId, tail, timestamps, chunks, token);
            return;
        }
        List<String> lines = reader.readLogs(containerId, tail, timestamps);
        for (String line : lines) {
            token.throwIfCancellationRequested();
            chunks.accept(line);
        }
    }

    @Override
    public String describe() {
        return "container";
    }
}
