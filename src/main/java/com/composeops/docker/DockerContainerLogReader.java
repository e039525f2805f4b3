package com.composeops.docker;

import com.composeops.core.streaming.CancellationToken;
import com.composeops.core.streaming.StreamFailureException;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.LogContainerCmd;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * {@link ContainerLogReader} backed by the docker-java {@code logs} API.
 */
@Component
public class DockerContainerLogReader implements ContainerLogReader {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerLogReader.class);

    private static final long POLL_MILLIS = 200;

    private final DockerClient dockerClient;
    private final DockerProperties properties;

    public DockerContainerLogReader(DockerClient dockerClient, DockerProperties properties) {
        this.dockerClient = dockerClient;
        this.properties = properties;
    }

    @Override
    public List<String> readLogs(String containerId, int tailLines, boolean withTimestamps)
            throws InterruptedException {
        List<String> lines = new ArrayList<>();
        var callback = new LineCallback(lines::add);
        try {
            logCommand(containerId, tailLines, withTimestamps)
                    .withFollowStream(false)
                    .exec(callback);
            if (!callback.awaitCompletion(properties.getCommandTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                closeQuietly(callback);
                throw new StreamFailureException("Timed out reading logs of container " + containerId);
            }
        } catch (NotFoundException e) {
            throw containerNotFound(containerId);
        } catch (RuntimeException e) {
            if (e instanceof StreamFailureException) {
                throw e;
            }
            throw translate(containerId, e);
        }
        rethrowFailure(containerId, callback);
        log.debug("Read {} log line(s) from container {}", lines.size(), containerId);
        return lines;
    }

    @Override
    public void followLogs(String containerId, int tailLines, boolean withTimestamps,
                           Consumer<String> lines, CancellationToken token) throws InterruptedException {
        BlockingQueue<String> queue = new LinkedBlockingQueue<>();
        var callback = new LineCallback(queue::add);
        token.onCancel(() -> closeQuietly(callback));
        try {
            logCommand(containerId, tailLines, withTimestamps)
                    .withFollowStream(true)
                    .exec(callback);
        } catch (NotFoundException e) {
            throw containerNotFound(containerId);
        }

        try {
            while (true) {
                token.throwIfCancellationRequested();
                String line = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (line != null) {
                    lines.accept(line);
                } else if (callback.finished) {
                    String rest;
                    while ((rest = queue.poll()) != null) {
                        token.throwIfCancellationRequested();
                        lines.accept(rest);
                    }
                    if (!token.isCancelled()) {
                        rethrowFailure(containerId, callback);
                    }
                    return;
                }
            }
        } finally {
            closeQuietly(callback);
        }
    }

    private LogContainerCmd logCommand(String containerId, int tailLines, boolean withTimestamps) {
        return dockerClient.logContainerCmd(containerId)
                .withStdOut(true)
                .withStdErr(true)
                .withTail(tailLines)
                .withTimestamps(withTimestamps);
    }

    private static void rethrowFailure(String containerId, LineCallback callback) {
        Throwable failure = callback.failure;
        if (failure == null) {
            return;
        }
        if (failure instanceof NotFoundException) {
            throw containerNotFound(containerId);
        }
        throw translate(containerId, failure);
    }

    private static StreamFailureException containerNotFound(String containerId) {
        return new StreamFailureException("Container not found: " + containerId);
    }

    private static StreamFailureException translate(String containerId, Throwable cause) {
        log.warn("Reading logs of container {} failed: {}", containerId, cause.getMessage());
        return new StreamFailureException("Failed to read logs of container " + containerId, cause);
    }

    private static void closeQuietly(LineCallback callback) {
        try {
            callback.close();
        } catch (IOException e) {
            log.debug("Closing log callback failed: {}", e.getMessage());
        }
    }

    /**
     * Turns docker frames into complete lines.
     */
    private static final class LineCallback extends ResultCallback.Adapter<Frame> {

        private final LineBuffer buffer = new LineBuffer();
        private final Consumer<String> sink;
        private volatile boolean finished;
        private volatile Throwable failure;

        private LineCallback(Consumer<String> sink) {
            this.sink = sink;
        }

        @Override
        public void onNext(Frame frame) {
            buffer.append(frame.getPayload()).forEach(sink);
        }

        @Override
        public void onError(Throwable throwable) {
            failure = throwable;
            finished = true;
            super.onError(throwable);
        }

        @Override
        public void onComplete() {
            buffer.flush().forEach(sink);
            finished = true;
            super.onComplete();
        }
    }
}
