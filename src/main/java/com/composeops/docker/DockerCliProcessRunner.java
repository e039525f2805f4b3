package com.composeops.docker;

import com.composeops.core.streaming.CancellationToken;
import com.composeops.core.streaming.StreamCancelledException;
import com.composeops.core.streaming.StreamFailureException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * {@link ProcessRunner} that shells out to the compose CLI via {@link ProcessBuilder}.
 */
@Component
public class DockerCliProcessRunner implements ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(DockerCliProcessRunner.class);

    private static final long OUTPUT_GRACE_MILLIS = 5_000;

    private final DockerProperties properties;

    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService ioExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "process-io-" + threadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public DockerCliProcessRunner(DockerProperties properties) {
        this.properties = properties;
    }

    @PreDestroy
    void shutdown() {
        ioExecutor.shutdownNow();
    }

    @Override
    public CommandResult run(Path workDir, List<String> args) {
        List<String> command = buildCommand(args);
        log.debug("Running: {}", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(false)
                    .start();
        } catch (IOException e) {
            log.error("Failed to start command: {}", String.join(" ", command), e);
            return CommandResult.failure("Failed to start " + command.get(0) + ": " + e.getMessage());
        }

        // Drain both pipes off the calling thread so the timeout applies even while output is pending
        Future<String> stdout = ioExecutor.submit(() -> readAll(process.getInputStream()));
        Future<String> stderr = ioExecutor.submit(() -> readAll(process.getErrorStream()));
        long timeoutMillis = properties.getCommandTimeout().toMillis();
        try {
            if (!process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                stdout.cancel(true);
                stderr.cancel(true);
                log.warn("Command timed out after {}ms: {}", timeoutMillis, String.join(" ", command));
                return CommandResult.failure("Command timed out after " + timeoutMillis + "ms");
            }
            int exitCode = process.exitValue();
            String output = stdout.get(OUTPUT_GRACE_MILLIS, TimeUnit.MILLISECONDS);
            String error = stderr.get(OUTPUT_GRACE_MILLIS, TimeUnit.MILLISECONDS);
            if (exitCode != 0) {
                log.warn("Command exited with code {}: {}", exitCode, String.join(" ", command));
            }
            return new CommandResult(exitCode == 0, output, error.isEmpty() ? null : error, exitCode);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return CommandResult.failure("Interrupted");
        } catch (ExecutionException e) {
            process.destroyForcibly();
            Throwable cause = e.getCause() instanceof UncheckedIOException io ? io.getCause() : e.getCause();
            log.warn("Failed to read output of {}: {}", String.join(" ", command), cause.getMessage());
            return CommandResult.failure(cause.getMessage());
        } catch (TimeoutException e) {
            // a child process still holds the pipes open
            process.destroyForcibly();
            stdout.cancel(true);
            stderr.cancel(true);
            log.warn("Output of {} not closed after exit", String.join(" ", command));
            return CommandResult.failure("Command output did not close after exit");
        }
    }

    @Override
    public void streamLines(Path workDir, List<String> args, Consumer<String> lines, CancellationToken token)
            throws IOException, InterruptedException {
        List<String> command = buildCommand(args);
        log.debug("Streaming: {}", String.join(" ", command));

        Process process = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true)
                .start();
        token.onCancel(process::destroy);
        try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                token.throwIfCancellationRequested();
                lines.accept(line);
            }
            int exitCode = process.waitFor();
            token.throwIfCancellationRequested();
            if (exitCode != 0) {
                throw new StreamFailureException("Command exited with code " + exitCode);
            }
        } catch (IOException e) {
            if (token.isCancelled()) {
                throw new StreamCancelledException("Stream cancelled");
            }
            throw e;
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    List<String> buildCommand(List<String> args) {
        var command = new ArrayList<>(properties.composeCommandParts());
        command.addAll(args);
        return command;
    }

    private static String readAll(InputStream stream) {
        try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
