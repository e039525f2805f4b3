package com.composeops.docker;

import com.composeops.core.streaming.CancellationToken;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * Runs compose CLI commands in a project directory.
 */
public interface ProcessRunner {

    /**
     * Runs a command to completion and captures its output.
     */
    CommandResult run(Path workDir, List<String> args);

    /**
     * Runs a command and hands each output line to {@code lines} as it is produced. The
     * process is destroyed when the token is cancelled.
     *
     * @throws com.composeops.core.streaming.StreamFailureException if the command exits non-zero
     * @throws com.composeops.core.streaming.StreamCancelledException if cancelled while running
     */
    void streamLines(Path workDir, List<String> args, Consumer<String> lines, CancellationToken token)
            throws IOException, InterruptedException;
}
