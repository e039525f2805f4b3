package com.composeops.docker;

import com.composeops.core.streaming.CancellationToken;
import com.composeops.core.streaming.LogSource;
import com.composeops.core.streaming.StreamFailureException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Logs of a whole compose project (or one of its services) via {@code docker compose logs}.
 * <p>
 * When following, each output line is its own chunk. A one-shot fetch sends the entire
 * output as a single chunk.
 */
public class ComposeLogSource implements LogSource {

    private final ProcessRunner runner;
    private final String projectPath;
    private final String serviceName;
    private final Integer tail;
    private final boolean follow;

    public ComposeLogSource(ProcessRunner runner, String projectPath, String serviceName,
                            Integer tail, boolean follow) {
        this.runner = runner;
        this.projectPath = projectPath;
        this.serviceName = serviceName;
        this.tail = tail;
        this.follow = follow;
    }

    @Override
    public void stream(Consumer<String> chunks, CancellationToken token)
            throws IOException, InterruptedException {
        ComposeProject project;
        try {
            project = ComposeProject.resolve(projectPath);
        } catch (ComposeProjectNotFoundException e) {
            throw new StreamFailureException(e.getMessage());
        }
        List<String> args = project.args(logArguments());

        if (follow) {
            runner.streamLines(project.directory(), args, chunks, token);
            return;
        }

        token.throwIfCancellationRequested();
        CommandResult result = runner.run(project.directory(), args);
        if (!result.success()) {
            String error = result.error();
            throw new StreamFailureException(error != null && !error.isBlank() ? error : "Failed to read compose logs");
        }
        if (!result.output().isEmpty()) {
            chunks.accept(result.output());
        }
    }

    List<String> logArguments() {
        var args = new ArrayList<String>();
        args.add("logs");
        args.add("--timestamps");
        if (follow) {
            args.add("--follow");
        }
        if (tail != null) {
            args.add("--tail=" + tail);
        }
        if (serviceName != null && !serviceName.isBlank()) {
            args.add(serviceName);
        }
        return args;
    }

    @Override
    public String describe() {
        return "compose";
    }
}
