package com.composeops.docker;

/**
 * Outcome of a one-shot command.
 *
 * @param success  true when the process exited with code 0
 * @param output   captured stdout
 * @param error    captured stderr, or a description of why the command could not run (nullable)
 * @param exitCode process exit code, -1 when the process did not exit normally
 */
public record CommandResult(
    boolean success,
    String output,
    String error,
    int exitCode
) {

    public static CommandResult failure(String error) {
        return new CommandResult(false, "", error, -1);
    }
}
