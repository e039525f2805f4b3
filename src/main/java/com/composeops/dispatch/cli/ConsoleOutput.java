package com.composeops.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the ComposeOps CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) COMPOSEOPS v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [COMPOSEOPS]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * Prints a status word colored by lifecycle: green when completed, red when failed or
     * cancelled, cyan otherwise.
     */
    public static String status(String status) {
        String color = switch (status) {
            case "completed" -> "fg(green)";
            case "failed", "cancelled" -> "fg(red)";
            default -> "fg(cyan)";
        };
        return CommandLine.Help.Ansi.AUTO.string("@|" + color + " " + status + "|@");
    }

    public static void logLine(String line) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|faint │|@ " + line));
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "connected" -> "@|fg(cyan) [CONNECTED]|@";
            case "OperationProgress" -> "@|fg(blue) [PROGRESS]|@";
            case "StreamComplete" -> "@|fg(green),bold [COMPLETE]|@";
            case "LogError" -> "@|fg(red),bold [ERROR]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
