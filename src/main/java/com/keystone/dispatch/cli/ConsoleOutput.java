package com.keystone.dispatch.cli;

import com.keystone.core.model.RunMetrics;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Keystone CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) KEYSTONE v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [KEYSTONE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * One line of the task tree, indented by depth.
     */
    public static void node(int depth, String id, String status, int attempts, String goal) {
        String color = switch (status) {
            case "SUCCESS" -> "fg(green)";
            case "FAILED", "CANCELLED" -> "fg(red)";
            case "ACTIVE" -> "fg(cyan)";
            case "DECOMPOSED" -> "fg(yellow)";
            default -> "fg(white)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + "  ".repeat(depth) + String.format("%-8s", id) + " @|" + color + " "
                        + String.format("%-10s", status) + "|@ "
                        + (attempts > 0 ? "(" + attempts + " rejected) " : "") + truncate(goal, 60)));
    }

    public static void metrics(RunMetrics m) {
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Run Metrics|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Nodes: " + m.nodes() + " (@|fg(green) " + m.succeeded() + " succeeded|@, @|fg(red) "
                        + m.failed() + " failed|@, " + m.cancelled() + " cancelled)"));
        System.out.println("  Tool calls: " + m.toolCalls()
                + (m.toolTimeouts() > 0 ? " (" + m.toolTimeouts() + " timed out)" : ""));
        System.out.println("  Rejections: " + m.rejects() + ", decompositions: " + m.decompositions());
        System.out.println("  Duration: " + formatDuration(m.elapsedMs()));
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "run.created" -> "@|fg(cyan) [RUN]|@";
            case "run.snapshot" -> "@|fg(white) [SNAPSHOT]|@";
            case "node.transition", "node.decomposed", "node.cancelled" -> "@|fg(blue) [NODE]|@";
            case "node.awaiting_feedback" -> "@|fg(yellow),bold [FEEDBACK]|@";
            case "approval.requested" -> "@|fg(magenta),bold [APPROVAL]|@";
            case "tool.timeout" -> "@|fg(red) [TIMEOUT]|@";
            case "run.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "run.failed", "run.aborted" -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
