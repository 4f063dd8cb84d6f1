package com.waypoint.dispatch.cli;

import com.waypoint.core.checkpoint.RestoreConflict;
import com.waypoint.core.hooks.HookExecutionResult;
import com.waypoint.core.model.Checkpoint;
import com.waypoint.core.temporal.TemporalViolation;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Waypoint CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) WAYPOINT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [WAYPOINT]|@ " + message));
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
     * Printed verbatim so automated callers can find the reminder block.
     */
    public static void reminder(String block) {
        System.out.println(block);
    }

    public static void hookResult(HookExecutionResult result) {
        String status = result.success() ? "@|fg(green) PASS|@"
                : result.timedOut() ? "@|fg(red) TIMEOUT|@" : "@|fg(red) FAIL|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [HOOK]|@ " + status + " " + result.hookName() +
                " (" + result.scope().name().toLowerCase() + (result.blocking() ? ", blocking" : "") +
                ", " + result.durationMs() + "ms)"));
    }

    public static void violation(TemporalViolation violation) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) -|@ " + violation.describe()));
    }

    public static void checkpoint(Checkpoint checkpoint) {
        String kind = checkpoint.isAutomatic() ? "@|fg(magenta) auto  |@" : "@|fg(cyan) manual|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + kind + " @|bold " + checkpoint.name() + "|@  " + checkpoint.createdAt()));
    }

    public static void conflict(RestoreConflict conflict) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) !|@ " + conflict.path() + " (" + conflict.workingContent().length +
                " bytes locally, " + conflict.checkpointContent().length + " bytes in checkpoint)"));
    }

    public static void event(String eventType, String data) {
        String prefix = switch (eventType) {
            case "transition.started" -> "@|fg(cyan) [TRANSITION]|@";
            case "transition.phase" -> "@|fg(cyan) [PHASE]|@";
            case "checkpoint.created", "checkpoint.cleanup" -> "@|fg(magenta) [CHECKPOINT]|@";
            case "hooks.completed" -> "@|fg(blue) [HOOKS]|@";
            case "transition.committed", "transition.completed" -> "@|fg(green),bold [COMMITTED]|@";
            case "transition.aborted" -> "@|fg(red),bold [ABORTED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }
}
