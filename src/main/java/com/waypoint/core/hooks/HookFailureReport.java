package com.waypoint.core.hooks;

/**
 * Renders a blocking hook failure as a {@code <system-reminder>} block so an automated caller
 * reading the output notices it and can act on the hook's stderr.
 */
public final class HookFailureReport {

    private HookFailureReport() {}

    public static String format(HookExecutionResult failure, HookPhase phase) {
        var sb = new StringBuilder();
        sb.append("<system-reminder>\n");
        sb.append("BLOCKING HOOK FAILURE (").append(phase.prefix()).append("-transition)\n\n");
        sb.append("Hook: ").append(failure.hookName()).append('\n');
        sb.append("Event: ").append(failure.event()).append('\n');
        if (failure.timedOut()) {
            sb.append("Exit code: timeout\n");
        } else {
            sb.append("Exit code: ").append(failure.exitCode()).append('\n');
        }
        if (failure.stderr() != null && !failure.stderr().isBlank()) {
            sb.append("Stderr:\n").append(failure.stderr().strip()).append('\n');
        }
        sb.append('\n');
        sb.append(phase == HookPhase.PRE
                ? "The transition was aborted and the work unit was not changed. Fix the issue and retry.\n"
                : "The status change was committed, but this hook must pass. Fix the issue before continuing.\n");
        sb.append("</system-reminder>");
        return sb.toString();
    }
}
