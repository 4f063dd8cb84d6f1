package com.waypoint.core.hooks;

/**
 * @param exitCode process exit status, {@code null} when the process was killed on timeout
 */
public record ProcessResult(
    String stdout,
    String stderr,
    Integer exitCode,
    boolean timedOut
) {
    public boolean succeeded() {
        return !timedOut && exitCode != null && exitCode == 0;
    }
}
