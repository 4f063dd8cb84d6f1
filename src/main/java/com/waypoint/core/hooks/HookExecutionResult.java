package com.waypoint.core.hooks;

/**
 * Outcome of running one hook.
 *
 * @param exitCode {@code null} when the hook was killed on timeout
 */
public record HookExecutionResult(
    String hookName,
    String event,
    HookScope scope,
    boolean blocking,
    boolean success,
    Integer exitCode,
    String stdout,
    String stderr,
    boolean timedOut,
    long durationMs
) {}
