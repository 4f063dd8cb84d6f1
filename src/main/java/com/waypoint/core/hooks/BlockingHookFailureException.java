package com.waypoint.core.hooks;

import com.waypoint.core.WaypointException;

public class BlockingHookFailureException extends WaypointException {

    private final HookExecutionResult failure;
    private final HookPhase phase;

    public BlockingHookFailureException(HookExecutionResult failure, HookPhase phase) {
        super(HookFailureReport.format(failure, phase));
        this.failure = failure;
        this.phase = phase;
    }

    public String getHookName() {
        return failure.hookName();
    }

    public String getStderr() {
        return failure.stderr();
    }

    public HookPhase getPhase() {
        return phase;
    }

    public HookExecutionResult getFailure() {
        return failure;
    }
}
