package com.waypoint.core.hooks;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a hook pipeline for one event.
 *
 * @param executed                hooks that ran, in execution order
 * @param haltedOnBlockingFailure whether a blocking hook failed and stopped the pipeline
 * @param failingHook             name of that blocking hook, if any
 */
public record PipelineResult(
    String event,
    List<HookExecutionResult> executed,
    boolean haltedOnBlockingFailure,
    String failingHook
) {
    public PipelineResult {
        executed = List.copyOf(executed);
    }

    public static PipelineResult empty(String event) {
        return new PipelineResult(event, List.of(), false, null);
    }

    /**
     * The blocking failure that halted the pipeline.
     */
    public Optional<HookExecutionResult> blockingFailure() {
        if (!haltedOnBlockingFailure || executed.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(executed.get(executed.size() - 1));
    }

    public List<HookExecutionResult> nonBlockingFailures() {
        return executed.stream().filter(r -> !r.success() && !r.blocking()).toList();
    }
}
