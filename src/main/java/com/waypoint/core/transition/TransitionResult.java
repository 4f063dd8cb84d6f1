package com.waypoint.core.transition;

import com.waypoint.core.WaypointException;
import com.waypoint.core.hooks.BlockingHookFailureException;
import com.waypoint.core.hooks.HookPhase;
import com.waypoint.core.hooks.PipelineResult;
import com.waypoint.core.model.Checkpoint;
import com.waypoint.core.model.WorkUnit;
import com.waypoint.core.model.WorkUnitStatus;
import com.waypoint.core.temporal.TemporalOrderingViolationException;
import com.waypoint.core.temporal.TemporalValidation;

import java.util.List;
import java.util.Optional;

/**
 * Everything that happened during one transition request.
 *
 * @param workUnit   the unit after the request (unchanged when aborted)
 * @param checkpoint automatic checkpoint taken before the transition, if the tree was dirty
 * @param temporal   temporal check outcome, {@code null} when skipped or never reached
 * @param postHooks  {@code null} unless the transition was committed
 * @param warnings   non-fatal problems, e.g. a failed automatic checkpoint
 */
public record TransitionResult(
    String workUnitId,
    WorkUnitStatus fromState,
    WorkUnitStatus targetState,
    TransitionOutcome outcome,
    TransitionPhase phase,
    WorkUnit workUnit,
    Checkpoint checkpoint,
    PipelineResult preHooks,
    TemporalValidation temporal,
    PipelineResult postHooks,
    List<String> warnings
) {
    public TransitionResult {
        warnings = List.copyOf(warnings);
    }

    public boolean succeeded() {
        return outcome == TransitionOutcome.COMMITTED;
    }

    public int exitCode() {
        return outcome.exitCode();
    }

    public Optional<Checkpoint> automaticCheckpoint() {
        return Optional.ofNullable(checkpoint);
    }

    /**
     * The typed failure behind a non-successful outcome.
     */
    public Optional<WaypointException> failure() {
        return switch (outcome) {
            case COMMITTED -> Optional.empty();
            case ABORTED_BY_PRE_HOOK -> preHooks.blockingFailure()
                    .map(f -> new BlockingHookFailureException(f, HookPhase.PRE));
            case ABORTED_BY_TEMPORAL_VIOLATION -> Optional.of(
                    new TemporalOrderingViolationException(workUnitId, targetState, temporal.violations()));
            case COMMITTED_WITH_POST_HOOK_FAILURE -> postHooks.blockingFailure()
                    .map(f -> new BlockingHookFailureException(f, HookPhase.POST));
        };
    }

    /**
     * Returns this result if it succeeded, otherwise throws its failure.
     */
    public TransitionResult orThrow() {
        failure().ifPresent(f -> {
            throw f;
        });
        return this;
    }
}
