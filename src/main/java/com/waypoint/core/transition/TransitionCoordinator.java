package com.waypoint.core.transition;

import com.waypoint.core.WaypointException;
import com.waypoint.core.checkpoint.CheckpointEngine;
import com.waypoint.core.checkpoint.CleanupResult;
import com.waypoint.core.events.EventBus;
import com.waypoint.core.events.WaypointEvent;
import com.waypoint.core.hooks.HookEvents;
import com.waypoint.core.hooks.HookOrchestrator;
import com.waypoint.core.hooks.PipelineResult;
import com.waypoint.core.logging.MdcContext;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.model.Checkpoint;
import com.waypoint.core.model.CheckpointKind;
import com.waypoint.core.model.WorkUnit;
import com.waypoint.core.model.WorkUnitStatus;
import com.waypoint.core.snapshot.WorkingTree;
import com.waypoint.core.temporal.ArtifactResolver;
import com.waypoint.core.temporal.TemporalValidation;
import com.waypoint.core.temporal.TemporalValidator;
import com.waypoint.core.workunit.InvalidTargetException;
import com.waypoint.core.workunit.WorkUnitRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Single entry point for moving a work unit to a new state.
 * <p>
 * Steps, in order:
 * <ol>
 *   <li>Automatic checkpoint of a dirty working tree (failure is only a warning)</li>
 *   <li>{@code pre-<target>} hooks; a blocking failure aborts</li>
 *   <li>Temporal validation unless bypassed; any violation aborts</li>
 *   <li>Commit: new status plus one history entry, saved through the repository</li>
 *   <li>{@code post-<target>} hooks; a blocking failure fails the result but keeps the commit</li>
 * </ol>
 * Nothing is persisted before step 4, so an abort leaves the work unit untouched.
 * There is no lock around the sequence and no recovery if the process dies part-way.
 */
public class TransitionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TransitionCoordinator.class);

    private final WorkUnitRepository repository;
    private final CheckpointEngine checkpoints;
    private final WorkingTree workingTree;
    private final HookOrchestrator hooks;
    private final TemporalValidator temporalValidator;
    private final ArtifactResolver artifactResolver;
    private final EventBus eventBus;
    private final WaypointMetrics metrics;
    private final Clock clock;

    public TransitionCoordinator(WorkUnitRepository repository, CheckpointEngine checkpoints, WorkingTree workingTree,
                                 HookOrchestrator hooks, TemporalValidator temporalValidator,
                                 ArtifactResolver artifactResolver, EventBus eventBus, WaypointMetrics metrics,
                                 Clock clock) {
        this.repository = repository;
        this.checkpoints = checkpoints;
        this.workingTree = workingTree;
        this.hooks = hooks;
        this.temporalValidator = temporalValidator;
        this.artifactResolver = artifactResolver;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @throws InvalidTargetException for an unknown state name
     */
    public TransitionResult transition(String workUnitId, String targetState, TransitionOptions options) {
        WorkUnitStatus target = WorkUnitStatus.parse(targetState)
                .orElseThrow(() -> new InvalidTargetException("Unknown state '%s'".formatted(targetState)));
        return transition(workUnitId, target, options);
    }

    /**
     * Runs the full transition sequence.
     *
     * @throws InvalidTargetException if the unit does not exist, the move is not allowed,
     *                                or a move to {@code blocked} has no reason
     */
    public TransitionResult transition(String workUnitId, WorkUnitStatus target, TransitionOptions options) {
        WorkUnit unit = repository.load(workUnitId);
        WorkUnitStatus from = unit.status();
        WorkflowRules.check(unit, target, options.blockedReason());

        MdcContext.setTransition(workUnitId, from.value(), target.value());
        try {
            log.info("Transition {} {} -> {}", workUnitId, from, target);
            publish("transition.started", workUnitId, Map.of("from", from.value(), "to", target.value()));
            var warnings = new ArrayList<String>();

            // 1. Pre-checkpoint
            Checkpoint checkpoint = createAutomaticCheckpoint(unit, warnings);
            publishPhase(workUnitId, TransitionPhase.CHECKPOINTED);

            // 2. Pre-hooks
            PipelineResult preHooks = hooks.run(HookEvents.pre(target), unit);
            publishHooks(workUnitId, preHooks);
            if (preHooks.haltedOnBlockingFailure()) {
                return abort(unit, target, TransitionOutcome.ABORTED_BY_PRE_HOOK, TransitionPhase.CHECKPOINTED,
                        checkpoint, preHooks, null, warnings);
            }
            publishPhase(workUnitId, TransitionPhase.PRE_HOOKED);

            // 3. Temporal validation
            TemporalValidation temporal = null;
            if (options.skipTemporalValidation()) {
                log.info("Temporal validation bypassed for {} -> {}", workUnitId, target);
                warnings.add("Temporal validation was skipped");
            } else {
                temporal = temporalValidator.validate(unit, from, target, artifactResolver);
                if (!temporal.ok()) {
                    metrics.recordTemporalViolations(temporal.violations().size());
                    return abort(unit, target, TransitionOutcome.ABORTED_BY_TEMPORAL_VIOLATION,
                            TransitionPhase.PRE_HOOKED, checkpoint, preHooks, temporal, warnings);
                }
            }
            publishPhase(workUnitId, TransitionPhase.VALIDATED);

            // 4. Commit
            WorkUnit committed = unit.withTransition(target, clock.instant(), options.blockedReason());
            repository.save(committed);
            log.info("Committed {} -> {}", workUnitId, target);
            publish("transition.committed", workUnitId, Map.of("from", from.value(), "to", target.value()));
            publishPhase(workUnitId, TransitionPhase.COMMITTED);
            if (target == WorkUnitStatus.DONE) {
                finishWorkUnit(committed, warnings);
            }

            // 5. Post-hooks
            PipelineResult postHooks = hooks.run(HookEvents.post(target), committed);
            publishHooks(workUnitId, postHooks);
            TransitionOutcome outcome = postHooks.haltedOnBlockingFailure()
                    ? TransitionOutcome.COMMITTED_WITH_POST_HOOK_FAILURE
                    : TransitionOutcome.COMMITTED;
            TransitionPhase phase = postHooks.haltedOnBlockingFailure()
                    ? TransitionPhase.COMMITTED
                    : TransitionPhase.POST_HOOKED;
            if (phase == TransitionPhase.POST_HOOKED) {
                publishPhase(workUnitId, phase);
            }

            metrics.recordTransition(target.value(), outcome.name().toLowerCase());
            publish("transition.completed", workUnitId, Map.of("to", target.value(), "outcome", outcome.name()));
            return new TransitionResult(workUnitId, from, target, outcome, phase, committed, checkpoint,
                    preHooks, temporal, postHooks, warnings);
        } finally {
            MdcContext.clear();
        }
    }

    private Checkpoint createAutomaticCheckpoint(WorkUnit unit, List<String> warnings) {
        String name = CheckpointEngine.automaticName(unit.id(), unit.status());
        try {
            if (!workingTree.isDirty()) {
                log.debug("Working tree clean; no automatic checkpoint for {}", unit.id());
                return null;
            }
            // Re-entering a state replaces the earlier automatic checkpoint for it
            Checkpoint checkpoint = checkpoints.create(unit.id(), name, CheckpointKind.AUTOMATIC, true);
            publish("checkpoint.created", unit.id(), Map.of("name", name, "kind", "automatic"));
            return checkpoint;
        } catch (WaypointException e) {
            log.warn("Automatic checkpoint '{}' failed: {}", name, e.getMessage());
            warnings.add("Automatic checkpoint '%s' could not be created: %s".formatted(name, e.getMessage()));
            return null;
        }
    }

    /**
     * Entering {@code done}: drop the unit's automatic checkpoints and remind about virtual hooks.
     */
    private void finishWorkUnit(WorkUnit unit, List<String> warnings) {
        try {
            CleanupResult cleanup = checkpoints.cleanupAutomatic(unit.id());
            if (cleanup.deletedCount() > 0) {
                publish("checkpoint.cleanup", unit.id(), Map.of("deleted", cleanup.deletedCount()));
            }
        } catch (WaypointException e) {
            log.warn("Could not clean up automatic checkpoints for {}: {}", unit.id(), e.getMessage());
            warnings.add("Automatic checkpoints were not cleaned up: " + e.getMessage());
        }
        if (!unit.virtualHooks().isEmpty()) {
            warnings.add("%s is done but still has %d virtual hook(s); remove them with 'hook clear %s'"
                    .formatted(unit.id(), unit.virtualHooks().size(), unit.id()));
        }
    }

    private TransitionResult abort(WorkUnit unit, WorkUnitStatus target, TransitionOutcome outcome,
                                   TransitionPhase phase, Checkpoint checkpoint, PipelineResult preHooks,
                                   TemporalValidation temporal, List<String> warnings) {
        log.warn("Transition {} -> {} aborted: {}", unit.id(), target, outcome);
        metrics.recordTransition(target.value(), outcome.name().toLowerCase());
        publish("transition.aborted", unit.id(), Map.of("to", target.value(), "outcome", outcome.name()));
        return new TransitionResult(unit.id(), unit.status(), target, outcome, phase, unit, checkpoint,
                preHooks, temporal, null, warnings);
    }

    private void publishHooks(String workUnitId, PipelineResult result) {
        if (result.executed().isEmpty()) {
            return;
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("event", result.event());
        payload.put("executed", result.executed().size());
        payload.put("halted", result.haltedOnBlockingFailure());
        if (result.failingHook() != null) {
            payload.put("failingHook", result.failingHook());
        }
        publish("hooks.completed", workUnitId, payload);
    }

    private void publishPhase(String workUnitId, TransitionPhase phase) {
        publish("transition.phase", workUnitId, Map.of("phase", phase.name()));
    }

    private void publish(String type, String workUnitId, Map<String, Object> payload) {
        eventBus.publish(new WaypointEvent(type, workUnitId, payload, clock.instant()));
    }
}
