package com.waypoint.dispatch.cli;

import com.waypoint.core.events.EventBus;
import com.waypoint.core.hooks.HookExecutionResult;
import com.waypoint.core.hooks.HookFailureReport;
import com.waypoint.core.hooks.HookPhase;
import com.waypoint.core.hooks.PipelineResult;
import com.waypoint.core.temporal.TemporalViolation;
import com.waypoint.core.transition.TransitionCoordinator;
import com.waypoint.core.transition.TransitionOptions;
import com.waypoint.core.transition.TransitionResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: waypoint transition &lt;id&gt; &lt;state&gt;
 * <p>
 * Exit code 0 when the transition commits cleanly, 1 when it is aborted or a blocking
 * post-hook fails after the commit.
 */
@Command(name = "transition", mixinStandardHelpOptions = true,
        description = "Move a work unit to a new lifecycle state")
@Component
public class TransitionCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Work unit id, e.g. AUTH-001")
    private String workUnitId;

    @Parameters(index = "1", description = "Target state: backlog, specifying, testing, implementing, validating, done, blocked")
    private String targetState;

    @Option(names = "--skip-temporal-validation", description = "Bypass the temporal ordering check for this transition")
    private boolean skipTemporalValidation;

    @Option(names = "--blocked-reason", description = "Why the work unit is blocked (required for 'blocked')")
    private String blockedReason;

    @Option(names = {"-v", "--verbose"}, description = "Print transition events as they happen")
    private boolean verbose;

    private final TransitionCoordinator coordinator;
    private final EventBus eventBus;

    public TransitionCommand(TransitionCoordinator coordinator, EventBus eventBus) {
        this.coordinator = coordinator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        EventBus.Subscription subscription = verbose
                ? eventBus.subscribe(workUnitId, e -> ConsoleOutput.event(e.eventType(), e.payload().toString()))
                : null;
        try {
            var options = new TransitionOptions(skipTemporalValidation, blockedReason);
            TransitionResult result = coordinator.transition(workUnitId, targetState, options);
            print(result);
            return result.exitCode();
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
    }

    private void print(TransitionResult result) {
        result.automaticCheckpoint().ifPresent(c ->
                ConsoleOutput.info("Automatic checkpoint: " + c.name()));
        printHooks(result.preHooks());

        switch (result.outcome()) {
            case ABORTED_BY_PRE_HOOK -> result.preHooks().blockingFailure().ifPresent(f -> {
                ConsoleOutput.error("Transition aborted by blocking hook '" + f.hookName() + "'");
                ConsoleOutput.reminder(HookFailureReport.format(f, HookPhase.PRE));
            });
            case ABORTED_BY_TEMPORAL_VIOLATION -> {
                ConsoleOutput.error("Temporal ordering violation: %s cannot move to %s"
                        .formatted(result.workUnitId(), result.targetState()));
                for (TemporalViolation violation : result.temporal().violations()) {
                    ConsoleOutput.violation(violation);
                }
                ConsoleOutput.info("Edit the artifacts during the current state, or pass --skip-temporal-validation");
            }
            case COMMITTED, COMMITTED_WITH_POST_HOOK_FAILURE -> {
                ConsoleOutput.success("%s: %s -> %s".formatted(
                        result.workUnitId(), result.fromState(), result.targetState()));
                printHooks(result.postHooks());
                result.postHooks().blockingFailure().ifPresent(f -> {
                    ConsoleOutput.error("Blocking post-hook '" + f.hookName() + "' failed; status change kept");
                    ConsoleOutput.reminder(HookFailureReport.format(f, HookPhase.POST));
                });
            }
        }
        result.warnings().forEach(ConsoleOutput::warn);
    }

    private static void printHooks(PipelineResult pipeline) {
        if (pipeline == null) {
            return;
        }
        for (HookExecutionResult hook : pipeline.executed()) {
            ConsoleOutput.hookResult(hook);
        }
    }
}
