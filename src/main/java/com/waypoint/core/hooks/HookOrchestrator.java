package com.waypoint.core.hooks;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.waypoint.core.logging.MdcContext;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.model.HookDefinition;
import com.waypoint.core.model.WorkUnit;
import com.waypoint.core.snapshot.ChangeSet;
import com.waypoint.core.snapshot.SnapshotStoreException;
import com.waypoint.core.snapshot.WorkingTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves and runs the hook pipeline for one lifecycle event.
 * <p>
 * Pipeline order is fixed: the work unit's virtual hooks in the order they were attached,
 * then global hooks in configuration order, each filtered by event and condition. Hooks run
 * one at a time. A failing non-blocking hook is recorded and the pipeline moves on; a failing
 * blocking hook stops it.
 */
public class HookOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(HookOrchestrator.class);

    /**
     * A hook selected for execution together with where it came from.
     */
    public record ResolvedHook(HookDefinition definition, HookScope scope) {}

    private final GlobalHookStore globalHooks;
    private final HookExecutor executor;
    private final WorkingTree workingTree;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final WaypointMetrics metrics;
    private final Duration defaultTimeout;

    public HookOrchestrator(GlobalHookStore globalHooks, HookExecutor executor, WorkingTree workingTree,
                            ObjectMapper mapper, Clock clock, WaypointMetrics metrics, Duration defaultTimeout) {
        this.globalHooks = globalHooks;
        this.executor = executor;
        this.workingTree = workingTree;
        this.mapper = mapper;
        this.clock = clock;
        this.metrics = metrics;
        this.defaultTimeout = defaultTimeout;
    }

    /**
     * Hooks that would run for {@code event}, in execution order.
     */
    public List<ResolvedHook> resolve(String event, WorkUnit workUnit) {
        var resolved = new ArrayList<ResolvedHook>();
        if (workUnit != null) {
            for (HookDefinition hook : workUnit.virtualHooks()) {
                if (event.equals(hook.event()) && HookConditionEvaluator.matches(hook, workUnit)) {
                    resolved.add(new ResolvedHook(hook, HookScope.VIRTUAL));
                }
            }
        }
        for (HookDefinition hook : globalHooks.hooksFor(event)) {
            if (HookConditionEvaluator.matches(hook, workUnit)) {
                resolved.add(new ResolvedHook(hook, HookScope.GLOBAL));
            }
        }
        return resolved;
    }

    /**
     * Runs every applicable hook for {@code event} sequentially.
     *
     * @param workUnit the unit being transitioned, or {@code null} outside a unit's context
     */
    public PipelineResult run(String event, WorkUnit workUnit) {
        List<ResolvedHook> hooks = resolve(event, workUnit);
        if (hooks.isEmpty()) {
            return PipelineResult.empty(event);
        }
        log.info("Running {} hook(s) for {}", hooks.size(), event);

        String workUnitId = workUnit != null ? workUnit.id() : null;
        Instant timestamp = clock.instant();
        ChangeSet changeSet = null;

        var executed = new ArrayList<HookExecutionResult>();
        for (ResolvedHook hook : hooks) {
            HookDefinition definition = hook.definition();
            HookContext context;
            if (definition.gitContext()) {
                if (changeSet == null) {
                    changeSet = currentChangeSet();
                }
                context = new HookContext(workUnitId, event, timestamp,
                        changeSet.stagedFiles(), changeSet.unstagedFiles());
            } else {
                context = new HookContext(workUnitId, event, timestamp);
            }

            HookExecutionResult result = execute(hook, context);
            executed.add(result);

            if (!result.success() && definition.blocking()) {
                log.warn("Blocking hook '{}' failed for {}; halting pipeline", definition.name(), event);
                return new PipelineResult(event, executed, true, definition.name());
            }
            if (!result.success()) {
                log.warn("Hook '{}' failed for {} (exit {}); continuing", definition.name(), event,
                        result.timedOut() ? "timeout" : result.exitCode());
            }
        }
        return new PipelineResult(event, executed, false, null);
    }

    private HookExecutionResult execute(ResolvedHook hook, HookContext context) {
        HookDefinition definition = hook.definition();
        Duration timeout = definition.timeoutSeconds() != null && definition.timeoutSeconds() > 0
                ? Duration.ofSeconds(definition.timeoutSeconds())
                : defaultTimeout;
        var command = new HookCommand(definition.command(), toJson(context), workingTree.root(), timeout);

        MdcContext.setHook(definition.name(), context.event());
        long start = System.currentTimeMillis();
        try {
            ProcessResult process = executor.execute(command);
            long durationMs = System.currentTimeMillis() - start;
            log.debug("Hook '{}' exited {} in {}ms", definition.name(), process.exitCode(), durationMs);
            if (!process.stdout().isBlank()) {
                log.debug("stdout: {}", process.stdout().strip());
            }
            if (!process.stderr().isBlank()) {
                log.debug("stderr: {}", process.stderr().strip());
            }
            metrics.recordHookExecution(context.event(), process.succeeded(), process.timedOut(), durationMs);
            return new HookExecutionResult(definition.name(), context.event(), hook.scope(), definition.blocking(),
                    process.succeeded(), process.exitCode(), process.stdout(), process.stderr(),
                    process.timedOut(), durationMs);
        } finally {
            MdcContext.clearHook();
        }
    }

    private ChangeSet currentChangeSet() {
        try {
            return workingTree.changeSet();
        } catch (SnapshotStoreException e) {
            log.warn("Could not determine git change-set for hooks: {}", e.getMessage());
            return ChangeSet.empty();
        }
    }

    private String toJson(HookContext context) {
        try {
            return mapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new HookConfigurationException("Cannot serialize hook context", e);
        }
    }
}
