package com.waypoint.core.hooks;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.model.HookCondition;
import com.waypoint.core.model.HookDefinition;
import com.waypoint.core.model.WorkUnit;
import com.waypoint.core.model.WorkUnitType;
import com.waypoint.core.persistence.JsonDocuments;
import com.waypoint.support.FakeWorkingTree;
import com.waypoint.support.InMemoryGlobalHookStore;
import com.waypoint.support.MutableClock;
import com.waypoint.support.RecordingHookExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HookOrchestratorTest {

    private static final String EVENT = "pre-implementing";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final ObjectMapper mapper = JsonDocuments.newMapper();
    private InMemoryGlobalHookStore globalHooks;
    private RecordingHookExecutor executor;
    private FakeWorkingTree tree;
    private HookOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        globalHooks = new InMemoryGlobalHookStore();
        executor = new RecordingHookExecutor();
        tree = new FakeWorkingTree();
        orchestrator = new HookOrchestrator(globalHooks, executor, tree, mapper, new MutableClock(NOW),
                new WaypointMetrics(new SimpleMeterRegistry()), Duration.ofSeconds(30));
    }

    private static HookDefinition hook(String name, boolean blocking) {
        return new HookDefinition(name, EVENT, "run-" + name, blocking, null, null, false);
    }

    private static WorkUnit unitWith(HookDefinition... virtualHooks) {
        return WorkUnit.create("AUTH-001", "Login", WorkUnitType.STORY, NOW)
                .withVirtualHooks(List.of(virtualHooks), NOW);
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("virtual hooks come before global hooks, each in configured order")
        void order() {
            globalHooks.add(hook("g1", false));
            globalHooks.add(hook("g2", false));
            WorkUnit unit = unitWith(hook("v1", false), hook("v2", false));

            List<HookOrchestrator.ResolvedHook> resolved = orchestrator.resolve(EVENT, unit);

            assertEquals(List.of("v1", "v2", "g1", "g2"),
                    resolved.stream().map(r -> r.definition().name()).toList());
            assertEquals(HookScope.VIRTUAL, resolved.get(0).scope());
            assertEquals(HookScope.GLOBAL, resolved.get(3).scope());
        }

        @Test
        @DisplayName("hooks for other events and unmatched conditions are skipped")
        void filters() {
            globalHooks.add(new HookDefinition("other", "post-implementing", "x", false, null, null, false));
            globalHooks.add(new HookDefinition("billing-only", EVENT, "x", false, null,
                    new HookCondition(null, List.of("BILL"), null, null, null), false));
            WorkUnit unit = unitWith(new HookDefinition("later", "pre-validating", "x", false, null, null, false));

            assertTrue(orchestrator.resolve(EVENT, unit).isEmpty());
        }

        @Test
        @DisplayName("without a work unit only unconditional global hooks apply")
        void noWorkUnit() {
            globalHooks.add(hook("always", false));
            globalHooks.add(new HookDefinition("tagged", EVENT, "x", false, null,
                    new HookCondition(List.of("security"), null, null, null, null), false));

            assertEquals(List.of("always"),
                    orchestrator.resolve(EVENT, null).stream().map(r -> r.definition().name()).toList());
        }
    }

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("runs A, B, C in order and continues past a non-blocking failure")
        void nonBlockingFailureContinues() {
            executor.failing("run-B", 2, "lint warnings");
            WorkUnit unit = unitWith(hook("A", false), hook("B", false), hook("C", true));

            PipelineResult result = orchestrator.run(EVENT, unit);

            assertEquals(List.of("run-A", "run-B", "run-C"), executor.commandLines());
            assertFalse(result.haltedOnBlockingFailure());
            assertEquals(1, result.nonBlockingFailures().size());
            assertEquals("B", result.nonBlockingFailures().get(0).hookName());
            assertEquals(2, result.nonBlockingFailures().get(0).exitCode());
        }

        @Test
        @DisplayName("a failing blocking hook halts the pipeline")
        void blockingFailureHalts() {
            executor.failing("run-B", 1, "tests failed");
            WorkUnit unit = unitWith(hook("A", false), hook("B", true), hook("C", false));

            PipelineResult result = orchestrator.run(EVENT, unit);

            assertEquals(List.of("run-A", "run-B"), executor.commandLines());
            assertTrue(result.haltedOnBlockingFailure());
            assertEquals("B", result.failingHook());
            HookExecutionResult failure = result.blockingFailure().orElseThrow();
            assertEquals("tests failed", failure.stderr());
            assertFalse(failure.success());
        }

        @Test
        @DisplayName("a timed out blocking hook counts as a failure")
        void timeoutIsFailure() {
            executor.timingOut("run-slow");
            PipelineResult result = orchestrator.run(EVENT, unitWith(hook("slow", true)));

            assertTrue(result.haltedOnBlockingFailure());
            HookExecutionResult failure = result.blockingFailure().orElseThrow();
            assertTrue(failure.timedOut());
            assertNull(failure.exitCode());
        }

        @Test
        @DisplayName("no applicable hooks yields an empty result")
        void empty() {
            PipelineResult result = orchestrator.run(EVENT, unitWith());

            assertTrue(result.executed().isEmpty());
            assertTrue(executor.commands().isEmpty());
        }

        @Test
        @DisplayName("commands run in the project root with the per-hook or default timeout")
        void commandSettings() {
            WorkUnit unit = unitWith(hook("default", false),
                    new HookDefinition("custom", EVENT, "run-custom", false, 5, null, false));

            orchestrator.run(EVENT, unit);

            assertEquals(tree.root(), executor.commands().get(0).workingDirectory());
            assertEquals(Duration.ofSeconds(30), executor.commands().get(0).timeout());
            assertEquals(Duration.ofSeconds(5), executor.commands().get(1).timeout());
        }

        @Test
        @DisplayName("stdin carries the unit id, event and timestamp")
        void stdinContext() throws Exception {
            orchestrator.run(EVENT, unitWith(hook("A", false)));

            JsonNode context = mapper.readTree(executor.commands().get(0).stdin());
            assertEquals("AUTH-001", context.get("workUnitId").asText());
            assertEquals(EVENT, context.get("event").asText());
            assertEquals("2026-03-01T10:00:00Z", context.get("timestamp").asText());
            assertFalse(context.has("stagedFiles"));
        }

        @Test
        @DisplayName("hooks asking for git context also receive staged and unstaged files")
        void gitContext() throws Exception {
            tree.commit("src/App.java", "a").edit("src/App.java", "b").stage("src/App.java")
                    .edit("notes.md", "new");
            var withGit = new HookDefinition("guard", EVENT, "run-guard", false, null, null, true);

            orchestrator.run(EVENT, unitWith(withGit));

            JsonNode context = mapper.readTree(executor.commands().get(0).stdin());
            assertEquals("src/App.java", context.get("stagedFiles").get(0).asText());
            assertEquals("notes.md", context.get("unstagedFiles").get(0).asText());
        }
    }

    @Test
    @DisplayName("failure report names the hook, event, exit code and stderr")
    void failureReport() {
        var failure = new HookExecutionResult("tests", "pre-implementing", HookScope.GLOBAL, true, false,
                1, "", "3 tests failed\n", false, 120);

        String report = HookFailureReport.format(failure, HookPhase.PRE);

        assertTrue(report.startsWith("<system-reminder>"));
        assertTrue(report.endsWith("</system-reminder>"));
        assertTrue(report.contains("Hook: tests"));
        assertTrue(report.contains("Event: pre-implementing"));
        assertTrue(report.contains("Exit code: 1"));
        assertTrue(report.contains("Stderr:\n3 tests failed"));
        assertTrue(report.contains("aborted"));
        assertEquals("tests", new BlockingHookFailureException(failure, HookPhase.POST).getHookName());
    }
}
