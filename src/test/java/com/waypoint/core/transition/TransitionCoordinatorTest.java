package com.waypoint.core.transition;

import com.waypoint.core.checkpoint.CheckpointEngine;
import com.waypoint.core.events.EventBus;
import com.waypoint.core.hooks.BlockingHookFailureException;
import com.waypoint.core.hooks.HookOrchestrator;
import com.waypoint.core.hooks.HookPhase;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.model.Checkpoint;
import com.waypoint.core.model.CheckpointKind;
import com.waypoint.core.model.HookDefinition;
import com.waypoint.core.model.WorkUnit;
import com.waypoint.core.model.WorkUnitStatus;
import com.waypoint.core.model.WorkUnitType;
import com.waypoint.core.persistence.JsonDocuments;
import com.waypoint.core.temporal.ArtifactResolver;
import com.waypoint.core.temporal.TemporalOrderingViolationException;
import com.waypoint.core.temporal.TemporalValidator;
import com.waypoint.core.workunit.InvalidTargetException;
import com.waypoint.support.FakeSnapshotStore;
import com.waypoint.support.FakeWorkingTree;
import com.waypoint.support.InMemoryCheckpointIndex;
import com.waypoint.support.InMemoryGlobalHookStore;
import com.waypoint.support.InMemoryWorkUnitRepository;
import com.waypoint.support.MutableClock;
import com.waypoint.support.RecordingHookExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransitionCoordinatorTest {

    private static final String ID = "AUTH-001";
    private static final Instant CREATED = Instant.parse("2026-03-01T08:00:00Z");
    private static final Instant ENTERED_SPECIFYING = Instant.parse("2026-03-01T09:00:00Z");

    @TempDir
    Path dir;

    private InMemoryWorkUnitRepository repository;
    private FakeWorkingTree tree;
    private FakeSnapshotStore snapshots;
    private CheckpointEngine checkpoints;
    private RecordingHookExecutor executor;
    private InMemoryGlobalHookStore globalHooks;
    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private EventBus eventBus;
    private List<String> events;
    private List<Path> featureFiles;
    private Path feature;
    private TransitionCoordinator coordinator;

    @BeforeEach
    void setUp() throws IOException {
        clock = new MutableClock(ENTERED_SPECIFYING.plus(Duration.ofHours(1)));
        registry = new SimpleMeterRegistry();
        var metrics = new WaypointMetrics(registry);

        repository = new InMemoryWorkUnitRepository().with(specifyingStory());
        tree = new FakeWorkingTree(dir).commit("src/App.java", "class App {}\n");
        snapshots = new FakeSnapshotStore(tree);
        checkpoints = new CheckpointEngine(snapshots, tree, new InMemoryCheckpointIndex(), clock, metrics);
        executor = new RecordingHookExecutor();
        globalHooks = new InMemoryGlobalHookStore();
        var hooks = new HookOrchestrator(globalHooks, executor, tree, JsonDocuments.newMapper(), clock, metrics,
                Duration.ofSeconds(30));

        feature = Files.writeString(dir.resolve("login.feature"), "@AUTH-001\nFeature: Login\n");
        touch(feature, ENTERED_SPECIFYING.plus(Duration.ofMinutes(20)));
        featureFiles = new ArrayList<>(List.of(feature));
        ArtifactResolver resolver = new ArtifactResolver() {
            @Override
            public List<Path> specificationArtifacts(WorkUnit workUnit) {
                return featureFiles;
            }

            @Override
            public List<Path> testArtifacts(WorkUnit workUnit) {
                return List.of();
            }
        };

        eventBus = new EventBus();
        events = new ArrayList<>();
        eventBus.subscribeAll(e -> events.add(e.eventType()));

        coordinator = new TransitionCoordinator(repository, checkpoints, tree, hooks, new TemporalValidator(),
                resolver, eventBus, metrics, clock);
    }

    private static WorkUnit specifyingStory() {
        return WorkUnit.create(ID, "Login", WorkUnitType.STORY, CREATED)
                .withTransition(WorkUnitStatus.SPECIFYING, ENTERED_SPECIFYING, null);
    }

    private static void touch(Path file, Instant at) throws IOException {
        Files.setLastModifiedTime(file, FileTime.from(at));
    }

    private WorkUnit stored() {
        return repository.load(ID);
    }

    private TransitionResult toTesting() {
        return coordinator.transition(ID, WorkUnitStatus.TESTING, TransitionOptions.defaults());
    }

    @Nested
    @DisplayName("successful transition")
    class Successful {

        @Test
        @DisplayName("commits the new state with exactly one history entry")
        void commits() {
            TransitionResult result = toTesting();

            assertTrue(result.succeeded());
            assertEquals(0, result.exitCode());
            assertEquals(TransitionPhase.POST_HOOKED, result.phase());
            assertEquals(WorkUnitStatus.SPECIFYING, result.fromState());
            assertEquals(WorkUnitStatus.TESTING, stored().status());
            assertEquals(3, stored().stateHistory().size());
            assertEquals(clock.instant(), stored().stateHistory().get(2).timestamp());
            assertTrue(result.temporal().checked());
            assertEquals(1.0, registry.get("waypoint.transitions.total")
                    .tag("target", "testing").tag("outcome", "committed").counter().count());
        }

        @Test
        @DisplayName("state names are accepted case-insensitively")
        void stringTarget() {
            TransitionResult result = coordinator.transition(ID, "Testing", TransitionOptions.defaults());

            assertEquals(WorkUnitStatus.TESTING, result.targetState());
        }

        @Test
        @DisplayName("a clean working tree gets no automatic checkpoint")
        void cleanTreeNoCheckpoint() {
            TransitionResult result = toTesting();

            assertTrue(result.automaticCheckpoint().isEmpty());
            assertEquals(0, snapshots.createdCount());
            assertTrue(checkpoints.list(ID).isEmpty());
        }

        @Test
        @DisplayName("a dirty working tree gets exactly one automatic checkpoint named after the state left")
        void dirtyTreeCheckpoint() {
            tree.edit("src/App.java", "class App { int x; }\n");

            TransitionResult result = toTesting();

            Checkpoint checkpoint = result.automaticCheckpoint().orElseThrow();
            assertEquals("AUTH-001-auto-specifying", checkpoint.name());
            assertEquals(CheckpointKind.AUTOMATIC, checkpoint.kind());
            assertEquals(List.of(checkpoint), checkpoints.list(ID));
            assertEquals(1, snapshots.createdCount());
        }

        @Test
        @DisplayName("re-entering a state replaces its earlier automatic checkpoint")
        void reentryReplacesCheckpoint() {
            tree.edit("src/App.java", "v2");
            toTesting();
            clock.advance(Duration.ofMinutes(1));
            coordinator.transition(ID, WorkUnitStatus.SPECIFYING, TransitionOptions.defaults());
            clock.advance(Duration.ofMinutes(1));
            coordinator.transition(ID, WorkUnitStatus.TESTING, TransitionOptions.skippingTemporalValidation());

            List<String> names = checkpoints.list(ID).stream().map(Checkpoint::name).toList();
            assertEquals(List.of("AUTH-001-auto-specifying", "AUTH-001-auto-testing"), names);
        }

        @Test
        @DisplayName("a failing automatic checkpoint is a warning, not an abort")
        void checkpointFailureWarns() {
            tree.edit("src/App.java", "v2");
            snapshots.failOnCreate();

            TransitionResult result = toTesting();

            assertTrue(result.succeeded());
            assertTrue(result.automaticCheckpoint().isEmpty());
            assertTrue(result.warnings().get(0).contains("AUTH-001-auto-specifying"));
        }

        @Test
        @DisplayName("publishes lifecycle events in order")
        void events() {
            tree.edit("src/App.java", "v2");
            globalHooks.add(new HookDefinition("lint", "pre-testing", "lint", false, null, null, false));

            toTesting();

            assertEquals(List.of("transition.started", "checkpoint.created", "transition.phase", "hooks.completed",
                    "transition.phase", "transition.phase", "transition.committed", "transition.phase",
                    "transition.phase", "transition.completed"), events);
        }

        @Test
        @DisplayName("publishes every phase reached, even with a clean tree and no hooks")
        void phaseEvents() {
            List<Object> phases = new ArrayList<>();
            eventBus.subscribeAll(e -> {
                if (e.eventType().equals("transition.phase")) {
                    phases.add(e.payload().get("phase"));
                }
            });

            toTesting();

            assertEquals(List.of("CHECKPOINTED", "PRE_HOOKED", "VALIDATED", "COMMITTED", "POST_HOOKED"), phases);
        }

        @Test
        @DisplayName("an aborted transition publishes only the phases it reached")
        void phaseEventsOnAbort() {
            List<Object> phases = new ArrayList<>();
            eventBus.subscribeAll(e -> {
                if (e.eventType().equals("transition.phase")) {
                    phases.add(e.payload().get("phase"));
                }
            });
            globalHooks.add(new HookDefinition("gate", "pre-testing", "gate", true, null, null, false));
            executor.failing("gate", 1, "");

            toTesting();

            assertEquals(List.of("CHECKPOINTED"), phases);
        }
    }

    @Nested
    @DisplayName("pre-hooks")
    class PreHooks {

        @Test
        @DisplayName("a failing blocking pre-hook aborts without touching the work unit")
        void blockingFailureAborts() {
            WorkUnit before = stored();
            globalHooks.add(new HookDefinition("spec-lint", "pre-testing", "spec-lint", true, null, null, false));
            globalHooks.add(new HookDefinition("after", "post-testing", "after", false, null, null, false));
            executor.failing("spec-lint", 1, "missing scenario");

            TransitionResult result = toTesting();

            assertEquals(TransitionOutcome.ABORTED_BY_PRE_HOOK, result.outcome());
            assertEquals(TransitionPhase.CHECKPOINTED, result.phase());
            assertEquals(1, result.exitCode());
            assertEquals(before, stored());
            assertEquals(0, repository.saveCount());
            assertEquals(List.of("spec-lint"), executor.commandLines());
            assertNull(result.postHooks());
            var failure = assertInstanceOf(BlockingHookFailureException.class, result.failure().orElseThrow());
            assertEquals("spec-lint", failure.getHookName());
            assertEquals(HookPhase.PRE, failure.getPhase());
            assertThrows(BlockingHookFailureException.class, result::orThrow);
            assertTrue(events.contains("transition.aborted"));
        }

        @Test
        @DisplayName("the automatic checkpoint survives an aborted transition")
        void checkpointKeptOnAbort() {
            tree.edit("src/App.java", "v2");
            globalHooks.add(new HookDefinition("gate", "pre-testing", "gate", true, null, null, false));
            executor.failing("gate", 2, "");

            toTesting();

            assertEquals(1, checkpoints.list(ID).size());
        }

        @Test
        @DisplayName("a failing non-blocking pre-hook does not stop the transition")
        void nonBlockingFailure() {
            globalHooks.add(new HookDefinition("advice", "pre-testing", "advice", false, null, null, false));
            executor.failing("advice", 1, "consider more scenarios");

            TransitionResult result = toTesting();

            assertTrue(result.succeeded());
            assertEquals(1, result.preHooks().nonBlockingFailures().size());
        }
    }

    @Nested
    @DisplayName("temporal validation")
    class Temporal {

        @Test
        @DisplayName("a stale feature file rejects the transition and leaves history unchanged")
        void staleFeatureRejects() throws IOException {
            touch(feature, ENTERED_SPECIFYING.minus(Duration.ofMinutes(5)));

            TransitionResult result = toTesting();

            assertEquals(TransitionOutcome.ABORTED_BY_TEMPORAL_VIOLATION, result.outcome());
            assertEquals(TransitionPhase.PRE_HOOKED, result.phase());
            assertEquals(2, stored().stateHistory().size());
            assertEquals(WorkUnitStatus.SPECIFYING, stored().status());
            var failure = assertInstanceOf(TemporalOrderingViolationException.class,
                    result.failure().orElseThrow());
            assertEquals(feature, failure.getViolations().get(0).path());
        }

        @Test
        @DisplayName("bypassing the check commits and records a warning")
        void bypass() throws IOException {
            touch(feature, ENTERED_SPECIFYING.minus(Duration.ofMinutes(5)));

            TransitionResult result = coordinator.transition(ID, WorkUnitStatus.TESTING,
                    TransitionOptions.skippingTemporalValidation());

            assertTrue(result.succeeded());
            assertNull(result.temporal());
            assertTrue(result.warnings().contains("Temporal validation was skipped"));
            assertEquals(WorkUnitStatus.TESTING, stored().status());
        }

        @Test
        @DisplayName("tasks skip testing and are never temporally checked")
        void tasks() throws IOException {
            repository.with(WorkUnit.create("OPS-7", "Rotate keys", WorkUnitType.TASK, CREATED)
                    .withTransition(WorkUnitStatus.SPECIFYING, ENTERED_SPECIFYING, null));
            touch(feature, CREATED.minus(Duration.ofDays(1)));

            assertThrows(InvalidTargetException.class,
                    () -> coordinator.transition("OPS-7", WorkUnitStatus.TESTING, TransitionOptions.defaults()));
            TransitionResult result = coordinator.transition("OPS-7", WorkUnitStatus.IMPLEMENTING,
                    TransitionOptions.defaults());
            assertTrue(result.succeeded());
        }
    }

    @Nested
    @DisplayName("post-hooks")
    class PostHooks {

        @Test
        @DisplayName("a failing blocking post-hook keeps the commit but fails the result")
        void blockingPostFailure() {
            globalHooks.add(new HookDefinition("notify", "post-testing", "notify", true, null, null, false));
            executor.failing("notify", 4, "webhook down");

            TransitionResult result = toTesting();

            assertEquals(TransitionOutcome.COMMITTED_WITH_POST_HOOK_FAILURE, result.outcome());
            assertEquals(TransitionPhase.COMMITTED, result.phase());
            assertEquals(1, result.exitCode());
            assertFalse(result.succeeded());
            assertTrue(result.outcome().committed());
            assertEquals(WorkUnitStatus.TESTING, stored().status());
            var failure = assertInstanceOf(BlockingHookFailureException.class, result.failure().orElseThrow());
            assertEquals(HookPhase.POST, failure.getPhase());
            assertTrue(failure.getMessage().contains("webhook down"));
        }

        @Test
        @DisplayName("post-hooks see the committed state")
        void postHooksAfterCommit() {
            globalHooks.add(new HookDefinition("pre", "pre-testing", "pre", false, null, null, false));
            globalHooks.add(new HookDefinition("post", "post-testing", "post", false, null, null, false));

            toTesting();

            assertEquals(List.of("pre", "post"), executor.commandLines());
        }
    }

    @Nested
    @DisplayName("workflow rules")
    class Rules {

        @Test
        @DisplayName("illegal moves and unknown targets are invalid")
        void invalid() {
            assertThrows(InvalidTargetException.class,
                    () -> coordinator.transition(ID, WorkUnitStatus.DONE, TransitionOptions.defaults()));
            assertThrows(InvalidTargetException.class,
                    () -> coordinator.transition(ID, "shipping", TransitionOptions.defaults()));
            assertThrows(InvalidTargetException.class,
                    () -> coordinator.transition("NOPE-9", WorkUnitStatus.TESTING, TransitionOptions.defaults()));
            assertEquals(0, repository.saveCount());
            assertTrue(events.isEmpty());
        }

        @Test
        @DisplayName("blocking requires a reason, which is stored")
        void blocked() {
            assertThrows(InvalidTargetException.class,
                    () -> coordinator.transition(ID, WorkUnitStatus.BLOCKED, TransitionOptions.defaults()));

            coordinator.transition(ID, WorkUnitStatus.BLOCKED, TransitionOptions.blocked("waiting on IdP"));

            assertEquals("waiting on IdP", stored().blockedReason());
            assertEquals(WorkUnitStatus.BLOCKED, stored().status());
        }
    }

    @Test
    @DisplayName("reaching done removes automatic checkpoints and warns about remaining virtual hooks")
    void done() {
        WorkUnit validating = specifyingStory()
                .withTransition(WorkUnitStatus.TESTING, ENTERED_SPECIFYING.plusSeconds(60), null)
                .withTransition(WorkUnitStatus.IMPLEMENTING, ENTERED_SPECIFYING.plusSeconds(120), null)
                .withTransition(WorkUnitStatus.VALIDATING, ENTERED_SPECIFYING.plusSeconds(180), null)
                .withVirtualHooks(List.of(new HookDefinition("smoke", "pre-validating", "smoke", false, null, null,
                        false)), ENTERED_SPECIFYING);
        repository.with(validating);
        checkpoints.create(ID, "AUTH-001-auto-testing", CheckpointKind.AUTOMATIC);
        checkpoints.create(ID, "before-release", CheckpointKind.MANUAL);
        tree.edit("src/App.java", "final");

        TransitionResult result = coordinator.transition(ID, WorkUnitStatus.DONE, TransitionOptions.defaults());

        assertTrue(result.succeeded());
        assertEquals(List.of("before-release"), checkpoints.list(ID).stream().map(Checkpoint::name).toList());
        assertTrue(result.warnings().stream().anyMatch(w -> w.contains("1 virtual hook")));
        assertTrue(events.contains("checkpoint.cleanup"));
    }
}
