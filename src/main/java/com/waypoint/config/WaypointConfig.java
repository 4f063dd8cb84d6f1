package com.waypoint.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.waypoint.core.checkpoint.CheckpointEngine;
import com.waypoint.core.checkpoint.CheckpointIndex;
import com.waypoint.core.checkpoint.JsonCheckpointIndex;
import com.waypoint.core.events.EventBus;
import com.waypoint.core.git.GitCommandRunner;
import com.waypoint.core.git.GitSnapshotStore;
import com.waypoint.core.git.GitWorkingTree;
import com.waypoint.core.health.HealthCheckService;
import com.waypoint.core.hooks.GlobalHookStore;
import com.waypoint.core.hooks.HookExecutor;
import com.waypoint.core.hooks.HookManagementService;
import com.waypoint.core.hooks.HookOrchestrator;
import com.waypoint.core.hooks.JsonGlobalHookStore;
import com.waypoint.core.hooks.ProcessHookExecutor;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.persistence.JsonDocuments;
import com.waypoint.core.snapshot.SnapshotStore;
import com.waypoint.core.snapshot.WorkingTree;
import com.waypoint.core.temporal.ArtifactResolver;
import com.waypoint.core.temporal.ConventionArtifactResolver;
import com.waypoint.core.temporal.TemporalValidator;
import com.waypoint.core.transition.TransitionCoordinator;
import com.waypoint.core.workunit.JsonWorkUnitRepository;
import com.waypoint.core.workunit.WorkUnitRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;

/**
 * Wires the core components against the project directory named by {@code waypoint.project-root}.
 * All document paths in {@link WaypointProperties} resolve against that directory.
 */
@Configuration
public class WaypointConfig {

    @Bean
    public Path projectRoot(WaypointProperties properties) {
        return Path.of(properties.getProjectRoot()).toAbsolutePath().normalize();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    /**
     * Mapper shared by every on-disk document and by hook stdin payloads.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return JsonDocuments.newMapper();
    }

    @Bean
    public GitCommandRunner gitCommandRunner(Path projectRoot) {
        return new GitCommandRunner(projectRoot);
    }

    @Bean
    public SnapshotStore snapshotStore(GitCommandRunner git, WaypointProperties properties) {
        return new GitSnapshotStore(git, properties.getCheckpoints().getRefNamespace());
    }

    @Bean
    public WorkingTree workingTree(GitCommandRunner git) {
        return new GitWorkingTree(git);
    }

    @Bean
    public WorkUnitRepository workUnitRepository(Path projectRoot, WaypointProperties properties,
                                                 ObjectMapper mapper) {
        return new JsonWorkUnitRepository(projectRoot.resolve(properties.getWorkUnits().getFile()), mapper);
    }

    @Bean
    public CheckpointIndex checkpointIndex(Path projectRoot, WaypointProperties properties,
                                           ObjectMapper mapper) {
        return new JsonCheckpointIndex(projectRoot.resolve(properties.getCheckpoints().getIndexDir()), mapper);
    }

    @Bean
    public CheckpointEngine checkpointEngine(SnapshotStore snapshotStore, WorkingTree workingTree,
                                             CheckpointIndex checkpointIndex, Clock clock, WaypointMetrics metrics) {
        return new CheckpointEngine(snapshotStore, workingTree, checkpointIndex, clock, metrics);
    }

    @Bean
    public GlobalHookStore globalHookStore(Path projectRoot, WaypointProperties properties,
                                           ObjectMapper mapper) {
        return new JsonGlobalHookStore(projectRoot.resolve(properties.getHooks().getConfigFile()), mapper);
    }

    @Bean
    public HookExecutor hookExecutor(WaypointProperties properties) {
        return new ProcessHookExecutor(properties.getHooks().getShell());
    }

    @Bean
    public HookOrchestrator hookOrchestrator(GlobalHookStore globalHookStore, HookExecutor hookExecutor,
                                             WorkingTree workingTree,
                                             ObjectMapper mapper,
                                             Clock clock, WaypointMetrics metrics, WaypointProperties properties) {
        return new HookOrchestrator(globalHookStore, hookExecutor, workingTree, mapper, clock, metrics,
                Duration.ofSeconds(properties.getHooks().getDefaultTimeoutSeconds()));
    }

    @Bean
    public HookManagementService hookManagementService(WorkUnitRepository repository,
                                                       GlobalHookStore globalHookStore, Clock clock) {
        return new HookManagementService(repository, globalHookStore, clock);
    }

    @Bean
    public ArtifactResolver artifactResolver(Path projectRoot, WaypointProperties properties,
                                             ObjectMapper mapper) {
        var temporal = properties.getTemporal();
        return new ConventionArtifactResolver(projectRoot, temporal.getFeaturesDir(), temporal.getTestRoots(),
                new HashSet<>(temporal.getIgnoreDirs()), mapper);
    }

    @Bean
    public TemporalValidator temporalValidator() {
        return new TemporalValidator();
    }

    @Bean
    public TransitionCoordinator transitionCoordinator(WorkUnitRepository repository, CheckpointEngine checkpointEngine,
                                                       WorkingTree workingTree, HookOrchestrator hookOrchestrator,
                                                       TemporalValidator temporalValidator,
                                                       ArtifactResolver artifactResolver, EventBus eventBus,
                                                       WaypointMetrics metrics, Clock clock) {
        return new TransitionCoordinator(repository, checkpointEngine, workingTree, hookOrchestrator,
                temporalValidator, artifactResolver, eventBus, metrics, clock);
    }

    @Bean
    public HealthCheckService healthCheckService(GitCommandRunner git, WorkUnitRepository repository,
                                                 GlobalHookStore globalHookStore) {
        return new HealthCheckService(git, repository, globalHookStore);
    }
}
