package com.waypoint.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for transitions, hooks and checkpoints.
 */
@Service
public class WaypointMetrics {

    private final MeterRegistry registry;

    public WaypointMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public void recordTransition(String targetState, String outcome) {
        Counter.builder("waypoint.transitions.total")
                .tag("target", targetState)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordHookExecution(String event, boolean success, boolean timedOut, long ms) {
        Timer.builder("waypoint.hook.duration")
                .tag("event", event)
                .tag("outcome", timedOut ? "timeout" : success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordCheckpointCreated(String kind) {
        Counter.builder("waypoint.checkpoints.created")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "restored", "conflict" or "forced"
     */
    public void recordRestore(String outcome) {
        Counter.builder("waypoint.checkpoints.restores")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordCheckpointsDeleted(int count) {
        Counter.builder("waypoint.checkpoints.deleted")
                .register(registry)
                .increment(count);
    }

    /**
     * Records how many artifacts failed the temporal check for a rejected transition.
     */
    public void recordTemporalViolations(int count) {
        DistributionSummary.builder("waypoint.temporal.violations")
                .description("Artifacts modified before their state was entered")
                .register(registry)
                .record(count);
    }
}
