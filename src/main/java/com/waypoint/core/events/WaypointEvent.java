package com.waypoint.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a transition runs, used for CLI verbose output.
 *
 * @param eventType  e.g. "transition.started", "checkpoint.created", "transition.committed"
 * @param workUnitId the work unit being transitioned
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record WaypointEvent(
    String eventType,
    String workUnitId,
    Map<String, Object> payload,
    Instant timestamp
) {}
