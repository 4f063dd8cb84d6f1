package com.waypoint.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One entry of a work unit's append-only state history.
 *
 * @param state     the state that was entered
 * @param timestamp when it was entered
 * @param reason    optional note, set when entering {@code blocked}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StateHistoryEntry(
    WorkUnitStatus state,
    Instant timestamp,
    String reason
) {
    public StateHistoryEntry(WorkUnitStatus state, Instant timestamp) {
        this(state, timestamp, null);
    }
}
