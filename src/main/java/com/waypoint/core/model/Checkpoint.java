package com.waypoint.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * A named, restorable capture of the working tree for one work unit.
 * Never mutated once recorded; restoring it does not consume it.
 */
public record Checkpoint(
    String name,
    CheckpointKind kind,
    Instant createdAt,
    String workUnitId,
    String snapshotRef
) {
    @JsonIgnore
    public boolean isAutomatic() {
        return kind == CheckpointKind.AUTOMATIC;
    }
}
