package com.waypoint.core.checkpoint;

import com.waypoint.core.WaypointException;

public class CheckpointNameCollisionException extends WaypointException {

    private final String workUnitId;
    private final String checkpointName;

    public CheckpointNameCollisionException(String workUnitId, String checkpointName) {
        super("Checkpoint '%s' already exists for work unit %s; choose another name or overwrite it"
                .formatted(checkpointName, workUnitId));
        this.workUnitId = workUnitId;
        this.checkpointName = checkpointName;
    }

    public String getWorkUnitId() {
        return workUnitId;
    }

    public String getCheckpointName() {
        return checkpointName;
    }
}
