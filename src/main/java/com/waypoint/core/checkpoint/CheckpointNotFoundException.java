package com.waypoint.core.checkpoint;

import com.waypoint.core.WaypointException;

public class CheckpointNotFoundException extends WaypointException {

    private final String workUnitId;
    private final String checkpointName;

    public CheckpointNotFoundException(String workUnitId, String checkpointName) {
        super("Checkpoint '%s' not found for work unit %s".formatted(checkpointName, workUnitId));
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
