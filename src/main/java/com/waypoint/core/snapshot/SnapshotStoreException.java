package com.waypoint.core.snapshot;

import com.waypoint.core.WaypointException;

/**
 * Failure of the underlying version-control store or of working-tree I/O.
 */
public class SnapshotStoreException extends WaypointException {

    public SnapshotStoreException(String message) {
        super(message);
    }

    public SnapshotStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
