package com.waypoint.core.workunit;

import com.waypoint.core.WaypointException;

/**
 * Raised for an unknown work unit id, an unknown state, or a transition the workflow does not allow.
 */
public class InvalidTargetException extends WaypointException {

    public InvalidTargetException(String message) {
        super(message);
    }
}
