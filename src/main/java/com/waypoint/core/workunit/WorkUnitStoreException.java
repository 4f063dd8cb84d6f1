package com.waypoint.core.workunit;

import com.waypoint.core.WaypointException;

public class WorkUnitStoreException extends WaypointException {

    public WorkUnitStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
