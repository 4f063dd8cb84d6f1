package com.waypoint.core;

/**
 * Base type for every failure Waypoint reports to its callers.
 * Subclasses carry the structured detail needed to act on the failure.
 */
public class WaypointException extends RuntimeException {

    public WaypointException(String message) {
        super(message);
    }

    public WaypointException(String message, Throwable cause) {
        super(message, cause);
    }
}
