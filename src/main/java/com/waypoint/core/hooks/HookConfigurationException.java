package com.waypoint.core.hooks;

import com.waypoint.core.WaypointException;

public class HookConfigurationException extends WaypointException {

    public HookConfigurationException(String message) {
        super(message);
    }

    public HookConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
