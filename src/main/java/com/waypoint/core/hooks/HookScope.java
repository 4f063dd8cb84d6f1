package com.waypoint.core.hooks;

public enum HookScope {
    /** Attached to a single work unit. */
    VIRTUAL,
    /** Defined in the project-wide hook configuration. */
    GLOBAL
}
