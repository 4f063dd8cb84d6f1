package com.waypoint.core.hooks;

/**
 * Capability to run a hook command as an external process.
 */
@FunctionalInterface
public interface HookExecutor {

    ProcessResult execute(HookCommand command);
}
