package com.waypoint.core.hooks;

import java.nio.file.Path;
import java.time.Duration;

/**
 * One external process invocation for a hook.
 *
 * @param commandLine      shell command line
 * @param stdin            text written to the process's standard input
 * @param workingDirectory directory the process runs in
 * @param timeout          wall-clock limit after which the process is killed
 */
public record HookCommand(
    String commandLine,
    String stdin,
    Path workingDirectory,
    Duration timeout
) {}
