package com.waypoint.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A lifecycle hook, either global (project-wide config) or virtual (attached to one work unit).
 *
 * @param name           identifier, unique per event
 * @param event          lifecycle event such as {@code pre-implementing} or {@code post-validating}
 * @param command        shell command, relative paths resolve against the project root
 * @param blocking       whether a failure halts the pipeline
 * @param timeoutSeconds per-hook timeout, {@code null} for the configured default
 * @param condition      optional applicability filter
 * @param gitContext     whether the hook receives the staged/unstaged change-set on stdin
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HookDefinition(
    String name,
    String event,
    String command,
    boolean blocking,
    @JsonAlias("timeout") Integer timeoutSeconds,
    HookCondition condition,
    boolean gitContext
) {
    public HookDefinition withEvent(String newEvent) {
        return new HookDefinition(name, newEvent, command, blocking, timeoutSeconds, condition, gitContext);
    }

    @JsonIgnore
    public boolean isUnconditional() {
        return condition == null || condition.isEmpty();
    }
}
