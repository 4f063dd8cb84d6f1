package com.waypoint.core.hooks;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * JSON document written to a hook's standard input.
 * The file lists are present only for hooks that requested git context.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HookContext(
    String workUnitId,
    String event,
    Instant timestamp,
    List<String> stagedFiles,
    List<String> unstagedFiles
) {
    public HookContext(String workUnitId, String event, Instant timestamp) {
        this(workUnitId, event, timestamp, null, null);
    }
}
