package com.waypoint.core.checkpoint;

import com.waypoint.core.WaypointException;

import java.util.List;

/**
 * The working tree holds local edits that an operation would overwrite.
 * The caller must pick a remediation: commit or checkpoint first, force, or merge with markers.
 */
public class DirtyWorkingTreeException extends WaypointException {

    private final List<String> paths;

    public DirtyWorkingTreeException(String message, List<String> paths) {
        super(message);
        this.paths = List.copyOf(paths);
    }

    public List<String> getPaths() {
        return paths;
    }
}
