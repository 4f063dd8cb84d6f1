package com.waypoint.core.checkpoint;

import com.waypoint.core.model.Checkpoint;

import java.util.List;

public record CleanupResult(List<Checkpoint> deleted, List<Checkpoint> preserved) {

    public CleanupResult {
        deleted = List.copyOf(deleted);
        preserved = List.copyOf(preserved);
    }

    public int deletedCount() {
        return deleted.size();
    }

    public int preservedCount() {
        return preserved.size();
    }
}
