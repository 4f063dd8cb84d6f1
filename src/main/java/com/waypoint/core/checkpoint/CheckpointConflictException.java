package com.waypoint.core.checkpoint;

import com.waypoint.core.model.Checkpoint;

import java.util.List;

public class CheckpointConflictException extends DirtyWorkingTreeException {

    private final Checkpoint checkpoint;
    private final List<RestoreConflict> conflicts;

    public CheckpointConflictException(Checkpoint checkpoint, List<RestoreConflict> conflicts) {
        super("Restoring checkpoint '%s' would overwrite %d locally modified file(s)"
                        .formatted(checkpoint.name(), conflicts.size()),
                conflicts.stream().map(RestoreConflict::path).toList());
        this.checkpoint = checkpoint;
        this.conflicts = List.copyOf(conflicts);
    }

    public Checkpoint getCheckpoint() {
        return checkpoint;
    }

    public List<RestoreConflict> getConflicts() {
        return conflicts;
    }
}
