package com.waypoint.core.checkpoint;

import com.waypoint.core.model.Checkpoint;

import java.util.List;

/**
 * Outcome of a checkpoint restore.
 *
 * @param checkpoint     the checkpoint that was restored (it is never consumed)
 * @param resolution     the conflict policy the caller chose
 * @param applied        whether any file was written; false when conflicts aborted the restore
 * @param writtenPaths   paths written to the working tree
 * @param unchangedPaths paths that already matched the checkpoint
 * @param conflicts      every conflicting path with both versions
 */
public record RestoreResult(
    Checkpoint checkpoint,
    ConflictResolution resolution,
    boolean applied,
    List<String> writtenPaths,
    List<String> unchangedPaths,
    List<RestoreConflict> conflicts
) {
    public RestoreResult {
        writtenPaths = List.copyOf(writtenPaths);
        unchangedPaths = List.copyOf(unchangedPaths);
        conflicts = List.copyOf(conflicts);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    /**
     * True when the restore was aborted because of conflicts and needs a caller decision.
     */
    public boolean requiresResolution() {
        return !applied && hasConflicts();
    }

    /**
     * Returns this result, or throws {@link CheckpointConflictException} if the restore was aborted.
     */
    public RestoreResult orThrow() {
        if (requiresResolution()) {
            throw new CheckpointConflictException(checkpoint, conflicts);
        }
        return this;
    }
}
