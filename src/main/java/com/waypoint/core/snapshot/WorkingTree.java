package com.waypoint.core.snapshot;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * The project's working tree as seen by checkpoints and hooks.
 * Paths are relative to {@link #root()} and use forward slashes.
 */
public interface WorkingTree {

    Path root();

    /**
     * Modified, added, deleted and untracked paths; ignored paths are excluded.
     */
    List<String> changedPaths();

    default boolean isDirty() {
        return !changedPaths().isEmpty();
    }

    /**
     * Staged and unstaged change-set handed to hooks that ask for git context.
     */
    ChangeSet changeSet();

    Optional<byte[]> read(String path);

    void write(String path, byte[] content);
}
