package com.waypoint.core.snapshot;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Object-addressed snapshot storage used by the checkpoint engine.
 * A snapshot captures a set of working-tree paths on top of a baseline
 * (the committed state the paths were changed from).
 */
public interface SnapshotStore {

    /**
     * Captures the current content of {@code paths} and returns an opaque reference.
     */
    String createSnapshot(Collection<String> paths);

    /**
     * Content of {@code path} as captured in the snapshot, empty if the snapshot has no such file.
     */
    Optional<byte[]> readHistoricalFile(String ref, String path);

    /**
     * Content of {@code path} in the baseline the snapshot was taken against,
     * empty if the file did not exist there.
     */
    Optional<byte[]> readBaselineFile(String ref, String path);

    /**
     * Paths recorded by the snapshot, i.e. those whose content it carries.
     */
    List<String> listFiles(String ref);

    void dropSnapshot(String ref);
}
