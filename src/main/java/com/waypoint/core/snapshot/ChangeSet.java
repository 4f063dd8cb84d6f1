package com.waypoint.core.snapshot;

import java.util.List;

/**
 * Staged and unstaged paths of the working tree. Untracked files count as unstaged.
 */
public record ChangeSet(
    List<String> stagedFiles,
    List<String> unstagedFiles
) {
    public ChangeSet {
        stagedFiles = List.copyOf(stagedFiles);
        unstagedFiles = List.copyOf(unstagedFiles);
    }

    public static ChangeSet empty() {
        return new ChangeSet(List.of(), List.of());
    }
}
