package com.waypoint.core.checkpoint;

/**
 * How a restore treats paths that were edited since the checkpoint's baseline.
 */
public enum ConflictResolution {
    /** Write nothing if any path conflicts; report the conflicts. */
    ABORT,
    /** Replace conflicting files with the checkpoint version. */
    OVERWRITE,
    /** Write conflicting files with both versions between conflict markers. */
    INLINE_MARKERS
}
