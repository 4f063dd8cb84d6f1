package com.waypoint.core.checkpoint;

import java.nio.charset.StandardCharsets;

/**
 * A path whose working-tree content diverged from both the checkpoint and its baseline.
 */
public record RestoreConflict(
    String path,
    byte[] workingContent,
    byte[] checkpointContent
) {
    public String workingText() {
        return new String(workingContent, StandardCharsets.UTF_8);
    }

    public String checkpointText() {
        return new String(checkpointContent, StandardCharsets.UTF_8);
    }
}
