package com.waypoint.core.checkpoint;

import com.waypoint.core.model.Checkpoint;

import java.util.List;

/**
 * Persistent mapping from (work unit, checkpoint name) to snapshot reference.
 * Lists are kept in creation order.
 */
public interface CheckpointIndex {

    List<Checkpoint> load(String workUnitId);

    void store(String workUnitId, List<Checkpoint> checkpoints);
}
