package com.waypoint.support;

import com.waypoint.core.checkpoint.CheckpointIndex;
import com.waypoint.core.model.Checkpoint;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class InMemoryCheckpointIndex implements CheckpointIndex {

    private final Map<String, List<Checkpoint>> byUnit = new HashMap<>();

    @Override
    public List<Checkpoint> load(String workUnitId) {
        return byUnit.getOrDefault(workUnitId, List.of());
    }

    @Override
    public void store(String workUnitId, List<Checkpoint> checkpoints) {
        if (checkpoints.isEmpty()) {
            byUnit.remove(workUnitId);
        } else {
            byUnit.put(workUnitId, List.copyOf(checkpoints));
        }
    }
}
