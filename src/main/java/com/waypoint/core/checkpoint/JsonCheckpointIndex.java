package com.waypoint.core.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.waypoint.core.model.Checkpoint;
import com.waypoint.core.persistence.JsonDocuments;
import com.waypoint.core.snapshot.SnapshotStoreException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Checkpoint index stored as one JSON file per work unit, {@code <indexDir>/<workUnitId>.json}.
 */
public class JsonCheckpointIndex implements CheckpointIndex {

    public record IndexDocument(String workUnitId, List<Checkpoint> checkpoints) {
        public IndexDocument {
            checkpoints = checkpoints == null ? List.of() : List.copyOf(checkpoints);
        }
    }

    private final Path indexDir;
    private final ObjectMapper mapper;

    public JsonCheckpointIndex(Path indexDir, ObjectMapper mapper) {
        this.indexDir = indexDir;
        this.mapper = mapper;
    }

    public JsonCheckpointIndex(Path indexDir) {
        this(indexDir, JsonDocuments.newMapper());
    }

    @Override
    public List<Checkpoint> load(String workUnitId) {
        Path file = fileFor(workUnitId);
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            return mapper.readValue(file.toFile(), IndexDocument.class).checkpoints();
        } catch (IOException e) {
            throw new SnapshotStoreException("Cannot read checkpoint index " + file, e);
        }
    }

    @Override
    public void store(String workUnitId, List<Checkpoint> checkpoints) {
        Path file = fileFor(workUnitId);
        try {
            if (checkpoints.isEmpty()) {
                Files.deleteIfExists(file);
                return;
            }
            JsonDocuments.writeAtomically(file, mapper.writeValueAsBytes(new IndexDocument(workUnitId, checkpoints)));
        } catch (IOException e) {
            throw new SnapshotStoreException("Cannot write checkpoint index " + file, e);
        }
    }

    private Path fileFor(String workUnitId) {
        if (workUnitId.contains("/") || workUnitId.contains("\\") || workUnitId.startsWith(".")) {
            throw new IllegalArgumentException("Invalid work unit id: " + workUnitId);
        }
        return indexDir.resolve(workUnitId + ".json");
    }
}
