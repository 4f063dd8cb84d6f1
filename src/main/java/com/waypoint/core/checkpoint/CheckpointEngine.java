package com.waypoint.core.checkpoint;

import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.model.Checkpoint;
import com.waypoint.core.model.CheckpointKind;
import com.waypoint.core.model.WorkUnitStatus;
import com.waypoint.core.snapshot.SnapshotStore;
import com.waypoint.core.snapshot.SnapshotStoreException;
import com.waypoint.core.snapshot.WorkingTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates, lists, restores and prunes named checkpoints of the working tree, per work unit.
 * <p>
 * Snapshot content lives in the {@link SnapshotStore}; this engine owns only the mapping
 * from (work unit, name) to snapshot reference, kept in a {@link CheckpointIndex}.
 * <p>
 * Restore runs in two phases. The pre-flight reads every recorded file and classifies it
 * against the working tree before anything is written; the apply phase then writes all
 * files or, when conflicts exist and the caller asked to abort, none of them.
 */
public class CheckpointEngine {

    private static final Logger log = LoggerFactory.getLogger(CheckpointEngine.class);

    private final SnapshotStore snapshotStore;
    private final WorkingTree workingTree;
    private final CheckpointIndex index;
    private final Clock clock;
    private final WaypointMetrics metrics;

    public CheckpointEngine(SnapshotStore snapshotStore, WorkingTree workingTree, CheckpointIndex index,
                            Clock clock, WaypointMetrics metrics) {
        this.snapshotStore = snapshotStore;
        this.workingTree = workingTree;
        this.index = index;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Name of the automatic checkpoint taken before a unit leaves {@code state},
     * e.g. {@code AUTH-001-auto-testing}.
     */
    public static String automaticName(String workUnitId, WorkUnitStatus state) {
        return workUnitId + "-auto-" + state.value();
    }

    // --- create ---

    public Checkpoint create(String workUnitId, String name, CheckpointKind kind) {
        return create(workUnitId, name, kind, false);
    }

    /**
     * Snapshots every modified and untracked file and records it under {@code name}.
     *
     * @param overwrite replace an existing checkpoint of the same name instead of failing
     * @throws CheckpointNameCollisionException if the name is taken and {@code overwrite} is false
     */
    public Checkpoint create(String workUnitId, String name, CheckpointKind kind, boolean overwrite) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Checkpoint name must not be blank");
        }
        var checkpoints = new ArrayList<>(index.load(workUnitId));
        Optional<Checkpoint> existing = checkpoints.stream().filter(c -> c.name().equals(name)).findFirst();
        if (existing.isPresent() && !overwrite) {
            throw new CheckpointNameCollisionException(workUnitId, name);
        }

        List<String> paths = workingTree.changedPaths();
        String ref = snapshotStore.createSnapshot(paths);
        var checkpoint = new Checkpoint(name, kind, clock.instant(), workUnitId, ref);

        existing.ifPresent(checkpoints::remove);
        checkpoints.add(checkpoint);
        index.store(workUnitId, checkpoints);

        existing.ifPresent(old -> dropQuietly(old));
        metrics.recordCheckpointCreated(kind.value());
        log.info("Created {} checkpoint '{}' for {} ({} file(s))", kind.value(), name, workUnitId, paths.size());
        return checkpoint;
    }

    // --- list ---

    /**
     * Checkpoints of the unit, newest first. Equal timestamps fall back to creation order.
     */
    public List<Checkpoint> list(String workUnitId) {
        List<Checkpoint> checkpoints = index.load(workUnitId);
        var positions = new LinkedHashMap<Checkpoint, Integer>();
        for (int i = 0; i < checkpoints.size(); i++) {
            positions.put(checkpoints.get(i), i);
        }
        return checkpoints.stream()
                .sorted(Comparator.comparing(Checkpoint::createdAt)
                        .thenComparing(positions::get)
                        .reversed())
                .toList();
    }

    public Optional<Checkpoint> find(String workUnitId, String name) {
        return index.load(workUnitId).stream().filter(c -> c.name().equals(name)).findFirst();
    }

    // --- restore ---

    public RestoreResult restore(String workUnitId, String name) {
        return restore(workUnitId, name, ConflictResolution.ABORT);
    }

    /**
     * Restores every file recorded in the checkpoint.
     * <p>
     * A path conflicts when the working file exists, differs from the checkpoint version,
     * and also differs from the checkpoint's baseline, i.e. it was edited locally. Missing
     * files and files still at their baseline content are restored without conflict.
     */
    public RestoreResult restore(String workUnitId, String name, ConflictResolution resolution) {
        Checkpoint checkpoint = find(workUnitId, name)
                .orElseThrow(() -> new CheckpointNotFoundException(workUnitId, name));

        // Pre-flight: classify every path before touching the working tree
        Map<String, byte[]> toWrite = new LinkedHashMap<>();
        var unchanged = new ArrayList<String>();
        var conflicts = new ArrayList<RestoreConflict>();
        for (String path : snapshotStore.listFiles(checkpoint.snapshotRef())) {
            byte[] saved = snapshotStore.readHistoricalFile(checkpoint.snapshotRef(), path)
                    .orElseThrow(() -> new SnapshotStoreException(
                            "Snapshot %s lists %s but has no content for it".formatted(checkpoint.snapshotRef(), path)));
            Optional<byte[]> current = workingTree.read(path);
            if (current.isEmpty()) {
                toWrite.put(path, saved);
            } else if (Arrays.equals(current.get(), saved)) {
                unchanged.add(path);
            } else if (snapshotStore.readBaselineFile(checkpoint.snapshotRef(), path)
                    .map(base -> Arrays.equals(base, current.get()))
                    .orElse(false)) {
                toWrite.put(path, saved);
            } else {
                conflicts.add(new RestoreConflict(path, current.get(), saved));
            }
        }

        if (!conflicts.isEmpty() && resolution == ConflictResolution.ABORT) {
            metrics.recordRestore("conflict");
            log.warn("Restore of '{}' for {} aborted: {} conflicting file(s)", name, workUnitId, conflicts.size());
            return new RestoreResult(checkpoint, resolution, false, List.of(), unchanged, conflicts);
        }

        // Apply
        for (RestoreConflict conflict : conflicts) {
            toWrite.put(conflict.path(), resolution == ConflictResolution.INLINE_MARKERS
                    ? withConflictMarkers(conflict, name)
                    : conflict.checkpointContent());
        }
        for (var entry : toWrite.entrySet()) {
            workingTree.write(entry.getKey(), entry.getValue());
        }

        metrics.recordRestore(conflicts.isEmpty() ? "restored" : "forced");
        log.info("Restored checkpoint '{}' for {}: {} written, {} unchanged, {} conflict(s) resolved by {}",
                name, workUnitId, toWrite.size(), unchanged.size(), conflicts.size(), resolution);
        return new RestoreResult(checkpoint, resolution, true, new ArrayList<>(toWrite.keySet()), unchanged, conflicts);
    }

    static byte[] withConflictMarkers(RestoreConflict conflict, String checkpointName) {
        var out = new ByteArrayOutputStream();
        appendLine(out, "<<<<<<< working tree");
        appendSection(out, conflict.workingContent());
        appendLine(out, "=======");
        appendSection(out, conflict.checkpointContent());
        appendLine(out, ">>>>>>> checkpoint " + checkpointName);
        return out.toByteArray();
    }

    // --- cleanup / delete ---

    /**
     * Keeps the {@code keepLast} newest checkpoints and deletes the rest, whatever their kind.
     */
    public CleanupResult cleanup(String workUnitId, int keepLast) {
        if (keepLast < 0) {
            throw new IllegalArgumentException("keepLast must be >= 0, was " + keepLast);
        }
        List<Checkpoint> newestFirst = list(workUnitId);
        int preserveCount = Math.min(keepLast, newestFirst.size());
        List<Checkpoint> preserved = newestFirst.subList(0, preserveCount);
        List<Checkpoint> doomed = newestFirst.subList(preserveCount, newestFirst.size());
        deleteAll(workUnitId, doomed);
        log.info("Cleaned up checkpoints for {}: {} deleted, {} preserved", workUnitId, doomed.size(), preserved.size());
        return new CleanupResult(doomed, preserved);
    }

    /**
     * Deletes every automatic checkpoint of the unit; manual checkpoints are kept.
     */
    public CleanupResult cleanupAutomatic(String workUnitId) {
        List<Checkpoint> newestFirst = list(workUnitId);
        List<Checkpoint> automatic = newestFirst.stream().filter(Checkpoint::isAutomatic).toList();
        List<Checkpoint> manual = newestFirst.stream().filter(c -> !c.isAutomatic()).toList();
        deleteAll(workUnitId, automatic);
        if (!automatic.isEmpty()) {
            log.info("Removed {} automatic checkpoint(s) for {}", automatic.size(), workUnitId);
        }
        return new CleanupResult(automatic, manual);
    }

    public void delete(String workUnitId, String name) {
        Checkpoint checkpoint = find(workUnitId, name)
                .orElseThrow(() -> new CheckpointNotFoundException(workUnitId, name));
        deleteAll(workUnitId, List.of(checkpoint));
        log.info("Deleted checkpoint '{}' for {}", name, workUnitId);
    }

    private void deleteAll(String workUnitId, List<Checkpoint> doomed) {
        if (doomed.isEmpty()) {
            return;
        }
        var remaining = new ArrayList<>(index.load(workUnitId));
        int deleted = 0;
        try {
            for (Checkpoint checkpoint : doomed) {
                snapshotStore.dropSnapshot(checkpoint.snapshotRef());
                remaining.removeIf(c -> c.name().equals(checkpoint.name()));
                deleted++;
            }
        } finally {
            // Persist whatever was dropped, even if a later drop failed
            index.store(workUnitId, remaining);
            metrics.recordCheckpointsDeleted(deleted);
        }
    }

    private void dropQuietly(Checkpoint replaced) {
        try {
            snapshotStore.dropSnapshot(replaced.snapshotRef());
        } catch (SnapshotStoreException e) {
            log.warn("Replaced checkpoint '{}' but could not drop its snapshot {}: {}",
                    replaced.name(), replaced.snapshotRef(), e.getMessage());
        }
    }

    private static void appendLine(ByteArrayOutputStream out, String line) {
        out.writeBytes((line + "\n").getBytes(StandardCharsets.UTF_8));
    }

    private static void appendSection(ByteArrayOutputStream out, byte[] content) {
        out.writeBytes(content);
        if (content.length > 0 && content[content.length - 1] != '\n') {
            out.write('\n');
        }
    }
}
