package com.waypoint.support;

import com.waypoint.core.snapshot.SnapshotStore;
import com.waypoint.core.snapshot.SnapshotStoreException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot store over a {@link FakeWorkingTree}. Deleted paths are not captured,
 * matching what a commit-based store records.
 */
public class FakeSnapshotStore implements SnapshotStore {

    private record Snapshot(Map<String, byte[]> files, Map<String, byte[]> baseline) {}

    private final FakeWorkingTree tree;
    private final Map<String, Snapshot> snapshots = new HashMap<>();
    private final List<String> dropped = new ArrayList<>();
    private int sequence;
    private boolean failing;

    public FakeSnapshotStore(FakeWorkingTree tree) {
        this.tree = tree;
    }

    public void failOnCreate() {
        this.failing = true;
    }

    public boolean exists(String ref) {
        return snapshots.containsKey(ref);
    }

    public List<String> dropped() {
        return dropped;
    }

    public int createdCount() {
        return sequence;
    }

    @Override
    public String createSnapshot(Collection<String> paths) {
        if (failing) {
            throw new SnapshotStoreException("snapshot storage unavailable");
        }
        var files = new LinkedHashMap<String, byte[]>();
        var baseline = new HashMap<String, byte[]>();
        for (String path : paths) {
            tree.read(path).ifPresent(content -> files.put(path, content));
            byte[] base = tree.committedFiles().get(path);
            if (base != null) {
                baseline.put(path, base.clone());
            }
        }
        String ref = "snap-" + (++sequence);
        snapshots.put(ref, new Snapshot(files, baseline));
        return ref;
    }

    @Override
    public Optional<byte[]> readHistoricalFile(String ref, String path) {
        return Optional.ofNullable(snapshot(ref).files().get(path)).map(byte[]::clone);
    }

    @Override
    public Optional<byte[]> readBaselineFile(String ref, String path) {
        return Optional.ofNullable(snapshot(ref).baseline().get(path)).map(byte[]::clone);
    }

    @Override
    public List<String> listFiles(String ref) {
        return List.copyOf(snapshot(ref).files().keySet());
    }

    @Override
    public void dropSnapshot(String ref) {
        snapshots.remove(ref);
        dropped.add(ref);
    }

    private Snapshot snapshot(String ref) {
        Snapshot snapshot = snapshots.get(ref);
        if (snapshot == null) {
            throw new SnapshotStoreException("Unknown snapshot " + ref);
        }
        return snapshot;
    }
}
