package com.waypoint.core.git;

import com.waypoint.core.snapshot.ChangeSet;
import com.waypoint.core.snapshot.SnapshotStoreException;
import com.waypoint.core.snapshot.WorkingTree;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Working tree of a git repository whose top-level directory is the project root.
 * Change detection parses {@code git status --porcelain -z}.
 */
public class GitWorkingTree implements WorkingTree {

    private final GitCommandRunner git;
    private final Path root;

    public GitWorkingTree(GitCommandRunner git) {
        this.git = git;
        this.root = git.getRepositoryRoot().toAbsolutePath().normalize();
    }

    @Override
    public Path root() {
        return root;
    }

    @Override
    public List<String> changedPaths() {
        var paths = new LinkedHashSet<String>();
        for (StatusEntry entry : status()) {
            paths.add(entry.path());
        }
        return new ArrayList<>(paths);
    }

    @Override
    public ChangeSet changeSet() {
        var staged = new ArrayList<String>();
        var unstaged = new ArrayList<String>();
        for (StatusEntry entry : status()) {
            if (entry.untracked()) {
                unstaged.add(entry.path());
                continue;
            }
            if (entry.index() != ' ') {
                staged.add(entry.path());
            }
            if (entry.workTree() != ' ') {
                unstaged.add(entry.path());
            }
        }
        return new ChangeSet(staged, unstaged);
    }

    @Override
    public Optional<byte[]> read(String path) {
        Path file = resolve(path);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new SnapshotStoreException("Cannot read " + path, e);
        }
    }

    @Override
    public void write(String path, byte[] content) {
        Path file = resolve(path);
        try {
            Files.createDirectories(file.getParent());
            Files.write(file, content);
        } catch (IOException e) {
            throw new SnapshotStoreException("Cannot write " + path, e);
        }
    }

    List<StatusEntry> status() {
        GitResult result = git.require("status", "--porcelain=v1", "-z", "--untracked-files=all");
        List<String> records = GitCommandRunner.splitNul(result.stdout());
        var entries = new ArrayList<StatusEntry>();
        for (int i = 0; i < records.size(); i++) {
            String record = records.get(i);
            if (record.length() < 4) {
                continue;
            }
            char x = record.charAt(0);
            char y = record.charAt(1);
            entries.add(new StatusEntry(x, y, record.substring(3)));
            // Renames and copies are followed by their source path
            if (x == 'R' || x == 'C') {
                i++;
            }
        }
        return entries;
    }

    private Path resolve(String path) {
        Path file = root.resolve(path).normalize();
        if (!file.startsWith(root)) {
            throw new SnapshotStoreException("Path escapes the project root: " + path);
        }
        return file;
    }

    record StatusEntry(char index, char workTree, String path) {
        boolean untracked() {
            return index == '?' && workTree == '?';
        }
    }
}
