package com.waypoint.core.git;

import com.waypoint.core.snapshot.SnapshotStore;
import com.waypoint.core.snapshot.SnapshotStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Snapshot store built on git objects.
 * <p>
 * A snapshot is a dangling commit whose tree is HEAD plus the captured paths and whose
 * parent is HEAD (the baseline). The commit is staged through a throw-away index, so the
 * user's own index and branch are never touched, and is pinned under a private ref
 * namespace to survive garbage collection until it is dropped.
 * <p>
 * Every commit message carries a random id, so two snapshots of identical content taken
 * within the same second still get distinct commits and distinct refs.
 */
public class GitSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(GitSnapshotStore.class);

    static final String SNAPSHOT_MESSAGE = "waypoint snapshot";

    private final GitCommandRunner git;
    private final String refNamespace;

    public GitSnapshotStore(GitCommandRunner git, String refNamespace) {
        this.git = git;
        this.refNamespace = refNamespace.endsWith("/")
                ? refNamespace.substring(0, refNamespace.length() - 1)
                : refNamespace;
    }

    @Override
    public String createSnapshot(Collection<String> paths) {
        Path indexDir = createIndexDir();
        Map<String, String> env = Map.of("GIT_INDEX_FILE", indexDir.resolve("index").toAbsolutePath().toString());
        try {
            Optional<String> head = resolveHead();
            if (head.isPresent()) {
                git.require(env, "read-tree", head.get());
            } else {
                git.require(env, "read-tree", "--empty");
            }

            if (!paths.isEmpty()) {
                var addArgs = new ArrayList<String>(List.of("add", "-A", "--"));
                addArgs.addAll(paths);
                git.require(env, addArgs.toArray(String[]::new));
            }

            String tree = git.require(env, "write-tree").stdoutText().trim();

            var commitArgs = new ArrayList<String>(List.of(
                    "-c", "user.name=Waypoint", "-c", "user.email=waypoint@localhost",
                    "commit-tree", tree));
            head.ifPresent(h -> {
                commitArgs.add("-p");
                commitArgs.add(h);
            });
            commitArgs.add("-m");
            commitArgs.add(SNAPSHOT_MESSAGE + " " + UUID.randomUUID());
            String commit = git.require(env, commitArgs.toArray(String[]::new)).stdoutText().trim();

            git.require("update-ref", refFor(commit), commit);
            log.info("Created snapshot {} of {} path(s)", abbreviate(commit), paths.size());
            return commit;
        } finally {
            deleteQuietly(indexDir);
        }
    }

    @Override
    public Optional<byte[]> readHistoricalFile(String ref, String path) {
        return readBlob(ref + ":" + path);
    }

    @Override
    public Optional<byte[]> readBaselineFile(String ref, String path) {
        if (!hasBaseline(ref)) {
            return Optional.empty();
        }
        return readBlob(ref + "^1:" + path);
    }

    @Override
    public List<String> listFiles(String ref) {
        requireSnapshot(ref);
        GitResult result = hasBaseline(ref)
                ? git.require("diff-tree", "-r", "--name-only", "-z", "--diff-filter=d", ref + "^1", ref)
                : git.require("ls-tree", "-r", "--name-only", "-z", ref);
        return GitCommandRunner.splitNul(result.stdout());
    }

    @Override
    public void dropSnapshot(String ref) {
        git.require("update-ref", "-d", refFor(ref));
        log.info("Dropped snapshot {}", abbreviate(ref));
    }

    String refFor(String commit) {
        return refNamespace + "/" + commit;
    }

    private Optional<String> resolveHead() {
        GitResult result = git.run("rev-parse", "--verify", "-q", "HEAD");
        return result.ok() ? Optional.of(result.stdoutText().trim()) : Optional.empty();
    }

    private boolean hasBaseline(String ref) {
        return git.run("rev-parse", "--verify", "-q", ref + "^1").ok();
    }

    private void requireSnapshot(String ref) {
        if (!git.run("cat-file", "-e", ref + "^{commit}").ok()) {
            throw new SnapshotStoreException("Snapshot " + ref + " does not exist");
        }
    }

    private Optional<byte[]> readBlob(String spec) {
        GitResult result = git.run("cat-file", "blob", spec);
        return result.ok() ? Optional.of(result.stdout()) : Optional.empty();
    }

    private static Path createIndexDir() {
        try {
            return Files.createTempDirectory("waypoint-index");
        } catch (IOException e) {
            throw new SnapshotStoreException("Cannot create temporary index directory", e);
        }
    }

    private static void deleteQuietly(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            log.warn("Could not remove temporary index {}: {}", dir, e.getMessage());
        }
    }

    private static String abbreviate(String commit) {
        return commit.length() > 10 ? commit.substring(0, 10) : commit;
    }
}
