package com.waypoint.core.git;

import com.waypoint.core.snapshot.ChangeSet;
import com.waypoint.core.snapshot.SnapshotStoreException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GitWorkingTreeTest {

    @TempDir
    Path root;

    /**
     * Runner that answers every command with canned porcelain output.
     */
    static class ScriptedGitCommandRunner extends GitCommandRunner {
        final List<List<String>> invocations = new ArrayList<>();
        private final String stdout;

        ScriptedGitCommandRunner(Path root, String stdout) {
            super(root);
            this.stdout = stdout;
        }

        @Override
        public GitResult run(Map<String, String> environment, String... args) {
            invocations.add(List.of(args));
            return new GitResult(0, stdout.getBytes(StandardCharsets.UTF_8), "");
        }
    }

    private static final String PORCELAIN =
            "M  src/App.java\0 M README.md\0?? docs/new.md\0R  src/Renamed.java\0src/Old.java\0MM both.txt\0";

    @Test
    @DisplayName("changed paths include staged, unstaged, untracked and renamed files once each")
    void changedPaths() {
        var tree = new GitWorkingTree(new ScriptedGitCommandRunner(root, PORCELAIN));

        assertEquals(List.of("src/App.java", "README.md", "docs/new.md", "src/Renamed.java", "both.txt"),
                tree.changedPaths());
    }

    @Test
    @DisplayName("change-set splits staged from unstaged and treats untracked files as unstaged")
    void changeSet() {
        var tree = new GitWorkingTree(new ScriptedGitCommandRunner(root, PORCELAIN));

        ChangeSet changeSet = tree.changeSet();

        assertEquals(List.of("src/App.java", "src/Renamed.java", "both.txt"), changeSet.stagedFiles());
        assertEquals(List.of("README.md", "docs/new.md", "both.txt"), changeSet.unstagedFiles());
    }

    @Test
    @DisplayName("status is read in NUL-separated porcelain form including untracked files")
    void statusCommand() {
        var runner = new ScriptedGitCommandRunner(root, "");
        var tree = new GitWorkingTree(runner);

        assertFalse(tree.isDirty());
        assertEquals(List.of("status", "--porcelain=v1", "-z", "--untracked-files=all"), runner.invocations.get(0));
    }

    @Test
    @DisplayName("reads and writes files relative to the root")
    void readWrite() throws Exception {
        var tree = new GitWorkingTree(new ScriptedGitCommandRunner(root, ""));

        tree.write("nested/dir/file.txt", "hello".getBytes(StandardCharsets.UTF_8));

        assertEquals("hello", Files.readString(root.resolve("nested/dir/file.txt")));
        assertArrayEquals("hello".getBytes(StandardCharsets.UTF_8), tree.read("nested/dir/file.txt").orElseThrow());
        assertTrue(tree.read("absent.txt").isEmpty());
    }

    @Test
    @DisplayName("paths that leave the root are refused")
    void pathEscape() {
        var tree = new GitWorkingTree(new ScriptedGitCommandRunner(root, ""));

        assertThrows(SnapshotStoreException.class, () -> tree.write("../outside.txt", new byte[0]));
        assertThrows(SnapshotStoreException.class, () -> tree.read("../../etc/passwd"));
    }
}
