package com.waypoint.core.git;

import com.waypoint.core.snapshot.SnapshotStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Shells out to the {@code git} CLI via {@link ProcessBuilder} in a fixed repository directory.
 * <p>
 * {@link #run(Map, String...)} is the single point where processes are started, so tests can
 * subclass this runner to record commands and script results without a real repository.
 */
public class GitCommandRunner {

    private static final Logger log = LoggerFactory.getLogger(GitCommandRunner.class);

    private final Path repositoryRoot;

    public GitCommandRunner(Path repositoryRoot) {
        this.repositoryRoot = repositoryRoot;
    }

    public Path getRepositoryRoot() {
        return repositoryRoot;
    }

    public GitResult run(String... args) {
        return run(Map.of(), args);
    }

    /**
     * Runs {@code git <args>} with extra environment variables and captures stdout as raw bytes.
     * A non-zero exit is returned, not thrown; use {@link #require} when failure is an error.
     */
    public GitResult run(Map<String, String> environment, String... args) {
        var command = buildCommand(args);
        log.debug("Running: {}", String.join(" ", command));

        try {
            var builder = new ProcessBuilder(command)
                    .directory(repositoryRoot.toFile())
                    .redirectErrorStream(false);
            builder.environment().putAll(environment);
            var process = builder.start();
            process.getOutputStream().close();

            // Drain stderr alongside stdout so neither pipe can fill up and stall git
            CompletableFuture<byte[]> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));
            byte[] stdout = readFully(process.getInputStream());
            int exitCode = process.waitFor();
            String errorText = new String(stderr.get(), StandardCharsets.UTF_8);

            if (exitCode != 0) {
                log.debug("git exited with code {}: {}", exitCode, errorText.strip());
            }
            return new GitResult(exitCode, stdout, errorText);
        } catch (IOException e) {
            throw new SnapshotStoreException("Git command failed: " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SnapshotStoreException("Interrupted running: " + String.join(" ", command), e);
        } catch (ExecutionException e) {
            throw new SnapshotStoreException("Failed reading git output: " + String.join(" ", command), e.getCause());
        }
    }

    public GitResult require(String... args) {
        return require(Map.of(), args);
    }

    /**
     * Like {@link #run(Map, String...)} but throws {@link SnapshotStoreException} on a non-zero exit.
     */
    public GitResult require(Map<String, String> environment, String... args) {
        GitResult result = run(environment, args);
        if (!result.ok()) {
            throw new SnapshotStoreException("git %s failed (exit code %d): %s".formatted(
                    args.length > 0 ? args[0] : "", result.exitCode(), result.stderr().strip()));
        }
        return result;
    }

    /**
     * Splits NUL-terminated output produced by {@code -z} flags.
     */
    static List<String> splitNul(byte[] output) {
        var entries = new ArrayList<String>();
        for (String part : new String(output, StandardCharsets.UTF_8).split("\0")) {
            if (!part.isEmpty()) {
                entries.add(part);
            }
        }
        return entries;
    }

    private List<String> buildCommand(String... args) {
        var command = new ArrayList<String>();
        command.add("git");
        command.addAll(Arrays.asList(args));
        return command;
    }

    private static byte[] readFully(InputStream in) {
        try (in) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new SnapshotStoreException("Failed reading git process stream", e);
        }
    }
}
