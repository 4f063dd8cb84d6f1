package com.waypoint.core.hooks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs hook commands through a shell ({@code sh -c <command>}) with {@link ProcessBuilder}.
 * Standard input is written and output streams are drained on background threads, so the
 * timeout runs from the moment the process starts; on timeout the process tree is killed.
 */
public class ProcessHookExecutor implements HookExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessHookExecutor.class);

    private static final long STREAM_GRACE_SECONDS = 5;

    private static final ExecutorService STREAM_IO = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "hook-io");
        thread.setDaemon(true);
        return thread;
    });

    private final String shell;

    public ProcessHookExecutor(String shell) {
        this.shell = shell;
    }

    public ProcessHookExecutor() {
        this("sh");
    }

    @Override
    public ProcessResult execute(HookCommand command) {
        var argv = List.of(shell, "-c", command.commandLine());
        Process process;
        try {
            process = new ProcessBuilder(argv)
                    .directory(command.workingDirectory().toFile())
                    .start();
        } catch (IOException e) {
            log.warn("Could not start hook command '{}': {}", command.commandLine(), e.getMessage());
            return new ProcessResult("", "Failed to start: " + e.getMessage(), 127, false);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), STREAM_IO);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), STREAM_IO);
        CompletableFuture.runAsync(() -> writeStdin(process, command.stdin()), STREAM_IO);

        try {
            boolean finished = process.waitFor(command.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                process.waitFor(STREAM_GRACE_SECONDS, TimeUnit.SECONDS);
                log.warn("Hook command timed out after {}s: {}", command.timeout().toSeconds(), command.commandLine());
                return new ProcessResult(collect(stdout), collect(stderr), null, true);
            }
            return new ProcessResult(collect(stdout), collect(stderr), process.exitValue(), false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return new ProcessResult(collect(stdout), "Interrupted", null, false);
        }
    }

    private static void writeStdin(Process process, String stdin) {
        try (OutputStream in = process.getOutputStream()) {
            if (stdin != null) {
                in.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            // The hook exited or was killed without reading its input
            log.debug("Hook closed stdin early: {}", e.getMessage());
        }
    }

    private static String drain(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Hook output stream closed: {}", e.getMessage());
            return "";
        }
    }

    private static String collect(CompletableFuture<String> output) {
        try {
            return output.get(STREAM_GRACE_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Could not collect hook output: {}", e.toString());
            return "";
        }
    }
}
