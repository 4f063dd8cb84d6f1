package com.waypoint.dispatch.cli;

import com.waypoint.core.WaypointException;
import com.waypoint.core.checkpoint.CheckpointConflictException;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    /** Exit code for aborted transitions, unresolved restore conflicts and other typed failures. */
    public static final int EXIT_FAILURE = 1;

    private final WaypointCommand waypointCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(WaypointCommand waypointCommand, IFactory factory) {
        this.waypointCommand = waypointCommand;
        this.factory = factory;
    }

    /**
     * Builds the command line with Waypoint's exception handling: typed failures print their
     * message and exit with {@link #EXIT_FAILURE} instead of a stack trace.
     */
    public static CommandLine createCommandLine(WaypointCommand command, IFactory factory) {
        return new CommandLine(command, factory)
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    if (ex instanceof CheckpointConflictException conflict) {
                        ConsoleOutput.error(conflict.getMessage());
                        conflict.getConflicts().forEach(ConsoleOutput::conflict);
                        return EXIT_FAILURE;
                    }
                    if (ex instanceof WaypointException || ex instanceof IllegalArgumentException) {
                        ConsoleOutput.error(ex.getMessage());
                        return EXIT_FAILURE;
                    }
                    throw ex;
                });
    }

    @Override
    public void run(String... args) {
        exitCode = createCommandLine(waypointCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
