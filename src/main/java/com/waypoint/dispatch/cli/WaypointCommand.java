package com.waypoint.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Waypoint.
 */
@Command(
        name = "waypoint",
        mixinStandardHelpOptions = true,
        version = "Waypoint 0.1.0",
        description = "Guarded work-unit lifecycle with temporal checks, checkpoints and hooks",
        subcommands = {
                TransitionCommand.class,
                CheckpointCommand.class,
                HooksCommand.class,
                HistoryCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class WaypointCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
