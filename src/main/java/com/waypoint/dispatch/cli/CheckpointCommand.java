package com.waypoint.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command group: waypoint checkpoint create|list|restore|cleanup|delete
 */
@Command(name = "checkpoint", mixinStandardHelpOptions = true,
        description = "Create, list, restore and clean up working-tree checkpoints",
        subcommands = {
                CreateCheckpointCommand.class,
                ListCheckpointsCommand.class,
                RestoreCheckpointCommand.class,
                CleanupCheckpointsCommand.class,
                DeleteCheckpointCommand.class
        })
@Component
public class CheckpointCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
