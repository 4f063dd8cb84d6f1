package com.waypoint.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command group: waypoint hook ...
 * <p>
 * Virtual hooks belong to one work unit; global hooks live in the project hook configuration.
 */
@Command(name = "hook", mixinStandardHelpOptions = true,
        description = "Manage virtual (per work unit) and global lifecycle hooks",
        subcommands = {
                AddHookCommand.class,
                RemoveHookCommand.class,
                ListHooksCommand.class,
                ClearHooksCommand.class,
                CopyHooksCommand.class,
                AddGlobalHookCommand.class,
                RemoveGlobalHookCommand.class
        })
@Component
public class HooksCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
