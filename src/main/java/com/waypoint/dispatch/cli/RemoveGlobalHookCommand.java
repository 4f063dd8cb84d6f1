package com.waypoint.dispatch.cli;

import com.waypoint.core.hooks.HookManagementService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "remove-global", mixinStandardHelpOptions = true, description = "Remove a project-wide hook")
@Component
public class RemoveGlobalHookCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Event")
    private String event;

    @Parameters(index = "1", description = "Hook name")
    private String name;

    private final HookManagementService hookManagementService;

    public RemoveGlobalHookCommand(HookManagementService hookManagementService) {
        this.hookManagementService = hookManagementService;
    }

    @Override
    public Integer call() {
        hookManagementService.removeGlobalHook(event, name);
        ConsoleOutput.success("Removed global hook '%s' from %s".formatted(name, event));
        return 0;
    }
}
