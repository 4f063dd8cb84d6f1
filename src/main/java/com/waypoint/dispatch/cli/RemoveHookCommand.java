package com.waypoint.dispatch.cli;

import com.waypoint.core.hooks.HookManagementService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "remove", mixinStandardHelpOptions = true, description = "Remove a virtual hook from a work unit")
@Component
public class RemoveHookCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Work unit id")
    private String workUnitId;

    @Parameters(index = "1", description = "Hook name")
    private String name;

    private final HookManagementService hookManagementService;

    public RemoveHookCommand(HookManagementService hookManagementService) {
        this.hookManagementService = hookManagementService;
    }

    @Override
    public Integer call() {
        hookManagementService.removeVirtualHook(workUnitId, name);
        ConsoleOutput.success("Removed hook '%s' from %s".formatted(name, workUnitId));
        return 0;
    }
}
