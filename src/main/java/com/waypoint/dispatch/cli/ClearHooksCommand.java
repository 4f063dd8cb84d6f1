package com.waypoint.dispatch.cli;

import com.waypoint.core.hooks.HookManagementService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "clear", mixinStandardHelpOptions = true, description = "Remove all virtual hooks from a work unit")
@Component
public class ClearHooksCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Work unit id")
    private String workUnitId;

    private final HookManagementService hookManagementService;

    public ClearHooksCommand(HookManagementService hookManagementService) {
        this.hookManagementService = hookManagementService;
    }

    @Override
    public Integer call() {
        int removed = hookManagementService.clearVirtualHooks(workUnitId);
        ConsoleOutput.success("Cleared %d hook(s) from %s".formatted(removed, workUnitId));
        return 0;
    }
}
