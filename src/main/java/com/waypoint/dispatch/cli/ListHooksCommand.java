package com.waypoint.dispatch.cli;

import com.waypoint.core.hooks.HookManagementService;
import com.waypoint.core.model.HookDefinition;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "list", mixinStandardHelpOptions = true,
        description = "List a work unit's virtual hooks, or the global hooks when no id is given")
@Component
public class ListHooksCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Work unit id")
    private String workUnitId;

    private final HookManagementService hookManagementService;

    public ListHooksCommand(HookManagementService hookManagementService) {
        this.hookManagementService = hookManagementService;
    }

    @Override
    public Integer call() {
        Map<String, List<HookDefinition>> hooks = workUnitId == null
                ? hookManagementService.listGlobalHooks()
                : hookManagementService.listVirtualHooks(workUnitId);
        String owner = workUnitId == null ? "global" : workUnitId;
        if (hooks.isEmpty()) {
            ConsoleOutput.info("No hooks for " + owner);
            return 0;
        }
        ConsoleOutput.info("Hooks for " + owner);
        hooks.forEach((event, definitions) -> {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + event + "|@"));
            for (HookDefinition hook : definitions) {
                System.out.println("  " + hook.name() + (hook.blocking() ? " [blocking]" : "")
                        + (hook.gitContext() ? " [git-context]" : "") + ": " + hook.command());
            }
        });
        return 0;
    }
}
