package com.waypoint.dispatch.cli;

import com.waypoint.core.hooks.HookManagementService;
import com.waypoint.core.model.HookDefinition;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "add", mixinStandardHelpOptions = true, description = "Attach a virtual hook to a work unit")
@Component
public class AddHookCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Work unit id")
    private String workUnitId;

    @Parameters(index = "1", description = "Event, e.g. pre-validating or post-implementing")
    private String event;

    @Parameters(index = "2", description = "Hook name")
    private String name;

    @Parameters(index = "3", description = "Shell command to run")
    private String command;

    @Option(names = "--blocking", description = "Fail the transition when this hook fails")
    private boolean blocking;

    @Option(names = "--git-context", description = "Pass staged and unstaged files to the hook on stdin")
    private boolean gitContext;

    @Option(names = "--timeout", description = "Timeout in seconds")
    private Integer timeoutSeconds;

    @Mixin
    private HookConditionOptions condition = new HookConditionOptions();

    private final HookManagementService hookManagementService;

    public AddHookCommand(HookManagementService hookManagementService) {
        this.hookManagementService = hookManagementService;
    }

    @Override
    public Integer call() {
        HookDefinition hook = hookManagementService.addVirtualHook(workUnitId, event, name, command,
                blocking, gitContext, timeoutSeconds, condition.toCondition());
        ConsoleOutput.success("Added %s hook '%s' to %s for %s".formatted(
                hook.blocking() ? "blocking" : "non-blocking", hook.name(), workUnitId, hook.event()));
        return 0;
    }
}
