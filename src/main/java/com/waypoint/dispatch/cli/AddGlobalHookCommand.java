package com.waypoint.dispatch.cli;

import com.waypoint.core.hooks.HookManagementService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "add-global", mixinStandardHelpOptions = true, description = "Add a project-wide hook")
@Component
public class AddGlobalHookCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Event, e.g. post-implementing")
    private String event;

    @Parameters(index = "1", description = "Hook name")
    private String name;

    @Parameters(index = "2", description = "Shell command, relative paths resolve against the project root")
    private String command;

    @Option(names = "--blocking", description = "Fail the transition when this hook fails")
    private boolean blocking;

    @Option(names = "--timeout", description = "Timeout in seconds")
    private Integer timeoutSeconds;

    @Mixin
    private HookConditionOptions condition = new HookConditionOptions();

    private final HookManagementService hookManagementService;

    public AddGlobalHookCommand(HookManagementService hookManagementService) {
        this.hookManagementService = hookManagementService;
    }

    @Override
    public Integer call() {
        hookManagementService.addGlobalHook(event, name, command, blocking, timeoutSeconds, condition.toCondition());
        ConsoleOutput.success("Added global hook '%s' for %s".formatted(name, event));
        return 0;
    }
}
