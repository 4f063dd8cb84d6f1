package com.waypoint.dispatch.cli;

import com.waypoint.core.hooks.HookManagementService;
import com.waypoint.core.model.HookDefinition;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "copy", mixinStandardHelpOptions = true, description = "Copy virtual hooks between work units")
@Component
public class CopyHooksCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Source work unit id")
    private String from;

    @Parameters(index = "1", description = "Target work unit id")
    private String to;

    @Option(names = "--hook", description = "Copy only the hook with this name")
    private String hookName;

    private final HookManagementService hookManagementService;

    public CopyHooksCommand(HookManagementService hookManagementService) {
        this.hookManagementService = hookManagementService;
    }

    @Override
    public Integer call() {
        List<HookDefinition> copied = hookManagementService.copyVirtualHooks(from, to, hookName);
        ConsoleOutput.success("Copied %d hook(s) from %s to %s".formatted(copied.size(), from, to));
        return 0;
    }
}
