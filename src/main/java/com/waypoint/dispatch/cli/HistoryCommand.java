package com.waypoint.dispatch.cli;

import com.waypoint.core.model.StateHistoryEntry;
import com.waypoint.core.model.WorkUnit;
import com.waypoint.core.workunit.WorkUnitRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: waypoint history &lt;id&gt;
 * <p>
 * Shows the current status and the state history of a work unit, oldest first.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "Show a work unit's state history")
@Component
public class HistoryCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Work unit id")
    private String workUnitId;

    private final WorkUnitRepository repository;

    public HistoryCommand(WorkUnitRepository repository) {
        this.repository = repository;
    }

    @Override
    public Integer call() {
        WorkUnit unit = repository.load(workUnitId);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold " + unit.id() + "|@ " + (unit.title() != null ? unit.title() : "") +
                " [" + unit.type().value() + "] status: @|fg(cyan) " + unit.status() + "|@"));
        if (unit.blockedReason() != null) {
            ConsoleOutput.warn("Blocked: " + unit.blockedReason());
        }
        System.out.println("──────────────────────────────────");
        for (StateHistoryEntry entry : unit.stateHistory()) {
            System.out.println("  " + entry.timestamp() + "  " + entry.state()
                    + (entry.reason() != null ? "  (" + entry.reason() + ")" : ""));
        }
        return 0;
    }
}
