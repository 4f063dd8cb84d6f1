package com.waypoint.dispatch.cli;

import com.waypoint.core.checkpoint.CheckpointEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "delete", mixinStandardHelpOptions = true, description = "Delete one checkpoint")
@Component
public class DeleteCheckpointCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Work unit id")
    private String workUnitId;

    @Parameters(index = "1", description = "Checkpoint name")
    private String name;

    private final CheckpointEngine checkpointEngine;

    public DeleteCheckpointCommand(CheckpointEngine checkpointEngine) {
        this.checkpointEngine = checkpointEngine;
    }

    @Override
    public Integer call() {
        checkpointEngine.delete(workUnitId, name);
        ConsoleOutput.success("Deleted checkpoint '%s' for %s".formatted(name, workUnitId));
        return 0;
    }
}
