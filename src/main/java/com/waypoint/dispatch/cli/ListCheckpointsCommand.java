package com.waypoint.dispatch.cli;

import com.waypoint.core.checkpoint.CheckpointEngine;
import com.waypoint.core.model.Checkpoint;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "list", mixinStandardHelpOptions = true,
        description = "List checkpoints of a work unit, newest first")
@Component
public class ListCheckpointsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Work unit id")
    private String workUnitId;

    private final CheckpointEngine checkpointEngine;

    public ListCheckpointsCommand(CheckpointEngine checkpointEngine) {
        this.checkpointEngine = checkpointEngine;
    }

    @Override
    public Integer call() {
        List<Checkpoint> checkpoints = checkpointEngine.list(workUnitId);
        if (checkpoints.isEmpty()) {
            ConsoleOutput.info("No checkpoints for " + workUnitId);
            return 0;
        }
        ConsoleOutput.info("Checkpoints for " + workUnitId + " (" + checkpoints.size() + ")");
        checkpoints.forEach(ConsoleOutput::checkpoint);
        return 0;
    }
}
