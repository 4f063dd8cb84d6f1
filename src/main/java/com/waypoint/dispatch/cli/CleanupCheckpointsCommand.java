package com.waypoint.dispatch.cli;

import com.waypoint.core.checkpoint.CheckpointEngine;
import com.waypoint.core.checkpoint.CleanupResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "cleanup", mixinStandardHelpOptions = true,
        description = "Delete all but the newest N checkpoints of a work unit")
@Component
public class CleanupCheckpointsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Work unit id")
    private String workUnitId;

    @Option(names = "--keep-last", required = true, description = "Number of newest checkpoints to keep")
    private int keepLast;

    private final CheckpointEngine checkpointEngine;

    public CleanupCheckpointsCommand(CheckpointEngine checkpointEngine) {
        this.checkpointEngine = checkpointEngine;
    }

    @Override
    public Integer call() {
        CleanupResult result = checkpointEngine.cleanup(workUnitId, keepLast);
        ConsoleOutput.success("Deleted %d checkpoint(s), kept %d"
                .formatted(result.deletedCount(), result.preservedCount()));
        result.preserved().forEach(ConsoleOutput::checkpoint);
        return 0;
    }
}
