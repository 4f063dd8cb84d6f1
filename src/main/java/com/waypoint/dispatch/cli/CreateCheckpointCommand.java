package com.waypoint.dispatch.cli;

import com.waypoint.core.checkpoint.CheckpointEngine;
import com.waypoint.core.model.Checkpoint;
import com.waypoint.core.model.CheckpointKind;
import com.waypoint.core.workunit.WorkUnitRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "create", mixinStandardHelpOptions = true,
        description = "Snapshot all modified and untracked files under a name")
@Component
public class CreateCheckpointCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Work unit id")
    private String workUnitId;

    @Parameters(index = "1", description = "Checkpoint name")
    private String name;

    @Option(names = "--overwrite", description = "Replace an existing checkpoint with the same name")
    private boolean overwrite;

    private final CheckpointEngine checkpointEngine;
    private final WorkUnitRepository repository;

    public CreateCheckpointCommand(CheckpointEngine checkpointEngine, WorkUnitRepository repository) {
        this.checkpointEngine = checkpointEngine;
        this.repository = repository;
    }

    @Override
    public Integer call() {
        repository.load(workUnitId);
        Checkpoint checkpoint = checkpointEngine.create(workUnitId, name, CheckpointKind.MANUAL, overwrite);
        ConsoleOutput.success("Created checkpoint '%s' for %s".formatted(checkpoint.name(), workUnitId));
        return 0;
    }
}
