package com.waypoint.dispatch.cli;

import com.waypoint.core.checkpoint.CheckpointEngine;
import com.waypoint.core.checkpoint.ConflictResolution;
import com.waypoint.core.checkpoint.RestoreResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: waypoint checkpoint restore &lt;id&gt; &lt;name&gt;
 * <p>
 * Without a resolution flag a conflicting restore writes nothing, lists the conflicts and exits 1.
 */
@Command(name = "restore", mixinStandardHelpOptions = true,
        description = "Restore the files captured by a checkpoint")
@Component
public class RestoreCheckpointCommand implements Callable<Integer> {

    static class Resolution {
        @Option(names = "--force", description = "Overwrite locally modified files")
        boolean force;

        @Option(names = "--inline-markers", description = "Write both versions of conflicting files with conflict markers")
        boolean inlineMarkers;
    }

    @Parameters(index = "0", description = "Work unit id")
    private String workUnitId;

    @Parameters(index = "1", description = "Checkpoint name")
    private String name;

    @ArgGroup(exclusive = true)
    private Resolution resolution;

    private final CheckpointEngine checkpointEngine;

    public RestoreCheckpointCommand(CheckpointEngine checkpointEngine) {
        this.checkpointEngine = checkpointEngine;
    }

    @Override
    public Integer call() {
        RestoreResult result = checkpointEngine.restore(workUnitId, name, chosenResolution()).orThrow();
        ConsoleOutput.success("Restored checkpoint '%s': %d file(s) written, %d already current"
                .formatted(name, result.writtenPaths().size(), result.unchangedPaths().size()));
        if (result.hasConflicts()) {
            ConsoleOutput.warn(result.conflicts().size() + " conflicting file(s) resolved by "
                    + result.resolution().name().toLowerCase().replace('_', ' '));
            result.conflicts().forEach(ConsoleOutput::conflict);
        }
        return 0;
    }

    private ConflictResolution chosenResolution() {
        if (resolution == null) {
            return ConflictResolution.ABORT;
        }
        if (resolution.force) {
            return ConflictResolution.OVERWRITE;
        }
        return resolution.inlineMarkers ? ConflictResolution.INLINE_MARKERS : ConflictResolution.ABORT;
    }
}
