package com.waypoint.core.temporal;

import com.waypoint.core.model.StateHistoryEntry;
import com.waypoint.core.model.WorkUnit;
import com.waypoint.core.model.WorkUnitStatus;
import com.waypoint.core.model.WorkUnitType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks that artifacts were produced during the state that owns them.
 * <p>
 * Only two forward moves are checked:
 * <ul>
 *   <li>{@code specifying -> testing}: every tagged feature file must be newer than the
 *       unit's most recent entry into {@code specifying}</li>
 *   <li>{@code testing -> implementing}: every associated test file must be newer than the
 *       most recent entry into {@code testing}</li>
 * </ul>
 * Tasks are exempt. The validator reads only file metadata and history; it never writes.
 */
public class TemporalValidator {

    private static final Logger log = LoggerFactory.getLogger(TemporalValidator.class);

    public TemporalValidation validate(WorkUnit workUnit, WorkUnitStatus from, WorkUnitStatus to,
                                       ArtifactResolver resolver) {
        if (workUnit.type() == WorkUnitType.TASK) {
            return TemporalValidation.notApplicable();
        }
        if (from == WorkUnitStatus.SPECIFYING && to == WorkUnitStatus.TESTING) {
            return check(workUnit, WorkUnitStatus.SPECIFYING, resolver.specificationArtifacts(workUnit));
        }
        if (from == WorkUnitStatus.TESTING && to == WorkUnitStatus.IMPLEMENTING) {
            return check(workUnit, WorkUnitStatus.TESTING, resolver.testArtifacts(workUnit));
        }
        return TemporalValidation.notApplicable();
    }

    private TemporalValidation check(WorkUnit workUnit, WorkUnitStatus sourceState, List<Path> artifacts) {
        Optional<StateHistoryEntry> entry = workUnit.lastEntryFor(sourceState);
        if (entry.isEmpty() || entry.get().timestamp() == null) {
            log.debug("{} has no recorded entry into {}; skipping temporal check", workUnit.id(), sourceState);
            return new TemporalValidation(true, List.of());
        }
        Instant enteredAt = entry.get().timestamp();

        var violations = new ArrayList<TemporalViolation>();
        for (Path artifact : artifacts) {
            Instant modified = lastModified(artifact);
            if (!modified.isAfter(enteredAt)) {
                violations.add(new TemporalViolation(artifact, modified, sourceState, enteredAt));
            }
        }
        log.debug("Temporal check for {} against {} entry at {}: {} artifact(s), {} violation(s)",
                workUnit.id(), sourceState, enteredAt, artifacts.size(), violations.size());
        return new TemporalValidation(true, violations);
    }

    Instant lastModified(Path file) {
        try {
            return Files.getLastModifiedTime(file).toInstant();
        } catch (IOException e) {
            throw new ArtifactAccessException("Cannot read modification time of", file, e);
        }
    }
}
