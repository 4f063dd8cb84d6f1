package com.waypoint.core.temporal;

import com.waypoint.core.model.WorkUnit;

import java.nio.file.Path;
import java.util.List;

/**
 * Locates the files that must have been written while a work unit was in a given state.
 */
public interface ArtifactResolver {

    /**
     * Specification artifacts tagged with the unit's id, written while {@code specifying}.
     */
    List<Path> specificationArtifacts(WorkUnit workUnit);

    /**
     * Test artifacts associated with the unit, written while {@code testing}.
     */
    List<Path> testArtifacts(WorkUnit workUnit);
}
