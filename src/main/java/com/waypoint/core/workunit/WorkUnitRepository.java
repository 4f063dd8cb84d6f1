package com.waypoint.core.workunit;

import com.waypoint.core.model.WorkUnit;

import java.util.List;
import java.util.Optional;

/**
 * Persistent store of work units. Reads and writes are synchronous and unlocked;
 * two processes saving the same document race and the last write wins.
 */
public interface WorkUnitRepository {

    Optional<WorkUnit> findById(String id);

    List<WorkUnit> findAll();

    void save(WorkUnit workUnit);

    /**
     * Loads a work unit that must exist.
     *
     * @throws InvalidTargetException if no unit has this id
     */
    default WorkUnit load(String id) {
        return findById(id).orElseThrow(() ->
                new InvalidTargetException("Work unit '%s' does not exist".formatted(id)));
    }
}
