package com.waypoint.core.temporal;

import com.waypoint.core.WaypointException;

import java.nio.file.Path;

/**
 * An artifact file or directory could not be read while locating or timing artifacts.
 */
public class ArtifactAccessException extends WaypointException {

    private final Path path;

    public ArtifactAccessException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
