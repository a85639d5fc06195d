package com.telemetrysentinel.core.scoring;

import java.nio.file.Path;

/**
 * Thrown when a scorer artifact cannot be loaded or saved. Fatal at startup.
 *
 * @since 1.0.0
 */
public class ScorerLoadException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final transient Path path;

    public ScorerLoadException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public ScorerLoadException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
