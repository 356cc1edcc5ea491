package dev.unitrain.serialization;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A checkpoint could not be restored: the file is missing, belongs to another model
 * kind, or is not a valid checkpoint.
 */
public class CheckpointLoadException extends IOException {

    private final Path path;

    public CheckpointLoadException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public CheckpointLoadException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
