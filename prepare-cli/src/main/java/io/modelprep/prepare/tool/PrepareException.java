package io.modelprep.prepare.tool;

import java.nio.file.Path;

/**
 * Thrown when a model file cannot be read, has an unusable shape or cannot be written.
 */
public class PrepareException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Path file;

    public PrepareException(String message, Path file) {
        super(message);
        this.file = file;
    }

    public PrepareException(String message, Path file, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    /** The file being processed when the failure occurred, or null. */
    public Path file() {
        return file;
    }
}
