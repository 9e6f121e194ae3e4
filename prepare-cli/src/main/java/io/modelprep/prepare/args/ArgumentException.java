package io.modelprep.prepare.args;

import io.modelprep.prepare.ExitCode;
import java.util.Objects;

/**
 * Thrown when the command line cannot be turned into a {@link ModelContext}. Carries the exit
 * code the tool terminates with, so each argument problem keeps its documented status.
 */
public class ArgumentException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ExitCode exitCode;

    public ArgumentException(ExitCode exitCode, String message) {
        super(message);
        this.exitCode = Objects.requireNonNull(exitCode, "exitCode must not be null");
    }

    public ArgumentException(ExitCode exitCode, String message, Throwable cause) {
        super(message, cause);
        this.exitCode = Objects.requireNonNull(exitCode, "exitCode must not be null");
    }

    public ExitCode exitCode() {
        return exitCode;
    }
}
