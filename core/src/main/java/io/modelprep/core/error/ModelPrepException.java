package io.modelprep.core.error;

/**
 * Root of the failures raised by the core. Profile problems surface while a target is resolved
 * ({@link Phase#LOAD}); shape problems surface while a model is filtered ({@link Phase#FILTER}).
 * Callers that only map failures to an exit code can catch this type alone.
 */
public abstract class ModelPrepException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Where in a run the failure happened. */
    public enum Phase {
        LOAD,
        FILTER
    }

    private final String profileId;
    private final Phase phase;

    protected ModelPrepException(String message, String profileId, Phase phase) {
        super(message);
        this.profileId = profileId;
        this.phase = phase;
    }

    protected ModelPrepException(String message, Throwable cause, String profileId, Phase phase) {
        super(message, cause);
        this.profileId = profileId;
        this.phase = phase;
    }

    /** Id of the profile involved; {@code null} when the failure precedes parsing its header. */
    public String profileId() {
        return profileId;
    }

    /** The message without the exception class name, for log lines and CLI output. */
    public String detail() {
        return getMessage();
    }

    public Phase phase() {
        return phase;
    }
}
