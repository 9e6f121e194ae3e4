package io.modelprep.core.error;

/**
 * Abstract parent for load-time profile errors. Thrown while a filter profile is parsed or a
 * target name is resolved to a profile. Carries an additional {@code source} field identifying
 * the file or classpath resource that caused the error.
 */
public abstract class ProfileLoadException extends ModelPrepException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected ProfileLoadException(String message, String profileId, String source) {
        super(message, profileId, Phase.LOAD);
        this.source = source;
    }

    protected ProfileLoadException(String message, Throwable cause, String profileId, String source) {
        super(message, cause, profileId, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
