package io.modelprep.core.error;

/** Thrown when a target name is malformed or has no filter profile, built-in or external. */
public final class ProfileResolveException extends ProfileLoadException {

    private static final long serialVersionUID = 1L;

    public ProfileResolveException(String message, String profileId, String source) {
        super(message, profileId, source);
    }

    public ProfileResolveException(String message, Throwable cause, String profileId, String source) {
        super(message, cause, profileId, source);
    }
}
