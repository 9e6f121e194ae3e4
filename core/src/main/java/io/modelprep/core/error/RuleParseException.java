package io.modelprep.core.error;

/** Thrown when a filter profile YAML file has invalid syntax, fails its schema or has a malformed rule. */
public final class RuleParseException extends ProfileLoadException {

    private static final long serialVersionUID = 1L;

    public RuleParseException(String message, String profileId, String source) {
        super(message, profileId, source);
    }

    public RuleParseException(String message, Throwable cause, String profileId, String source) {
        super(message, cause, profileId, source);
    }
}
