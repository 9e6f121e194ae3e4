package io.modelprep.core.engine;

import java.util.Locale;

/**
 * What {@link TreeFilter} does after a rule hits a structural mismatch.
 *
 * <ul>
 *   <li>{@link #FAIL_FAST}: stop the pass and throw the mismatch immediately.
 *   <li>{@link #CONTINUE}: abandon only the failing rule, run the remaining rules, then throw the
 *       first mismatch with any later ones attached as suppressed exceptions.
 * </ul>
 *
 * <p>
 * In both modes a mismatch always reaches the caller.
 */
public enum MismatchMode {
    FAIL_FAST("fail-fast"),
    CONTINUE("continue");

    private final String configValue;

    MismatchMode(String configValue) {
        this.configValue = configValue;
    }

    /** The value used for this mode in configuration files and environment variables. */
    public String configValue() {
        return configValue;
    }

    /**
     * Parses a configuration value ({@code fail-fast} or {@code continue}, case-insensitive; the
     * enum constant names are accepted too).
     *
     * @throws IllegalArgumentException for any other value
     */
    public static MismatchMode fromConfig(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (MismatchMode mode : values()) {
            if (mode.configValue.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException(
                "Invalid mismatch mode '" + value + "': must be 'fail-fast' or 'continue'");
    }
}
