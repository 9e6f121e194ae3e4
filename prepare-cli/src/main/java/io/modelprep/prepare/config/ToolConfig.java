package io.modelprep.prepare.config;

import io.modelprep.core.engine.MismatchMode;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Runtime configuration of the model tools. Every field has a default, so a run without
 * {@code -tool_config} and without environment overrides uses {@link #defaults()}.
 *
 * @param loggingFormat {@code text} or {@code json}
 * @param loggingLevel  root log level (TRACE, DEBUG, INFO, WARN, ERROR)
 * @param mismatchMode  how the filter reacts to a structural mismatch
 * @param targetsDir    external directory of target profiles, searched before the built-in ones
 */
public record ToolConfig(
        String loggingFormat, String loggingLevel, MismatchMode mismatchMode, Optional<Path> targetsDir) {

    public static final String FORMAT_TEXT = "text";
    public static final String FORMAT_JSON = "json";

    /** Creates a new builder with the default values. */
    public static Builder builder() {
        return new Builder();
    }

    /** Configuration used when nothing is overridden. */
    public static ToolConfig defaults() {
        return builder().build();
    }

    /** Builder for {@link ToolConfig}. */
    public static final class Builder {
        private String loggingFormat = FORMAT_TEXT;
        private String loggingLevel = "INFO";
        private MismatchMode mismatchMode = MismatchMode.FAIL_FAST;
        private Path targetsDir;

        Builder() {}

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder mismatchMode(MismatchMode mismatchMode) {
            this.mismatchMode = mismatchMode;
            return this;
        }

        public Builder targetsDir(Path targetsDir) {
            this.targetsDir = targetsDir;
            return this;
        }

        /**
         * Builds the {@link ToolConfig}.
         *
         * @throws ConfigLoadException if the logging format is neither {@code text} nor {@code json}
         */
        public ToolConfig build() {
            String format = loggingFormat == null ? FORMAT_TEXT : loggingFormat.trim().toLowerCase(Locale.ROOT);
            if (!FORMAT_TEXT.equals(format) && !FORMAT_JSON.equals(format)) {
                throw new ConfigLoadException(
                        "Invalid logging.format '" + loggingFormat + "': expected 'text' or 'json'");
            }
            return new ToolConfig(
                    format,
                    loggingLevel == null ? "INFO" : loggingLevel.trim().toUpperCase(Locale.ROOT),
                    mismatchMode == null ? MismatchMode.FAIL_FAST : mismatchMode,
                    Optional.ofNullable(targetsDir));
        }
    }
}
