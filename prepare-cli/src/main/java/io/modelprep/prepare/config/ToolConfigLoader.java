package io.modelprep.prepare.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.modelprep.core.engine.MismatchMode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link ToolConfig} from an optional YAML file with an environment variable overlay.
 *
 * <p>
 * Recognised YAML keys:
 *
 * <pre>
 * logging:
 *   format: text | json
 *   level: INFO
 * filter:
 *   mismatch-mode: fail-fast | continue
 * targets:
 *   dir: /path/to/targets
 * </pre>
 *
 * <p>
 * Environment variables take precedence over YAML values. A variable counts as set only when it
 * is defined and non-blank after trimming.
 *
 * <table>
 * <caption>Environment overrides</caption>
 * <tr><td>{@code MODELPREP_LOG_FORMAT}</td><td>{@code logging.format}</td></tr>
 * <tr><td>{@code MODELPREP_LOG_LEVEL}</td><td>{@code logging.level}</td></tr>
 * <tr><td>{@code MODELPREP_MISMATCH_MODE}</td><td>{@code filter.mismatch-mode}</td></tr>
 * <tr><td>{@code MODELPREP_TARGETS_DIR}</td><td>{@code targets.dir}</td></tr>
 * </table>
 */
public final class ToolConfigLoader {

    static final String ENV_LOG_FORMAT = "MODELPREP_LOG_FORMAT";
    static final String ENV_LOG_LEVEL = "MODELPREP_LOG_LEVEL";
    static final String ENV_MISMATCH_MODE = "MODELPREP_MISMATCH_MODE";
    static final String ENV_TARGETS_DIR = "MODELPREP_TARGETS_DIR";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ToolConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration, applying overrides from {@link System#getenv}.
     *
     * @param configPath the YAML file, or empty for defaults plus environment
     * @return the configuration
     * @throws ConfigLoadException if the file is missing, unparsable or holds invalid values
     */
    public static ToolConfig load(Optional<Path> configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration, applying overrides from the supplied lookup. The lookup returns
     * {@code null} for an undefined variable.
     */
    public static ToolConfig load(Optional<Path> configPath, Function<String, String> envLookup) {
        ToolConfig.Builder builder = ToolConfig.builder();
        if (configPath.isPresent()) {
            applyYaml(builder, readYaml(configPath.get()), configPath.get());
        }
        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static JsonNode readYaml(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigLoadException("Tool configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode() || root.isNull()) {
                return YAML_MAPPER.createObjectNode();
            }
            if (!root.isObject()) {
                throw new ConfigLoadException("Tool configuration must be a YAML mapping: " + configPath);
            }
            return root;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    private static void applyYaml(ToolConfig.Builder builder, JsonNode root, Path source) {
        JsonNode logging = root.path("logging");
        if (logging.hasNonNull("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.hasNonNull("level")) builder.loggingLevel(logging.get("level").asText());

        JsonNode filter = root.path("filter");
        if (filter.hasNonNull("mismatch-mode")) {
            String origin = "filter.mismatch-mode in " + source;
            builder.mismatchMode(mismatchMode(filter.get("mismatch-mode").asText(), origin));
        }

        JsonNode targets = root.path("targets");
        if (targets.hasNonNull("dir")) {
            Path dir = Path.of(targets.get("dir").asText());
            // relative to the config file, so a config can ship next to its profiles
            Path base = source.toAbsolutePath().getParent();
            builder.targetsDir(dir.isAbsolute() || base == null ? dir : base.resolve(dir));
        }
    }

    private static void applyEnvOverrides(ToolConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, ENV_LOG_FORMAT, builder::loggingFormat);
        envString(envLookup, ENV_LOG_LEVEL, builder::loggingLevel);
        envString(
                envLookup, ENV_MISMATCH_MODE, value -> builder.mismatchMode(mismatchMode(value, ENV_MISMATCH_MODE)));
        envString(envLookup, ENV_TARGETS_DIR, value -> builder.targetsDir(Path.of(value)));
    }

    private static MismatchMode mismatchMode(String value, String origin) {
        try {
            return MismatchMode.fromConfig(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid " + origin + ": " + e.getMessage(), e);
        }
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }
}
