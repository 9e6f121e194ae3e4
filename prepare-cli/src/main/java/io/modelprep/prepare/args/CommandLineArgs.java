package io.modelprep.prepare.args;

import io.modelprep.core.spec.TargetProfiles;
import io.modelprep.prepare.ExitCode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Table-driven command-line parser for the model tools.
 *
 * <p>
 * Each tool declares which switches it requires and which it accepts optionally. Every switch
 * takes exactly one value ({@code -switch value}), except {@link #HELP_SWITCH}. Parsing only
 * checks the shape of the command line; {@link ModelContext#fromArguments} validates the values.
 *
 * <p>
 * Immutable, thread-safe.
 */
public final class CommandLineArgs {

    public static final String ORACLE_HOME_SWITCH = "-oracle_home";
    public static final String MODEL_FILE_SWITCH = "-model_file";
    public static final String OUTPUT_DIR_SWITCH = "-output_dir";
    public static final String TARGET_SWITCH = "-target";
    public static final String VARIABLE_FILE_SWITCH = "-variable_file";
    public static final String ARCHIVE_FILE_SWITCH = "-archive_file";
    public static final String TOOL_CONFIG_SWITCH = "-tool_config";
    public static final String HELP_SWITCH = "-help";

    /** Separator between model files when several are allowed. */
    public static final String MODEL_FILE_SEPARATOR = ",";

    private static final Map<String, String> SWITCH_HELP = new LinkedHashMap<>();

    static {
        SWITCH_HELP.put(ORACLE_HOME_SWITCH, "<dir>     the existing installation directory");
        SWITCH_HELP.put(MODEL_FILE_SWITCH, "<file>     model file(s) to prepare, comma-separated");
        SWITCH_HELP.put(OUTPUT_DIR_SWITCH, "<dir>      directory the prepared models are written to");
        SWITCH_HELP.put(
                TARGET_SWITCH,
                "<name>         target profile; built-in: " + String.join(", ", TargetProfiles.builtInTargets()));
        SWITCH_HELP.put(VARIABLE_FILE_SWITCH, "<file>  variable properties file, copied with the models");
        SWITCH_HELP.put(ARCHIVE_FILE_SWITCH, "<file>   archive referenced by the models");
        SWITCH_HELP.put(TOOL_CONFIG_SWITCH, "<file>    YAML tool configuration (logging, filter, targets)");
    }

    private final String programName;
    private final List<String> requiredSwitches;
    private final List<String> optionalSwitches;
    private final boolean allowMultipleModels;

    public CommandLineArgs(String programName, List<String> requiredSwitches, List<String> optionalSwitches) {
        this(programName, requiredSwitches, optionalSwitches, false);
    }

    private CommandLineArgs(
            String programName,
            List<String> requiredSwitches,
            List<String> optionalSwitches,
            boolean allowMultipleModels) {
        this.programName = Objects.requireNonNull(programName, "programName must not be null");
        this.requiredSwitches = List.copyOf(requiredSwitches);
        this.optionalSwitches = List.copyOf(optionalSwitches);
        this.allowMultipleModels = allowMultipleModels;
    }

    /** Returns a parser that accepts a comma-separated list for {@link #MODEL_FILE_SWITCH}. */
    public CommandLineArgs withMultipleModels() {
        return new CommandLineArgs(programName, requiredSwitches, optionalSwitches, true);
    }

    public String programName() {
        return programName;
    }

    /**
     * Parses the arguments into a switch → value map (insertion order follows the command line).
     *
     * @param args the raw command-line arguments
     * @return the parsed switches
     * @throws ArgumentException with {@link ExitCode#HELP} if help was requested, or
     *                           {@link ExitCode#USAGE_ERROR} for an unknown or repeated switch,
     *                           a missing value (including a switch where the value belongs) or a
     *                           missing required switch
     */
    public Map<String, String> process(String[] args) {
        Map<String, String> parsed = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (HELP_SWITCH.equals(arg)) {
                throw new ArgumentException(ExitCode.HELP, usage());
            }
            if (!isKnown(arg)) {
                throw new ArgumentException(
                        ExitCode.USAGE_ERROR, programName + ": unrecognized argument '" + arg + "'");
            }
            if (i + 1 >= args.length || args[i + 1].isBlank() || isSwitchName(args[i + 1].trim())) {
                throw new ArgumentException(ExitCode.USAGE_ERROR, programName + ": " + arg + " requires a value");
            }
            if (parsed.containsKey(arg)) {
                throw new ArgumentException(
                        ExitCode.USAGE_ERROR, programName + ": " + arg + " was specified more than once");
            }
            parsed.put(arg, args[++i].trim());
        }

        List<String> missing = new ArrayList<>();
        for (String required : requiredSwitches) {
            if (!parsed.containsKey(required)) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            throw new ArgumentException(
                    ExitCode.USAGE_ERROR,
                    programName + ": missing required argument(s) " + String.join(", ", missing));
        }

        String models = parsed.get(MODEL_FILE_SWITCH);
        if (models != null && !allowMultipleModels && models.contains(MODEL_FILE_SEPARATOR)) {
            throw new ArgumentException(
                    ExitCode.USAGE_ERROR, programName + ": " + MODEL_FILE_SWITCH + " accepts a single model file");
        }
        return parsed;
    }

    /** Usage text listing required and optional switches. */
    public String usage() {
        StringBuilder sb = new StringBuilder("Usage: ").append(programName);
        for (String required : requiredSwitches) {
            sb.append(' ').append(required).append(' ').append(placeholder(required));
        }
        for (String optional : optionalSwitches) {
            sb.append(" [").append(optional).append(' ').append(placeholder(optional)).append(']');
        }
        sb.append(System.lineSeparator());
        for (String name : allSwitches()) {
            sb.append("    ")
                    .append(name)
                    .append(' ')
                    .append(SWITCH_HELP.getOrDefault(name, ""))
                    .append(System.lineSeparator());
        }
        return sb.toString();
    }

    // a switch in value position means the value itself was left out
    private static boolean isSwitchName(String value) {
        return HELP_SWITCH.equals(value) || SWITCH_HELP.containsKey(value);
    }

    private boolean isKnown(String arg) {
        return requiredSwitches.contains(arg) || optionalSwitches.contains(arg);
    }

    private List<String> allSwitches() {
        List<String> all = new ArrayList<>(requiredSwitches);
        all.addAll(optionalSwitches);
        return all;
    }

    private static String placeholder(String name) {
        String help = SWITCH_HELP.getOrDefault(name, "<value>");
        return help.substring(0, help.indexOf('>') + 1);
    }
}
