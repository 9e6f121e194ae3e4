package io.modelprep.prepare.args;

import io.modelprep.prepare.ExitCode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated inputs of one tool run.
 *
 * @param programName                      the tool name, used in log and error messages
 * @param oracleHome                       the installation directory
 * @param modelFiles                       the model files to prepare, in command-line order
 * @param outputDir                        the directory prepared models are written to
 * @param target                           the target profile name
 * @param variableFile                     optional variable file, copied next to the prepared models
 * @param archiveFile                      optional archive referenced by the models
 * @param toolConfig                       optional YAML tool configuration
 * @param allowUnresolvedArchiveReferences true when no archive was given, so archive paths in the
 *                                         models cannot be resolved and are not checked
 */
public record ModelContext(
        String programName,
        Path oracleHome,
        List<Path> modelFiles,
        Path outputDir,
        String target,
        Optional<Path> variableFile,
        Optional<Path> archiveFile,
        Optional<Path> toolConfig,
        boolean allowUnresolvedArchiveReferences) {

    public ModelContext {
        Objects.requireNonNull(programName, "programName must not be null");
        Objects.requireNonNull(oracleHome, "oracleHome must not be null");
        Objects.requireNonNull(outputDir, "outputDir must not be null");
        Objects.requireNonNull(target, "target must not be null");
        modelFiles = List.copyOf(modelFiles);
        if (modelFiles.isEmpty()) {
            throw new IllegalArgumentException("at least one model file is required");
        }
        variableFile = variableFile != null ? variableFile : Optional.empty();
        archiveFile = archiveFile != null ? archiveFile : Optional.empty();
        toolConfig = toolConfig != null ? toolConfig : Optional.empty();
    }

    /**
     * Builds a context from parsed switches, checking every path argument. The output directory
     * is created if it does not exist yet.
     *
     * @param programName the tool name
     * @param arguments   the switches returned by {@link CommandLineArgs#process}
     * @return the validated context
     * @throws ArgumentException with {@link ExitCode#ARG_VALIDATION_ERROR} if a path is unusable,
     *                           or {@link ExitCode#USAGE_ERROR} if a required switch is absent
     */
    public static ModelContext fromArguments(String programName, Map<String, String> arguments) {
        Path oracleHome = existingDirectory(programName, arguments, CommandLineArgs.ORACLE_HOME_SWITCH);

        List<Path> modelFiles = new ArrayList<>();
        for (String name : required(programName, arguments, CommandLineArgs.MODEL_FILE_SWITCH)
                .split(CommandLineArgs.MODEL_FILE_SEPARATOR)) {
            if (name.isBlank()) {
                throw new ArgumentException(
                        ExitCode.USAGE_ERROR,
                        programName + ": " + CommandLineArgs.MODEL_FILE_SWITCH + " contains an empty entry");
            }
            modelFiles.add(existingFile(programName, CommandLineArgs.MODEL_FILE_SWITCH, name.trim()));
        }

        Path outputDir =
                outputDirectory(programName, required(programName, arguments, CommandLineArgs.OUTPUT_DIR_SWITCH));
        String target = required(programName, arguments, CommandLineArgs.TARGET_SWITCH);

        Optional<Path> variableFile = optionalFile(programName, arguments, CommandLineArgs.VARIABLE_FILE_SWITCH);
        Optional<Path> archiveFile = optionalFile(programName, arguments, CommandLineArgs.ARCHIVE_FILE_SWITCH);
        Optional<Path> toolConfig = optionalFile(programName, arguments, CommandLineArgs.TOOL_CONFIG_SWITCH);

        return new ModelContext(
                programName,
                oracleHome,
                modelFiles,
                outputDir,
                target,
                variableFile,
                archiveFile,
                toolConfig,
                archiveFile.isEmpty());
    }

    private static String required(String programName, Map<String, String> arguments, String name) {
        String value = arguments.get(name);
        if (value == null || value.isBlank()) {
            throw new ArgumentException(ExitCode.USAGE_ERROR, programName + ": missing required argument " + name);
        }
        return value.trim();
    }

    private static Path existingDirectory(String programName, Map<String, String> arguments, String name) {
        Path dir = Path.of(required(programName, arguments, name));
        if (!Files.isDirectory(dir)) {
            throw new ArgumentException(
                    ExitCode.ARG_VALIDATION_ERROR, programName + ": " + name + " directory does not exist: " + dir);
        }
        return dir;
    }

    private static Path existingFile(String programName, String name, String value) {
        Path file = Path.of(value);
        if (!Files.isRegularFile(file)) {
            throw new ArgumentException(
                    ExitCode.ARG_VALIDATION_ERROR, programName + ": " + name + " file does not exist: " + file);
        }
        if (!Files.isReadable(file)) {
            throw new ArgumentException(
                    ExitCode.ARG_VALIDATION_ERROR, programName + ": " + name + " file is not readable: " + file);
        }
        return file;
    }

    private static Optional<Path> optionalFile(String programName, Map<String, String> arguments, String name) {
        String value = arguments.get(name);
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(existingFile(programName, name, value.trim()));
    }

    private static Path outputDirectory(String programName, String value) {
        Path dir = Path.of(value);
        if (Files.exists(dir) && !Files.isDirectory(dir)) {
            throw new ArgumentException(
                    ExitCode.ARG_VALIDATION_ERROR,
                    programName + ": " + CommandLineArgs.OUTPUT_DIR_SWITCH + " is not a directory: " + dir);
        }
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ArgumentException(
                    ExitCode.ARG_VALIDATION_ERROR,
                    programName + ": unable to create " + CommandLineArgs.OUTPUT_DIR_SWITCH + " " + dir,
                    e);
        }
    }
}
