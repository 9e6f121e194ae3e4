package io.modelprep.prepare.tool;

import io.modelprep.core.engine.TreeFilter;
import io.modelprep.core.error.ModelPrepException;
import io.modelprep.core.spec.FilterProfileParser;
import io.modelprep.core.spec.TargetProfiles;
import io.modelprep.prepare.ExitCode;
import io.modelprep.prepare.args.ArgumentException;
import io.modelprep.prepare.args.CommandLineArgs;
import io.modelprep.prepare.args.ModelContext;
import io.modelprep.prepare.config.ConfigLoadException;
import io.modelprep.prepare.config.ToolConfig;
import io.modelprep.prepare.config.ToolConfigLoader;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code prepareModel} tool: prepares model files for a Kubernetes deployment target.
 *
 * <p>
 * Run sequence:
 * <ol>
 * <li>Parse and validate the command line into a {@link ModelContext}</li>
 * <li>Load the tool configuration ({@code -tool_config} plus environment) and apply its logging
 * settings</li>
 * <li>Resolve the target profile and prepare every model file</li>
 * </ol>
 *
 * <p>
 * Every failure is mapped to an {@link ExitCode}; nothing propagates out of {@link #execute}.
 * A summary line with the exit code is always logged.
 */
public final class PrepareModelTool {

    private static final Logger LOG = LoggerFactory.getLogger(PrepareModelTool.class);

    public static final String PROGRAM_NAME = "prepareModel";

    static final List<String> REQUIRED_SWITCHES = List.of(
            CommandLineArgs.ORACLE_HOME_SWITCH,
            CommandLineArgs.MODEL_FILE_SWITCH,
            CommandLineArgs.OUTPUT_DIR_SWITCH,
            CommandLineArgs.TARGET_SWITCH);

    static final List<String> OPTIONAL_SWITCHES = List.of(
            CommandLineArgs.VARIABLE_FILE_SWITCH,
            CommandLineArgs.ARCHIVE_FILE_SWITCH,
            CommandLineArgs.TOOL_CONFIG_SWITCH);

    private final Function<String, String> envLookup;
    private final PrintStream out;
    private final Consumer<ToolConfig> loggingSetup;

    /**
     * @param envLookup    environment variable lookup, {@code null} for undefined variables
     * @param out          stream usage text is printed to
     * @param loggingSetup applies the logging section of the loaded configuration
     */
    public PrepareModelTool(Function<String, String> envLookup, PrintStream out, Consumer<ToolConfig> loggingSetup) {
        this.envLookup = Objects.requireNonNull(envLookup, "envLookup must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.loggingSetup = Objects.requireNonNull(loggingSetup, "loggingSetup must not be null");
    }

    /** Runs the tool against the process environment, reconfiguring Logback from the tool config. */
    public static ExitCode run(String[] args) {
        return new PrepareModelTool(System::getenv, System.out, LogbackConfigurator::configure).execute(args);
    }

    /**
     * Runs the tool once.
     *
     * @param args the command-line arguments
     * @return the exit code of the run
     */
    public ExitCode execute(String[] args) {
        ExitCode exitCode;
        try {
            PrepareSummary summary = prepare(args);
            exitCode = summary.hasSkipped() ? ExitCode.WARNING : ExitCode.OK;
            LOG.info(
                    "{} prepared {} model file(s) with profile {} ({} skipped, {} rules applied)",
                    PROGRAM_NAME,
                    summary.written().size(),
                    summary.profileKey(),
                    summary.skipped().size(),
                    summary.rulesApplied());
        } catch (ArgumentException e) {
            exitCode = e.exitCode();
            if (exitCode == ExitCode.HELP) {
                out.print(e.getMessage());
            } else {
                LOG.error("Invalid arguments: {}", e.getMessage());
            }
        } catch (PrepareException | ModelPrepException | ConfigLoadException e) {
            exitCode = ExitCode.ERROR;
            LOG.error("{} failed: {}", PROGRAM_NAME, e.getMessage(), e);
        } catch (RuntimeException e) {
            exitCode = ExitCode.ERROR;
            LOG.error("{} failed: {}: {}", PROGRAM_NAME, e.getClass().getName(), e.getMessage(), e);
        }

        LOG.info("{} completed with exit code {} ({})", PROGRAM_NAME, exitCode.code(), exitCode);
        return exitCode;
    }

    private PrepareSummary prepare(String[] args) {
        CommandLineArgs parser =
                new CommandLineArgs(PROGRAM_NAME, REQUIRED_SWITCHES, OPTIONAL_SWITCHES).withMultipleModels();
        Map<String, String> arguments = parser.process(args);
        ModelContext context = ModelContext.fromArguments(PROGRAM_NAME, arguments);

        ToolConfig config = ToolConfigLoader.load(context.toolConfig(), envLookup);
        loggingSetup.accept(config);
        LOG.debug("Tool configuration: {}", config);

        TargetProfiles profiles =
                new TargetProfiles(new FilterProfileParser(), config.targetsDir().orElse(null));
        TreeFilter filter = new TreeFilter(config.mismatchMode());
        return new ModelPreparer(context, profiles, filter).prepareModels();
    }
}
