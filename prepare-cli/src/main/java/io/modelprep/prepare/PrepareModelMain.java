package io.modelprep.prepare;

import io.modelprep.prepare.tool.PrepareModelTool;

/**
 * Entry point of the {@code prepareModel} tool.
 *
 * <p>
 * Delegates to {@link PrepareModelTool#run(String[])} and exits with its {@link ExitCode}.
 */
public final class PrepareModelMain {

    private PrepareModelMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args e.g. {@code -oracle_home /u01/oracle -model_file model.yaml -output_dir out -target vz}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        System.exit(PrepareModelTool.run(args).code());
    }
}
