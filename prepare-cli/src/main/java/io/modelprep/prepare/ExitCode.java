package io.modelprep.prepare;

/**
 * Process exit codes of the {@code prepareModel} tool.
 *
 * <ul>
 * <li>{@link #OK}: all models prepared</li>
 * <li>{@link #WARNING}: models prepared, but at least one input was skipped</li>
 * <li>{@link #ERROR}: preparation failed</li>
 * <li>{@link #ARG_VALIDATION_ERROR}: an argument names a file or directory that is unusable</li>
 * <li>{@link #USAGE_ERROR}: unknown switch, missing value or missing required switch</li>
 * <li>{@link #HELP}: usage was requested and printed</li>
 * </ul>
 */
public enum ExitCode {
    OK(0),
    WARNING(1),
    ERROR(2),
    ARG_VALIDATION_ERROR(98),
    USAGE_ERROR(99),
    HELP(100);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    /** The numeric process exit status. */
    public int code() {
        return code;
    }
}
