package io.modelprep.prepare.tool;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of {@link ModelPreparer#prepareModels()}.
 *
 * @param profileKey   {@code id@version} of the applied profile
 * @param written      prepared model files in the output directory
 * @param skipped      input model files that were empty and produced no output
 * @param rulesApplied rules applied, summed over all models
 * @param variableFile the copied variable file, if one was given
 */
public record PrepareSummary(
        String profileKey, List<Path> written, List<Path> skipped, int rulesApplied, Optional<Path> variableFile) {

    public PrepareSummary {
        written = List.copyOf(written);
        skipped = List.copyOf(skipped);
        variableFile = variableFile != null ? variableFile : Optional.empty();
    }

    /** {@code true} if at least one input model was skipped. */
    public boolean hasSkipped() {
        return !skipped.isEmpty();
    }
}
