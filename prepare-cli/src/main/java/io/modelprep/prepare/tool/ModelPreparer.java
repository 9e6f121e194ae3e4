package io.modelprep.prepare.tool;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelprep.core.engine.FilterReport;
import io.modelprep.core.engine.TreeFilter;
import io.modelprep.core.model.FilterProfile;
import io.modelprep.core.spec.TargetProfiles;
import io.modelprep.prepare.args.ModelContext;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prepares the model files of one run for a deployment target.
 *
 * <p>
 * For every model file, in command-line order: read it, apply the target's filter profile and
 * write the result to the output directory under the same file name and format. Empty model files
 * are skipped with a warning. The variable file, if given, is copied alongside the models.
 *
 * <p>
 * The profile is resolved and the file names and extensions are checked before anything is
 * written, so an unknown target or two models with the same name fail the run without touching
 * the output directory.
 */
public final class ModelPreparer {

    private static final Logger LOG = LoggerFactory.getLogger(ModelPreparer.class);

    private final ModelContext context;
    private final TargetProfiles targetProfiles;
    private final TreeFilter filter;

    public ModelPreparer(ModelContext context, TargetProfiles targetProfiles, TreeFilter filter) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.targetProfiles = Objects.requireNonNull(targetProfiles, "targetProfiles must not be null");
        this.filter = Objects.requireNonNull(filter, "filter must not be null");
    }

    /**
     * Prepares all model files.
     *
     * @return what was written and skipped
     * @throws PrepareException if a model cannot be read or written, or two models share a name
     * @throws io.modelprep.core.error.ModelPrepException if the profile cannot be resolved or a
     *         model does not have the shape the profile expects
     */
    public PrepareSummary prepareModels() {
        FilterProfile profile = targetProfiles.resolve(context.target());
        checkModelFiles(context.modelFiles());
        if (context.allowUnresolvedArchiveReferences()) {
            LOG.debug("No archive file given; archive references in the models are left unresolved");
        } else {
            LOG.debug("Archive file {} is left unchanged", context.archiveFile().orElseThrow());
        }

        List<Path> written = new ArrayList<>();
        List<Path> skipped = new ArrayList<>();
        int rulesApplied = 0;
        for (Path modelFile : context.modelFiles()) {
            ModelFiles.Format format = ModelFiles.formatOf(modelFile);
            Optional<ObjectNode> model = ModelFiles.read(modelFile);
            if (model.isEmpty()) {
                LOG.warn("Model file {} is empty; nothing written for it", modelFile);
                skipped.add(modelFile);
                continue;
            }

            FilterReport report = filter.apply(model.get(), profile);
            Path output = context.outputDir().resolve(modelFile.getFileName());
            ModelFiles.write(report.tree(), output, format);
            rulesApplied += report.rulesApplied();
            written.add(output);
            LOG.info("Prepared {} for target '{}' -> {} ({})", modelFile, context.target(), output, report.summary());
        }

        Optional<Path> variableCopy = context.variableFile().map(this::copyVariableFile);
        return new PrepareSummary(profile.key(), written, skipped, rulesApplied, variableCopy);
    }

    private static void checkModelFiles(List<Path> modelFiles) {
        Map<Path, Path> byName = new HashMap<>();
        for (Path modelFile : modelFiles) {
            ModelFiles.formatOf(modelFile);
            Path previous = byName.putIfAbsent(modelFile.getFileName(), modelFile);
            if (previous != null) {
                throw new PrepareException(
                        "Model files " + previous + " and " + modelFile
                                + " have the same file name and would overwrite each other in the output directory",
                        modelFile);
            }
        }
    }

    private Path copyVariableFile(Path variableFile) {
        Path target = context.outputDir().resolve(variableFile.getFileName());
        try {
            if (Files.exists(target) && Files.isSameFile(variableFile, target)) {
                LOG.debug("Variable file {} is already in the output directory", variableFile);
                return target;
            }
            Files.copy(variableFile, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new PrepareException(
                    "Failed to copy variable file " + variableFile + " to " + target + ": " + e.getMessage(),
                    variableFile,
                    e);
        }
        LOG.info("Copied variable file {} to {}", variableFile, target);
        return target;
    }
}
