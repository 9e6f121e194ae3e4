package io.modelprep.prepare.tool;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads and writes model files. The format follows the file extension: {@code .yaml} and
 * {@code .yml} are YAML, {@code .json} is JSON. Key order is preserved in both directions.
 */
public final class ModelFiles {

    /** Prefix of the temporary files written next to the final output. */
    static final String TEMP_PREFIX = ".modelprep-";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(YAMLFactory.builder()
                    .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                    .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                    // keeps '12345' a string on the next read
                    .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                    .build())
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
            .enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
            .enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY);

    /** Supported model file formats. */
    public enum Format {
        YAML,
        JSON
    }

    private ModelFiles() {
        // utility class
    }

    /**
     * Determines the format of a model file from its extension.
     *
     * @throws PrepareException if the extension is not supported
     */
    public static Format formatOf(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return Format.YAML;
        }
        if (name.endsWith(".json")) {
            return Format.JSON;
        }
        throw new PrepareException(
                "Unsupported model file type: " + file + " (expected .yaml, .yml or .json)", file);
    }

    /**
     * Reads a model file.
     *
     * @return the model root, or empty if the file holds no document
     * @throws PrepareException if the file cannot be parsed, holds more than one document, or its
     *                          root is not a mapping
     */
    public static Optional<ObjectNode> read(Path file) {
        ObjectMapper mapper = mapperFor(formatOf(file));
        JsonNode root = null;
        try (InputStream in = Files.newInputStream(file);
                MappingIterator<JsonNode> documents = mapper.readerFor(JsonNode.class).readValues(in)) {
            if (documents.hasNextValue()) {
                root = documents.nextValue();
            }
            if (documents.hasNextValue()) {
                throw new PrepareException(
                        "Model file " + file + " contains more than one document; split it into one file per model",
                        file);
            }
        } catch (IOException e) {
            throw new PrepareException("Failed to read model file " + file + ": " + e.getMessage(), file, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return Optional.empty();
        }
        if (!root.isObject()) {
            throw new PrepareException(
                    "Model file " + file + " must contain a mapping at its root, found " + root.getNodeType(), file);
        }
        return Optional.of((ObjectNode) root);
    }

    /**
     * Writes a model to {@code target} in the given format. The content goes to a temporary file in
     * the same directory first and is moved into place, so a failed write never leaves a partial
     * model behind.
     *
     * @throws PrepareException if writing or moving fails
     */
    public static void write(ObjectNode model, Path target, Format format) {
        Path dir = target.toAbsolutePath().getParent();
        Path temp = null;
        try {
            temp = Files.createTempFile(dir, TEMP_PREFIX, ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                mapperFor(format).writeValue(out, model);
            }
            move(temp, target);
        } catch (IOException e) {
            PrepareException failure =
                    new PrepareException("Failed to write model file " + target + ": " + e.getMessage(), target, e);
            deleteQuietly(temp, failure);
            throw failure;
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp, PrepareException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private static ObjectMapper mapperFor(Format format) {
        return format == Format.JSON ? JSON_MAPPER : YAML_MAPPER;
    }
}
