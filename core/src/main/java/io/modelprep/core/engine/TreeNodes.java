package io.modelprep.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Locale;
import java.util.Optional;

/**
 * Total lookup and removal helpers over Jackson model trees. None of these methods throws on a
 * missing key; presence is reported through the return value instead.
 *
 * <p>
 * A JSON {@code null} (what YAML produces for {@code Section:} with nothing under it) counts as
 * absent for lookups and as empty for {@link #isEmptySection(JsonNode)}.
 *
 * <p>
 * Thread-safe, stateless utility class.
 */
public final class TreeNodes {

    private TreeNodes() {}

    /**
     * Looks up a direct child.
     *
     * @return the child, or empty if the key is absent or holds {@code null}
     */
    public static Optional<JsonNode> child(ObjectNode parent, String key) {
        JsonNode node = parent.get(key);
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(node);
    }

    /**
     * Removes a key if present.
     *
     * @return {@code true} if the key existed and was removed
     */
    public static boolean removeKey(ObjectNode node, String key) {
        return node.remove(key) != null;
    }

    /** Returns {@code true} for {@code null} and for a mapping with no keys. */
    public static boolean isEmptySection(JsonNode node) {
        if (node == null || node.isNull()) {
            return true;
        }
        return node.isObject() && node.isEmpty();
    }

    /** Returns {@code true} if the node is {@code null} (an instance declared with no attributes). */
    public static boolean isNullNode(JsonNode node) {
        return node == null || node.isNull();
    }

    /**
     * Describes the shape of a node for error messages: {@code mapping}, {@code sequence}, or
     * {@code scalar(<type>)}.
     */
    public static String shapeOf(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "nothing";
        }
        if (node.isObject()) {
            return "mapping";
        }
        if (node.isArray()) {
            return "sequence";
        }
        return "scalar(" + node.getNodeType().name().toLowerCase(Locale.ROOT) + ")";
    }
}
