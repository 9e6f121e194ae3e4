package io.modelprep.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Sets a literal value at a key of a section, or of every named instance of a section,
 * overwriting whatever was there. The value is copied on every write, so the rule's own node is
 * never attached to a model tree.
 *
 * @param path  the section to write into
 * @param key   the key to set
 * @param value the literal value (commonly a boolean sentinel)
 * @param scope {@link Scope#SECTION} or {@link Scope#EACH_INSTANCE}
 */
public record SetValue(RulePath path, String key, JsonNode value, Scope scope) implements FilterRule {

    public SetValue {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("set rule for '" + path + "' must name a key");
        }
    }

    @Override
    public String kind() {
        return "set";
    }

    @Override
    public String describe() {
        return "set " + path + (scope == Scope.EACH_INSTANCE ? "[*]" : "") + "." + key + " = " + value;
    }
}
