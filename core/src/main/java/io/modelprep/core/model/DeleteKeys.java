package io.modelprep.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Removes a set of keys from a section, or from every named instance of a section.
 * Keys that are not present are skipped.
 *
 * @param path  the section holding the keys
 * @param keys  keys to remove, in declaration order
 * @param scope {@link Scope#SECTION} or {@link Scope#EACH_INSTANCE}
 */
public record DeleteKeys(RulePath path, Set<String> keys, Scope scope) implements FilterRule {

    public DeleteKeys {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(keys, "keys must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("delete rule for '" + path + "' must name at least one key");
        }
        keys = Collections.unmodifiableSet(new LinkedHashSet<>(keys));
    }

    @Override
    public String kind() {
        return "delete";
    }

    @Override
    public String describe() {
        return "delete " + path + (scope == Scope.EACH_INSTANCE ? "[*]" : "") + " " + keys;
    }
}
