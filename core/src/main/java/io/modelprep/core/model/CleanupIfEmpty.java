package io.modelprep.core.model;

import java.util.Objects;

/**
 * Removes a section from its parent when it has become empty, so that an emptied optional
 * section looks the same as an absent one. Works one level only: the parent is never removed
 * even if this leaves it empty.
 *
 * @param path the section to check
 */
public record CleanupIfEmpty(RulePath path) implements FilterRule {

    public CleanupIfEmpty {
        Objects.requireNonNull(path, "path must not be null");
    }

    @Override
    public String kind() {
        return "cleanup-if-empty";
    }

    @Override
    public String describe() {
        return "cleanup-if-empty " + path;
    }
}
