package io.modelprep.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Location of a section in a model tree, as the ordered list of literal keys leading to it from
 * the root mapping (e.g. {@code topology.Cluster} → {@code [topology, Cluster]}).
 *
 * <p>
 * Immutable, thread-safe.
 *
 * @param segments the keys from the root, never empty, no blank key
 */
public record RulePath(List<String> segments) {

    /** Canonical constructor: validates and copies the segments. */
    public RulePath {
        Objects.requireNonNull(segments, "segments must not be null");
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("path must have at least one segment");
        }
        for (String segment : segments) {
            if (segment == null || segment.isBlank()) {
                throw new IllegalArgumentException("path segments must not be blank: " + segments);
            }
        }
        segments = List.copyOf(segments);
    }

    /**
     * Parses a dotted path such as {@code topology.SecurityConfiguration}.
     *
     * @throws IllegalArgumentException if the path is blank or has an empty segment
     */
    public static RulePath parse(String dotted) {
        Objects.requireNonNull(dotted, "path must not be null");
        if (dotted.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        return new RulePath(Arrays.asList(dotted.split("\\.", -1)));
    }

    public static RulePath of(String... segments) {
        return new RulePath(Arrays.asList(segments));
    }

    /** The last key of the path (the section's own name in its parent). */
    public String leaf() {
        return segments.get(segments.size() - 1);
    }

    /** Returns {@code true} if this path addresses a direct child of the root. */
    public boolean isTopLevel() {
        return segments.size() == 1;
    }

    /**
     * The path of the parent section.
     *
     * @throws IllegalStateException for a top-level path, whose parent is the root itself
     */
    public RulePath parent() {
        if (isTopLevel()) {
            throw new IllegalStateException("top-level path '" + this + "' has no parent section");
        }
        return new RulePath(segments.subList(0, segments.size() - 1));
    }

    /** The first {@code length} keys of this path. */
    public RulePath prefix(int length) {
        return new RulePath(segments.subList(0, length));
    }

    /** Appends a key, e.g. the name of an instance within a collection. */
    public RulePath child(String key) {
        String[] extended = segments.toArray(new String[segments.size() + 1]);
        extended[segments.size()] = key;
        return new RulePath(Arrays.asList(extended));
    }

    @Override
    public String toString() {
        return String.join(".", segments);
    }
}
