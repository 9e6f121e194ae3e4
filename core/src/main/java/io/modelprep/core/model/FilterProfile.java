package io.modelprep.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Parsed filter profile: a named, versioned rule table for one deployment target.
 *
 * <p>
 * Immutable, thread-safe. Created at load time by {@code FilterProfileParser}.
 *
 * @param id          profile identifier, usually the target name (e.g. "vz")
 * @param version     profile version
 * @param description human-readable description, may be null
 * @param rules       ordered rule table (declaration order is application order)
 */
public record FilterProfile(String id, String version, String description, List<FilterRule> rules) {

    /** Canonical constructor: validates required fields. */
    public FilterProfile {
        Objects.requireNonNull(id, "profile id must not be null");
        Objects.requireNonNull(version, "profile version must not be null");
        rules = rules != null ? List.copyOf(rules) : List.of();
    }

    /** Returns the {@code id@version} key used in log lines. */
    public String key() {
        return id + "@" + version;
    }
}
