package io.modelprep.core.model;

/**
 * Where a key-level rule operates once its path has been resolved.
 *
 * <ul>
 *   <li>{@link #SECTION}: on the resolved mapping itself.
 *   <li>{@link #EACH_INSTANCE}: on every value of the resolved mapping, which is treated as a
 *       named-instance collection (one mapping per named cluster, server, ...).
 * </ul>
 */
public enum Scope {
    SECTION,
    EACH_INSTANCE
}
