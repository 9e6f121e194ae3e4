package io.modelprep.core.model;

/**
 * One structural edit in a rule table. Rules are plain values; all behaviour lives in
 * {@code TreeFilter}, which interprets a table in declaration order.
 *
 * <p>
 * Implementations are immutable and thread-safe.
 */
public sealed interface FilterRule permits DeleteKeys, SetValue, SynthesizeFromSiblings, CleanupIfEmpty {

    /** The rule kind as written in a profile file (e.g. {@code delete}). */
    String kind();

    /** The section the rule edits. */
    RulePath path();

    /** One-line description used in logs and error messages. */
    String describe();
}
