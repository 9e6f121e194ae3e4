package io.modelprep.core.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Outcome of one {@link TreeFilter} pass.
 *
 * @param tree                 the filtered root; the same instance that was passed in
 * @param profileId            the profile that was applied, or null for an anonymous rule table
 * @param rulesApplied         rules whose section resolved and which ran
 * @param rulesSkipped         rules that were no-ops because their section is absent
 * @param keysRemoved          keys removed by delete rules, summed over instances
 * @param valuesSet            keys written by set rules, summed over instances
 * @param sectionsCreated      sections created by synthesize rules
 * @param instancesSynthesized instances created by synthesize rules
 * @param sectionsRemoved      sections removed by cleanup rules
 */
public record FilterReport(
        ObjectNode tree,
        String profileId,
        int rulesApplied,
        int rulesSkipped,
        int keysRemoved,
        int valuesSet,
        int sectionsCreated,
        int instancesSynthesized,
        int sectionsRemoved) {

    /** Returns {@code true} if the pass modified the tree in any way. */
    public boolean changed() {
        return keysRemoved + valuesSet + sectionsCreated + instancesSynthesized + sectionsRemoved > 0;
    }

    /** Compact key=value summary for log lines. */
    public String summary() {
        return String.format(
                "rules_applied=%d, rules_skipped=%d, keys_removed=%d, values_set=%d, sections_created=%d,"
                        + " instances_synthesized=%d, sections_removed=%d",
                rulesApplied,
                rulesSkipped,
                keysRemoved,
                valuesSet,
                sectionsCreated,
                instancesSynthesized,
                sectionsRemoved);
    }
}
