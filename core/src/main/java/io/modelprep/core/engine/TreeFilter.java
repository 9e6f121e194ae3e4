package io.modelprep.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelprep.core.error.StructuralMismatchException;
import io.modelprep.core.model.CleanupIfEmpty;
import io.modelprep.core.model.DeleteKeys;
import io.modelprep.core.model.FilterProfile;
import io.modelprep.core.model.FilterRule;
import io.modelprep.core.model.RulePath;
import io.modelprep.core.model.Scope;
import io.modelprep.core.model.SetValue;
import io.modelprep.core.model.SynthesizeFromSiblings;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interprets a rule table against a model tree in one linear pass.
 *
 * <p>
 * Rules run strictly in declaration order and each rule sees the tree as left by the rules
 * before it. A later rule that checks whether an earlier one emptied a section only works if the
 * table lists them in that order; the filter never reorders or repeats rules.
 *
 * <p>
 * A rule whose section is absent is a no-op. A rule that meets a node of the wrong shape
 * (a scalar or sequence where it needs a mapping) raises {@link StructuralMismatchException}
 * before it changes anything; {@link MismatchMode} decides whether the pass stops there.
 *
 * <p>
 * The tree is mutated in place. Rule values are copied on every write, so one rule can feed any
 * number of instances without sharing nodes. Thread-safe: instances hold no per-call state and
 * may filter independent trees concurrently.
 */
public final class TreeFilter {

    private static final Logger LOG = LoggerFactory.getLogger(TreeFilter.class);

    private static final String MAPPING = "mapping";

    private final MismatchMode mismatchMode;

    /** Creates a filter that fails fast on the first structural mismatch. */
    public TreeFilter() {
        this(MismatchMode.FAIL_FAST);
    }

    public TreeFilter(MismatchMode mismatchMode) {
        this.mismatchMode = Objects.requireNonNull(mismatchMode, "mismatchMode must not be null");
    }

    public MismatchMode mismatchMode() {
        return mismatchMode;
    }

    /**
     * Applies a profile's rule table to the tree.
     *
     * @param tree    the model root, mutated in place
     * @param profile the profile to apply
     * @return the pass report; {@code report.tree()} is {@code tree}
     * @throws StructuralMismatchException if any rule met a node of the wrong shape
     */
    public FilterReport apply(ObjectNode tree, FilterProfile profile) {
        Objects.requireNonNull(profile, "profile must not be null");
        return run(tree, profile.rules(), profile.id());
    }

    /**
     * Applies an ad-hoc rule table to the tree.
     *
     * @param tree  the model root, mutated in place
     * @param rules the rules, in application order
     * @return the pass report; {@code report.tree()} is {@code tree}
     * @throws StructuralMismatchException if any rule met a node of the wrong shape
     */
    public FilterReport apply(ObjectNode tree, List<? extends FilterRule> rules) {
        return run(tree, rules, null);
    }

    private FilterReport run(ObjectNode tree, List<? extends FilterRule> rules, String profileId) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(rules, "rules must not be null");

        Pass pass = new Pass(tree, profileId);
        List<StructuralMismatchException> mismatches = new ArrayList<>();

        for (int i = 0; i < rules.size(); i++) {
            FilterRule rule = rules.get(i);
            pass.ruleIndex = i;
            pass.rule = rule;
            try {
                boolean applied = applyRule(pass, rule);
                if (applied) {
                    pass.rulesApplied++;
                } else {
                    pass.rulesSkipped++;
                    LOG.debug("Rule[{}] {} skipped: section absent", i, rule.describe());
                }
            } catch (StructuralMismatchException e) {
                if (mismatchMode == MismatchMode.FAIL_FAST) {
                    throw e;
                }
                LOG.warn("Rule[{}] abandoned, continuing with remaining rules: {}", i, e.getMessage());
                mismatches.add(e);
            }
        }

        if (!mismatches.isEmpty()) {
            StructuralMismatchException first = mismatches.get(0);
            for (int i = 1; i < mismatches.size(); i++) {
                first.addSuppressed(mismatches.get(i));
            }
            throw first;
        }

        FilterReport report = pass.report();
        LOG.debug("Filter pass complete: profile_id={}, {}", profileId, report.summary());
        return report;
    }

    /** Returns {@code false} if the rule was a no-op because its section is absent. */
    private boolean applyRule(Pass pass, FilterRule rule) {
        if (rule instanceof DeleteKeys delete) {
            return applyDelete(pass, delete);
        } else if (rule instanceof SetValue set) {
            return applySet(pass, set);
        } else if (rule instanceof SynthesizeFromSiblings synthesize) {
            return applySynthesize(pass, synthesize);
        } else if (rule instanceof CleanupIfEmpty cleanup) {
            return applyCleanup(pass, cleanup);
        }
        throw new IllegalStateException("Unsupported rule type: " + rule.getClass().getName());
    }

    // --- Rule kinds ---

    private boolean applyDelete(Pass pass, DeleteKeys rule) {
        Optional<ObjectNode> resolved = resolveSection(pass, pass.tree, rule.path());
        if (resolved.isEmpty()) {
            return false;
        }
        ObjectNode section = resolved.get();
        if (rule.scope() == Scope.SECTION) {
            pass.keysRemoved += removeKeys(section, rule);
            return true;
        }
        for (Map.Entry<String, JsonNode> instance : instances(pass, section, rule.path()).entrySet()) {
            // an instance declared with no attributes has nothing to delete
            if (instance.getValue().isObject()) {
                pass.keysRemoved += removeKeys((ObjectNode) instance.getValue(), rule);
            }
        }
        return true;
    }

    private int removeKeys(ObjectNode target, DeleteKeys rule) {
        int removed = 0;
        for (String key : rule.keys()) {
            if (TreeNodes.removeKey(target, key)) {
                removed++;
                LOG.debug("Removed '{}' from {}", key, rule.path());
            }
        }
        return removed;
    }

    private boolean applySet(Pass pass, SetValue rule) {
        Optional<ObjectNode> resolved = resolveSection(pass, pass.tree, rule.path());
        if (resolved.isEmpty()) {
            return false;
        }
        ObjectNode section = resolved.get();
        if (rule.scope() == Scope.SECTION) {
            section.set(rule.key(), rule.value().deepCopy());
            pass.valuesSet++;
            return true;
        }
        for (Map.Entry<String, JsonNode> instance : instances(pass, section, rule.path()).entrySet()) {
            ObjectNode target = instance.getValue().isObject()
                    ? (ObjectNode) instance.getValue()
                    : section.putObject(instance.getKey());
            target.set(rule.key(), rule.value().deepCopy());
            pass.valuesSet++;
        }
        return true;
    }

    private boolean applySynthesize(Pass pass, SynthesizeFromSiblings rule) {
        RulePath target = rule.target();
        Optional<ObjectNode> parent = resolveParent(pass, target);
        if (parent.isEmpty()) {
            return false;
        }
        Optional<JsonNode> existing = TreeNodes.child(parent.get(), target.leaf());
        if (existing.isPresent()) {
            if (!existing.get().isObject()) {
                throw mismatch(pass, target, existing.get());
            }
            LOG.debug("Rule[{}] {} left existing section untouched", pass.ruleIndex, rule.describe());
            return true;
        }

        // resolve the source before creating anything so a mismatch leaves the tree unchanged
        List<String> names = new ArrayList<>();
        resolveSection(pass, pass.tree, rule.source()).ifPresent(source -> source.fieldNames()
                .forEachRemaining(names::add));

        ObjectNode created = parent.get().putObject(target.leaf());
        pass.sectionsCreated++;
        for (String name : names) {
            ObjectNode instance = created.putObject(name);
            instance.put(rule.nameField(), name);
            for (Map.Entry<String, JsonNode> field : rule.fields().entrySet()) {
                instance.set(field.getKey(), field.getValue().deepCopy());
            }
            pass.instancesSynthesized++;
        }
        LOG.debug("Synthesized {} with {} instance(s) from {}", target, names.size(), rule.source());
        return true;
    }

    private boolean applyCleanup(Pass pass, CleanupIfEmpty rule) {
        RulePath path = rule.path();
        Optional<ObjectNode> parent = resolveParent(pass, path);
        if (parent.isEmpty()) {
            return false;
        }
        JsonNode section = parent.get().get(path.leaf());
        if (section == null) {
            return false;
        }
        if (!section.isNull() && !section.isObject()) {
            throw mismatch(pass, path, section);
        }
        if (TreeNodes.isEmptySection(section)) {
            parent.get().remove(path.leaf());
            pass.sectionsRemoved++;
            LOG.debug("Removed empty section {}", path);
        }
        return true;
    }

    // --- Path resolution ---

    private Optional<ObjectNode> resolveParent(Pass pass, RulePath path) {
        return path.isTopLevel() ? Optional.of(pass.tree) : resolveSection(pass, pass.tree, path.parent());
    }

    /**
     * Walks {@code path} from {@code root}. Absent or null sections yield empty; a non-mapping on
     * the way is a mismatch.
     */
    private Optional<ObjectNode> resolveSection(Pass pass, ObjectNode root, RulePath path) {
        ObjectNode current = root;
        List<String> segments = path.segments();
        for (int i = 0; i < segments.size(); i++) {
            Optional<JsonNode> next = TreeNodes.child(current, segments.get(i));
            if (next.isEmpty()) {
                return Optional.empty();
            }
            if (!next.get().isObject()) {
                throw mismatch(pass, path.prefix(i + 1), next.get());
            }
            current = (ObjectNode) next.get();
        }
        return Optional.of(current);
    }

    /**
     * Snapshot of a named-instance collection. Every value must be a mapping or null; the whole
     * collection is checked before the caller touches any instance.
     */
    private Map<String, JsonNode> instances(Pass pass, ObjectNode section, RulePath path) {
        Map<String, JsonNode> instances = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = section.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (!value.isObject() && !TreeNodes.isNullNode(value)) {
                throw mismatch(pass, path.child(field.getKey()), value);
            }
            instances.put(field.getKey(), value);
        }
        return instances;
    }

    private StructuralMismatchException mismatch(Pass pass, RulePath at, JsonNode actual) {
        return new StructuralMismatchException(
                pass.profileId, pass.ruleIndex, pass.rule.describe(), at.toString(), MAPPING, TreeNodes.shapeOf(actual));
    }

    /** Mutable per-call state; never shared between calls. */
    private static final class Pass {
        private final ObjectNode tree;
        private final String profileId;
        private int ruleIndex;
        private FilterRule rule;
        private int rulesApplied;
        private int rulesSkipped;
        private int keysRemoved;
        private int valuesSet;
        private int sectionsCreated;
        private int instancesSynthesized;
        private int sectionsRemoved;

        Pass(ObjectNode tree, String profileId) {
            this.tree = tree;
            this.profileId = profileId;
        }

        FilterReport report() {
            return new FilterReport(
                    tree,
                    profileId,
                    rulesApplied,
                    rulesSkipped,
                    keysRemoved,
                    valuesSet,
                    sectionsCreated,
                    instancesSynthesized,
                    sectionsRemoved);
        }
    }
}
