package io.modelprep.core.error;

/**
 * Thrown when a filter rule reaches a node whose shape does not match what the rule needs, for
 * example a scalar where a mapping section is expected. The only hard failure of a filter pass;
 * missing sections and keys are never errors.
 *
 * <p>
 * Carries the index of the failing rule within its table, the rule's description, the dotted
 * path of the offending node and the expected and actual node shapes.
 */
public final class StructuralMismatchException extends ModelPrepException {

    private static final long serialVersionUID = 1L;

    private final int ruleIndex;
    private final String rule;
    private final String path;
    private final String expected;
    private final String actual;

    public StructuralMismatchException(
            String profileId, int ruleIndex, String rule, String path, String expected, String actual) {
        super(
                String.format(
                        "Rule[%d] %s: expected %s at '%s' but found %s", ruleIndex, rule, expected, path, actual),
                profileId,
                Phase.FILTER);
        this.ruleIndex = ruleIndex;
        this.rule = rule;
        this.path = path;
        this.expected = expected;
        this.actual = actual;
    }

    /** Zero-based position of the failing rule in its rule table. */
    public int ruleIndex() {
        return ruleIndex;
    }

    /** Description of the failing rule. */
    public String rule() {
        return rule;
    }

    /** Dotted path of the node with the unexpected shape. */
    public String path() {
        return path;
    }

    public String expected() {
        return expected;
    }

    public String actual() {
        return actual;
    }
}
