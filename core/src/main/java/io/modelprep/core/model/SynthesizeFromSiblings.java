package io.modelprep.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a named-instance collection at {@code target} from the instance names found at
 * {@code source}, e.g. one server template per cluster. Each synthesized instance holds
 * {@code nameField: <instance name>} followed by a copy of {@code fields}.
 *
 * <p>
 * Only fires when the target section is absent; an existing target, even a partial one, is left
 * alone. The target's parent must exist.
 *
 * @param source    the section whose instance names drive the synthesis
 * @param target    the section to create
 * @param nameField key under which each instance records its source name
 * @param fields    literal fields added to every synthesized instance, in declaration order
 */
public record SynthesizeFromSiblings(RulePath source, RulePath target, String nameField, Map<String, JsonNode> fields)
        implements FilterRule {

    public SynthesizeFromSiblings {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(nameField, "nameField must not be null");
        if (source.equals(target)) {
            throw new IllegalArgumentException("synthesize source and target must differ: " + source);
        }
        if (nameField.isBlank()) {
            throw new IllegalArgumentException("synthesize rule for '" + target + "' must name a name-field");
        }
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
        if (fields.containsKey(nameField)) {
            throw new IllegalArgumentException(
                    "synthesize rule for '" + target + "' repeats name-field '" + nameField + "' in fields");
        }
    }

    @Override
    public String kind() {
        return "synthesize";
    }

    /** The section this rule creates. */
    @Override
    public RulePath path() {
        return target;
    }

    @Override
    public String describe() {
        return "synthesize " + target + " from " + source + " (" + nameField + " + " + fields.keySet() + ")";
    }
}
