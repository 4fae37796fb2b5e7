package io.surfworks.graphmatch.constraint;

import java.util.Map;

import io.surfworks.graphmatch.pattern.PatternInputArg;
import io.surfworks.graphmatch.pattern.PatternNode;

/**
 * The constraint chosen for every entity of one pattern.
 *
 * <p>Built by {@link ConstraintResolver}; every declared node and input has an
 * entry, so lookups never fall back at match time.
 *
 * @param nodeConstraints constraint per pattern node name
 * @param argConstraints constraint per pattern input name
 */
public record ResolvedConstraints(
        Map<String, NodeConstraint> nodeConstraints,
        Map<String, ArgConstraint> argConstraints
) {

    public ResolvedConstraints {
        nodeConstraints = Map.copyOf(nodeConstraints);
        argConstraints = Map.copyOf(argConstraints);
    }

    public NodeConstraint forNode(PatternNode node) {
        NodeConstraint constraint = nodeConstraints.get(node.name());
        if (constraint == null) {
            throw new IllegalStateException("No constraint resolved for pattern node '" + node.name() + "'");
        }
        return constraint;
    }

    public ArgConstraint forArg(PatternInputArg arg) {
        ArgConstraint constraint = argConstraints.get(arg.name());
        if (constraint == null) {
            throw new IllegalStateException("No constraint resolved for pattern input '" + arg.name() + "'");
        }
        return constraint;
    }
}
