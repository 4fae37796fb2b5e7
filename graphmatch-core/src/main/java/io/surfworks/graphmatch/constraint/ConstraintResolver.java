package io.surfworks.graphmatch.constraint;

import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

import io.surfworks.graphmatch.pattern.PatternGraph;
import io.surfworks.graphmatch.pattern.PatternInputArg;
import io.surfworks.graphmatch.pattern.PatternNode;

/**
 * Picks, for each pattern entity, either its registered override or the shared default.
 */
public final class ConstraintResolver {

    private static final Logger LOG = Logger.getLogger(ConstraintResolver.class.getName());

    private final NodeConstraint defaultNodeConstraint;
    private final ArgConstraint defaultArgConstraint;

    public ConstraintResolver(NodeConstraint defaultNodeConstraint, ArgConstraint defaultArgConstraint) {
        this.defaultNodeConstraint = defaultNodeConstraint;
        this.defaultArgConstraint = defaultArgConstraint;
    }

    public NodeConstraint defaultNodeConstraint() {
        return defaultNodeConstraint;
    }

    public ArgConstraint defaultArgConstraint() {
        return defaultArgConstraint;
    }

    /**
     * Resolves the constraints of every node and input of the pattern.
     *
     * @param pattern the pattern to resolve
     * @return one constraint per declared entity
     */
    public ResolvedConstraints resolve(PatternGraph pattern) {
        Map<String, NodeConstraint> nodes = new HashMap<>();
        for (PatternNode node : pattern.nodes()) {
            nodes.put(node.name(), pattern.nodeConstraints().getOrDefault(node.name(), defaultNodeConstraint));
        }
        Map<String, ArgConstraint> args = new HashMap<>();
        for (PatternInputArg arg : pattern.inputs()) {
            args.put(arg.name(), pattern.argConstraints().getOrDefault(arg.name(), defaultArgConstraint));
        }
        LOG.fine(() -> "Resolved constraints for pattern '" + pattern.name() + "': "
                + pattern.nodeConstraints().size() + " node overrides, "
                + pattern.argConstraints().size() + " argument overrides");
        return new ResolvedConstraints(nodes, args);
    }
}
