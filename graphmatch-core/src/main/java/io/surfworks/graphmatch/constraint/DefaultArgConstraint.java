package io.surfworks.graphmatch.constraint;

import java.util.logging.Logger;

import io.surfworks.graphmatch.graph.DataflowGraph;
import io.surfworks.graphmatch.graph.NodeArg;
import io.surfworks.graphmatch.pattern.PatternGraph;
import io.surfworks.graphmatch.pattern.PatternInputArg;

/**
 * Structural argument comparison: element type and rank.
 *
 * <p>An empty allow-list accepts anything, including arguments whose type or
 * rank is unknown. A non-empty allow-list rejects unknown values.
 */
public final class DefaultArgConstraint implements ArgConstraint {

    private static final Logger LOG = Logger.getLogger(DefaultArgConstraint.class.getName());

    public static final DefaultArgConstraint INSTANCE = new DefaultArgConstraint();

    private DefaultArgConstraint() {}

    @Override
    public boolean test(DataflowGraph target, NodeArg targetArg, PatternGraph pattern, PatternInputArg patternArg) {
        if (!patternArg.allowedTypes().isEmpty()
                && (!targetArg.hasElementType() || !patternArg.allowedTypes().contains(targetArg.elementType()))) {
            LOG.finest(() -> "Element type mismatch for " + patternArg.name() + ", target arg is " + targetArg);
            return false;
        }
        if (!patternArg.allowedRanks().isEmpty()
                && (!targetArg.hasRank() || !patternArg.allowedRanks().contains(targetArg.rank()))) {
            LOG.finest(() -> "Rank mismatch for " + patternArg.name() + ", target arg is " + targetArg);
            return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return "DefaultArgConstraint";
    }
}
