package io.surfworks.graphmatch.constraint;

import io.surfworks.graphmatch.graph.DataflowGraph;
import io.surfworks.graphmatch.graph.NodeArg;
import io.surfworks.graphmatch.pattern.PatternGraph;
import io.surfworks.graphmatch.pattern.PatternInputArg;

/**
 * Decides whether a target argument may stand in for a pattern input.
 *
 * <p>Same purity contract as {@link NodeConstraint}.
 */
@FunctionalInterface
public interface ArgConstraint {

    boolean test(DataflowGraph target, NodeArg targetArg, PatternGraph pattern, PatternInputArg patternArg);

    default ArgConstraint and(ArgConstraint other) {
        return (target, targetArg, pattern, patternArg) ->
                test(target, targetArg, pattern, patternArg)
                        && other.test(target, targetArg, pattern, patternArg);
    }
}
