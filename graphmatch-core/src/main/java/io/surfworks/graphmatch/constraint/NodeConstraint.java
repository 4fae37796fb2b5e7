package io.surfworks.graphmatch.constraint;

import io.surfworks.graphmatch.graph.DataflowGraph;
import io.surfworks.graphmatch.graph.Node;
import io.surfworks.graphmatch.pattern.PatternGraph;
import io.surfworks.graphmatch.pattern.PatternNode;

/**
 * Decides whether a target node may stand in for a pattern node.
 *
 * <p>Implementations must be pure: the matcher backtracks freely and relies on
 * a constraint giving the same answer for the same arguments without touching
 * either graph.
 */
@FunctionalInterface
public interface NodeConstraint {

    /**
     * @param target the graph being searched
     * @param targetNode candidate node of {@code target}
     * @param pattern the pattern being matched
     * @param patternNode the pattern node the candidate would be bound to
     * @return true if the candidate is acceptable
     */
    boolean test(DataflowGraph target, Node targetNode, PatternGraph pattern, PatternNode patternNode);

    /**
     * Returns a constraint accepting only candidates both constraints accept.
     */
    default NodeConstraint and(NodeConstraint other) {
        return (target, targetNode, pattern, patternNode) ->
                test(target, targetNode, pattern, patternNode)
                        && other.test(target, targetNode, pattern, patternNode);
    }
}
