package io.surfworks.graphmatch.match;

import io.surfworks.graphmatch.graph.Node;
import io.surfworks.graphmatch.pattern.PatternNode;

/**
 * A target node together with the pattern node it was bound to.
 *
 * @param matchedNode the node of the target graph
 * @param patternNode the pattern node it stands in for
 */
public record MatchedNodeGroup(Node matchedNode, PatternNode patternNode) {

    @Override
    public String toString() {
        return patternNode.name() + " -> " + matchedNode;
    }
}
