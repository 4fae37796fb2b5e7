package io.surfworks.graphmatch.match;

import io.surfworks.graphmatch.graph.NodeArg;
import io.surfworks.graphmatch.pattern.PatternInputArg;

/**
 * A target argument together with the pattern input it was bound to.
 *
 * @param matchedInputArg the argument of the target graph
 * @param patternInputArg the pattern input it stands in for
 */
public record MatchedInputGroup(NodeArg matchedInputArg, PatternInputArg patternInputArg) {

    @Override
    public String toString() {
        return patternInputArg.name() + " -> " + matchedInputArg;
    }
}
