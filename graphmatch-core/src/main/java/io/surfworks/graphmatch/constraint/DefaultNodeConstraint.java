package io.surfworks.graphmatch.constraint;

import java.util.logging.Logger;

import io.surfworks.graphmatch.graph.DataflowGraph;
import io.surfworks.graphmatch.graph.Node;
import io.surfworks.graphmatch.pattern.PatternGraph;
import io.surfworks.graphmatch.pattern.PatternNode;

/**
 * Structural node comparison: operator type, domain and version, fan-out.
 *
 * <p>The fan-out rule depends on how the pattern node was declared:
 * <ul>
 *   <li>explicit count {@code N > 0}: the target must have exactly {@code N}
 *       output edges</li>
 *   <li>{@link PatternNode#DERIVE_OUTPUT_EDGES}: the requirement is the pattern
 *       node's out-degree inside the pattern. The target needs at least that
 *       many output edges, or exactly that many when constructed with
 *       {@code strictDerivedFanOut}</li>
 * </ul>
 */
public final class DefaultNodeConstraint implements NodeConstraint {

    private static final Logger LOG = Logger.getLogger(DefaultNodeConstraint.class.getName());

    private final boolean skipOpType;
    private final boolean skipDomainAndVersion;
    private final boolean strictDerivedFanOut;

    public DefaultNodeConstraint(boolean skipOpType, boolean skipDomainAndVersion, boolean strictDerivedFanOut) {
        this.skipOpType = skipOpType;
        this.skipDomainAndVersion = skipDomainAndVersion;
        this.strictDerivedFanOut = strictDerivedFanOut;
    }

    /**
     * Creates the constraint with every check enabled and lenient derived fan-out.
     */
    public static DefaultNodeConstraint create() {
        return new DefaultNodeConstraint(false, false, false);
    }

    @Override
    public boolean test(DataflowGraph target, Node targetNode, PatternGraph pattern, PatternNode patternNode) {
        if (targetNode == null || patternNode == null) {
            return targetNode == null && patternNode == null;
        }
        if (!skipOpType && !patternNode.matchesOpType(targetNode.opType())) {
            LOG.finest(() -> "OpType mismatch for " + patternNode.name() + ", target node is " + targetNode);
            return false;
        }
        if (!skipDomainAndVersion
                && !patternNode.matchesDomainVersion(targetNode.domain(), targetNode.sinceVersion())) {
            LOG.finest(() -> "Domain or version mismatch for " + patternNode.name()
                    + ", target domain is '" + targetNode.domain() + "' version " + targetNode.sinceVersion());
            return false;
        }

        int fanOut = target.outputEdgeCount(targetNode);
        if (patternNode.hasExplicitOutputEdgeCount()) {
            if (fanOut != patternNode.outputEdgeCount()) {
                LOG.finest(() -> "Output edge count mismatch for " + patternNode.name() + ", expected "
                        + patternNode.outputEdgeCount() + " but target node has " + fanOut);
                return false;
            }
        } else {
            int derived = pattern.derivedOutputEdgeCount(patternNode);
            boolean ok = strictDerivedFanOut ? fanOut == derived : fanOut >= derived;
            if (!ok) {
                LOG.finest(() -> "Output edge count mismatch for " + patternNode.name() + ", pattern has "
                        + derived + " but target node has " + fanOut);
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("DefaultNodeConstraint[skipOpType=%s, skipDomainAndVersion=%s, strictDerivedFanOut=%s]",
                skipOpType, skipDomainAndVersion, strictDerivedFanOut);
    }
}
