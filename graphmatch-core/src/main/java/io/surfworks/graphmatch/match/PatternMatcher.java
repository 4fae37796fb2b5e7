package io.surfworks.graphmatch.match;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.graphmatch.constraint.ArgConstraint;
import io.surfworks.graphmatch.constraint.ConstraintResolver;
import io.surfworks.graphmatch.constraint.DefaultArgConstraint;
import io.surfworks.graphmatch.constraint.DefaultNodeConstraint;
import io.surfworks.graphmatch.constraint.NodeConstraint;
import io.surfworks.graphmatch.constraint.ResolvedConstraints;
import io.surfworks.graphmatch.graph.DataflowGraph;
import io.surfworks.graphmatch.graph.Node;
import io.surfworks.graphmatch.graph.NodeArg;
import io.surfworks.graphmatch.pattern.PatternGraph;
import io.surfworks.graphmatch.pattern.PatternGraphException;
import io.surfworks.graphmatch.pattern.PatternInputArg;
import io.surfworks.graphmatch.pattern.PatternNode;

/**
 * Finds one occurrence of a {@link PatternGraph} inside a target graph.
 *
 * <p>Target nodes are tried as the image of a root pattern node in
 * topological order; the first candidate from which the whole pattern can be
 * matched wins. There is no ranking between successful candidates.
 *
 * <p>From a (target, pattern) pair the search proceeds in phases:
 * <ol>
 *   <li>the node constraint of the pattern node must accept the target node</li>
 *   <li>declared pattern inputs are assigned injectively to target inputs,
 *       backtracking over the assignment; undeclared names are don't-care</li>
 *   <li>the pair is recorded on the search path</li>
 *   <li>each pattern predecessor is matched against an unused target
 *       predecessor; a predecessor already on the path is not revisited,
 *       instead its bound target must be a predecessor of the target node
 *       (look-ahead)</li>
 *   <li>the same for successors</li>
 * </ol>
 * A failure in any phase rolls the path back to where this pair started, so
 * sibling branches never see bindings of an abandoned branch, and the
 * bindings collected below it are dropped instead of being merged upwards.
 *
 * <p>Example:
 * <pre>{@code
 * PatternMatcher matcher = new PatternMatcher(pattern);
 * Optional<PatternMatchResult> match = matcher.tryMatch(graph, "act");
 * match.ifPresent(m -> fuse(m.getNodeByName("add"), m.getNodeByName("act")));
 * }</pre>
 *
 * <p>The search is exhaustive backtracking and exponential in the number of
 * interchangeable candidates in the worst case. Callers matching large,
 * highly symmetric graphs should bound the call externally. All search state
 * is created per call, so an instance may be reused and shared between
 * threads as long as its constraints are pure. A caller-owned
 * {@link PatternMatchResult} must not be shared.
 */
public final class PatternMatcher {

    private static final Logger LOG = Logger.getLogger(PatternMatcher.class.getName());

    private final PatternGraph pattern;
    private final ResolvedConstraints constraints;

    public PatternMatcher(PatternGraph pattern) {
        this(pattern, MatcherConfig.defaults());
    }

    public PatternMatcher(PatternGraph pattern, MatcherConfig config) {
        this(pattern, new ConstraintResolver(
                new DefaultNodeConstraint(config.skipOpType(), config.skipDomainAndVersion(),
                        config.strictDerivedFanOut()),
                DefaultArgConstraint.INSTANCE));
    }

    /**
     * Creates a matcher with custom default constraints.
     *
     * @param pattern the pattern to search for
     * @param resolver supplies the defaults used for entities without an override
     */
    public PatternMatcher(PatternGraph pattern, ConstraintResolver resolver) {
        this.pattern = pattern;
        this.constraints = resolver.resolve(pattern);
    }

    public PatternGraph pattern() {
        return pattern;
    }

    /**
     * Matches from the first pattern node in topological order.
     *
     * @return the bindings, or empty if the pattern does not occur
     * @throws PatternGraphException if the pattern has no nodes
     */
    public Optional<PatternMatchResult> tryMatch(DataflowGraph target) {
        return tryMatch(target, null);
    }

    /**
     * Matches from the named pattern node.
     *
     * @param target the graph to search
     * @param rootName the pattern node anchoring the search, or null/empty for the default
     * @return the bindings, or empty if the pattern does not occur
     * @throws PatternGraphException if the root is not a pattern node or the pattern has no nodes
     */
    public Optional<PatternMatchResult> tryMatch(DataflowGraph target, String rootName) {
        PatternMatchResult result = new PatternMatchResult();
        return tryMatch(target, result, rootName) ? Optional.of(result) : Optional.empty();
    }

    /**
     * Matches into a caller-owned result.
     *
     * <p>{@code result} is cleared before every root candidate; when this
     * returns false it is left empty.
     *
     * @return true if a match was found
     * @throws PatternGraphException if the root is not a pattern node or the pattern has no nodes
     */
    public boolean tryMatch(DataflowGraph target, PatternMatchResult result, String rootName) {
        PatternNode root = resolveRoot(rootName);
        SearchPath path = new SearchPath();

        for (Node candidate : target.topologicalOrder()) {
            result.clear();
            path.clear();
            Bindings bindings = new Bindings();
            if (findMatch(new Search(target, path), candidate, root, bindings)) {
                result.appendToNodeGroups(bindings.nodes);
                result.appendToInputGroups(bindings.inputs);
                LOG.fine(() -> "Pattern '" + pattern.name() + "' matched in '" + target.name()
                        + "' at " + candidate + " for root " + root.name());
                return true;
            }
        }

        result.clear();
        LOG.fine(() -> "No match for pattern '" + pattern.name() + "' in '" + target.name() + "'");
        return false;
    }

    private PatternNode resolveRoot(String rootName) {
        if (pattern.isEmpty()) {
            throw new PatternGraphException("Pattern '" + pattern.name() + "' has no nodes");
        }
        if (rootName == null || rootName.isEmpty()) {
            return pattern.firstNode()
                    .orElseThrow(() -> new PatternGraphException("Pattern '" + pattern.name() + "' has no nodes"));
        }
        return pattern.findPatternNode(rootName)
                .orElseThrow(() -> new PatternGraphException(
                        "Pattern root '" + rootName + "' was not found in pattern '" + pattern.name() + "'"));
    }

    private boolean findMatch(Search search, Node g, PatternNode p, Bindings out) {
        LOG.finest(() -> "Try " + g + " for " + p.name());

        NodeConstraint nodeConstraint = constraints.forNode(p);
        if (!nodeConstraint.test(search.target, g, pattern, p)) {
            LOG.finest(() -> "Node constraint rejected " + g + " for " + p.name());
            return false;
        }

        Map<String, NodeArg> assignment = new LinkedHashMap<>();
        if (!matchArgs(search, g, p, 0, new boolean[g.inputCount()], assignment)) {
            LOG.finest(() -> "Inputs of " + g + " do not match " + p.name());
            return false;
        }

        int mark = search.path.mark();
        search.path.enter(p, g);
        Bindings local = new Bindings();
        local.nodes.put(p.name(), new MatchedNodeGroup(g, p));
        for (Map.Entry<String, NodeArg> entry : assignment.entrySet()) {
            search.path.bindArg(entry.getKey(), entry.getValue());
            local.inputs.put(entry.getKey(),
                    new MatchedInputGroup(entry.getValue(), pattern.inputArg(entry.getKey())));
        }

        Node pg = pattern.graphNode(p);
        Set<Node> visitedTargets = new HashSet<>();
        Set<String> visitedPatterns = new HashSet<>();
        boolean matched = matchNeighbours(search, g, pattern.graph().inputNodes(pg),
                search.target.inputNodes(g), visitedTargets, visitedPatterns, local, "input")
                && matchNeighbours(search, g, pattern.graph().outputNodes(pg),
                search.target.outputNodes(g), visitedTargets, visitedPatterns, local, "output");

        if (!matched) {
            search.path.rollbackTo(mark);
            return false;
        }

        out.nodes.putAll(local.nodes);
        out.inputs.putAll(local.inputs);
        LOG.finest(() -> "Matched " + g + " for " + p.name());
        return true;
    }

    /*
     * Assigns the declared inputs of p, in order, to distinct input slots of g.
     * A pattern input already bound elsewhere must meet the same target argument
     * again; an unbound one may take any free argument its constraint accepts.
     */
    private boolean matchArgs(Search search, Node g, PatternNode p, int argIndex,
                              boolean[] claimed, Map<String, NodeArg> assignment) {
        if (argIndex >= p.inputs().size()) {
            return true;
        }
        String argName = p.inputs().get(argIndex);
        Optional<PatternInputArg> declared = pattern.findInputArg(argName);
        if (declared.isEmpty()) {
            return matchArgs(search, g, p, argIndex + 1, claimed, assignment);
        }

        PatternInputArg patternArg = declared.get();
        ArgConstraint argConstraint = constraints.forArg(patternArg);
        NodeArg required = assignment.containsKey(argName) ? assignment.get(argName) : search.path.boundArg(argName);
        List<NodeArg> targetArgs = g.inputDefs();

        for (int i = 0; i < targetArgs.size(); i++) {
            if (claimed[i]) {
                continue;
            }
            NodeArg targetArg = targetArgs.get(i);
            if (required != null) {
                if (!required.equals(targetArg)) {
                    continue;
                }
            } else if (search.path.isTargetArgBound(targetArg)
                    || assignment.containsValue(targetArg)
                    || !argConstraint.test(search.target, targetArg, pattern, patternArg)) {
                continue;
            }

            claimed[i] = true;
            boolean fresh = assignment.putIfAbsent(argName, targetArg) == null;
            if (matchArgs(search, g, p, argIndex + 1, claimed, assignment)) {
                return true;
            }
            claimed[i] = false;
            if (fresh) {
                assignment.remove(argName);
            }
        }
        return false;
    }

    private boolean matchNeighbours(Search search, Node g, List<Node> patternNeighbours, List<Node> targetNeighbours,
                                    Set<Node> visitedTargets, Set<String> visitedPatterns,
                                    Bindings local, String direction) {
        for (Node curGraphNode : patternNeighbours) {
            PatternNode cur = pattern.patternNode(curGraphNode);
            if (visitedPatterns.contains(cur.name())) {
                continue;
            }

            if (search.path.containsPattern(cur)) {
                // Reached again through another edge: its target must be adjacent to g
                Node bound = search.path.boundTarget(cur);
                if (targetNeighbours.contains(bound)) {
                    continue;
                }
                LOG.finest(() -> "Look-ahead failed: " + cur.name() + " is bound to " + bound
                        + ", which is not an " + direction + " of " + g);
                return false;
            }

            boolean found = false;
            for (Node tar : targetNeighbours) {
                if (search.path.containsTarget(tar) || visitedTargets.contains(tar)) {
                    continue;
                }
                if (findMatch(search, tar, cur, local)) {
                    visitedTargets.add(tar);
                    visitedPatterns.add(cur.name());
                    found = true;
                    break;
                }
            }
            if (!found) {
                LOG.finest(() -> "No " + direction + " of " + g + " matches " + cur.name());
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "PatternMatcher[" + pattern + "]";
    }

    private record Search(DataflowGraph target, SearchPath path) {}

    private static final class Bindings {
        final Map<String, MatchedNodeGroup> nodes = new LinkedHashMap<>();
        final Map<String, MatchedInputGroup> inputs = new LinkedHashMap<>();
    }
}
