package io.surfworks.graphmatch.match;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiPredicate;
import java.util.stream.Stream;

import io.surfworks.graphmatch.graph.Node;
import io.surfworks.graphmatch.graph.NodeArg;
import io.surfworks.graphmatch.pattern.PatternLookupException;

/**
 * Bindings produced by a successful {@link PatternMatcher#tryMatch} call.
 *
 * <p>Maps every pattern node name to the target node it matched and every
 * declared pattern input to the target argument it matched. A result is either
 * complete or empty; the matcher never leaves a partial binding behind.
 *
 * <p>Example:
 * <pre>{@code
 * PatternMatchResult result = matcher.tryMatch(graph).orElseThrow();
 * Node add = result.getNodeByName("add");
 * NodeArg bias = result.getInputByName("bias");
 * List<Node> relus = result.getNodesWithCondition(
 *         (name, group) -> group.matchedNode().opType().equals("Relu"))
 *     .toList();
 * }</pre>
 */
public final class PatternMatchResult {

    private final Map<String, MatchedNodeGroup> matchedNodeGroups = new LinkedHashMap<>();
    private final Map<String, MatchedInputGroup> matchedInputGroups = new LinkedHashMap<>();

    /**
     * Returns the target node bound to the named pattern node.
     *
     * @throws PatternLookupException if the name was not bound by this match
     */
    public Node getNodeByName(String nodeName) {
        MatchedNodeGroup group = matchedNodeGroups.get(nodeName);
        if (group == null) {
            throw new PatternLookupException("No target node has corresponding name '" + nodeName
                    + "' in pattern graph", nodeName);
        }
        return group.matchedNode();
    }

    /**
     * Returns the target argument bound to the named pattern input.
     *
     * @throws PatternLookupException if the name was not bound by this match
     */
    public NodeArg getInputByName(String argName) {
        MatchedInputGroup group = matchedInputGroups.get(argName);
        if (group == null) {
            throw new PatternLookupException("No argument has corresponding name '" + argName
                    + "' in pattern graph", argName);
        }
        return group.matchedInputArg();
    }

    /**
     * Returns the bound target nodes whose binding satisfies the filter.
     *
     * <p>The stream is lazy: the filter runs as elements are consumed.
     *
     * @param filter receives the pattern node name and its binding
     * @return matching target nodes, in binding order
     */
    public Stream<Node> getNodesWithCondition(BiPredicate<String, MatchedNodeGroup> filter) {
        return matchedNodeGroups.entrySet().stream()
                .filter(entry -> filter.test(entry.getKey(), entry.getValue()))
                .map(entry -> entry.getValue().matchedNode());
    }

    public Map<String, MatchedNodeGroup> getMatchedNodeGroups() {
        return Collections.unmodifiableMap(matchedNodeGroups);
    }

    public Map<String, MatchedInputGroup> getMatchedInputGroups() {
        return Collections.unmodifiableMap(matchedInputGroups);
    }

    public int size() {
        return matchedNodeGroups.size();
    }

    public boolean isEmpty() {
        return matchedNodeGroups.isEmpty() && matchedInputGroups.isEmpty();
    }

    /**
     * Drops every binding. Called before each root candidate is tried.
     */
    public void clear() {
        matchedNodeGroups.clear();
        matchedInputGroups.clear();
    }

    void appendToNodeGroups(Map<String, MatchedNodeGroup> groups) {
        matchedNodeGroups.putAll(groups);
    }

    void appendToInputGroups(Map<String, MatchedInputGroup> groups) {
        matchedInputGroups.putAll(groups);
    }

    @Override
    public String toString() {
        return String.format("PatternMatchResult[nodes=%s, inputs=%s]",
                matchedNodeGroups.values(), matchedInputGroups.values());
    }
}
