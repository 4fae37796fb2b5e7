package io.surfworks.graphmatch.match;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.surfworks.graphmatch.graph.Node;
import io.surfworks.graphmatch.graph.NodeArg;
import io.surfworks.graphmatch.pattern.PatternNode;

/**
 * Bindings made so far by one root candidate attempt.
 *
 * <p>Holds the target nodes and pattern nodes currently bound, the
 * pattern-to-target node map used for look-ahead, and the pattern-to-target
 * argument map. Every change is appended to an undo log so a recursive call
 * can take a {@link #mark()} on entry and {@link #rollbackTo(int)} on failure,
 * which also removes whatever its descendants bound beneath it. Removal is
 * erase-if-present.
 *
 * <p>Not thread-safe; a path lives for one candidate attempt of one
 * {@link PatternMatcher#tryMatch} call.
 */
final class SearchPath {

    private final Set<Node> targetNodes = new HashSet<>();
    private final Map<String, Node> pathMap = new HashMap<>();
    private final Map<String, NodeArg> argBindings = new HashMap<>();
    private final Map<String, String> targetArgOwners = new HashMap<>();
    private final List<Entry> undoLog = new ArrayList<>();

    int mark() {
        return undoLog.size();
    }

    void rollbackTo(int mark) {
        for (int i = undoLog.size() - 1; i >= mark; i--) {
            undoLog.remove(i).erase(this);
        }
    }

    void enter(PatternNode patternNode, Node targetNode) {
        targetNodes.add(targetNode);
        pathMap.put(patternNode.name(), targetNode);
        undoLog.add(new NodeEntry(patternNode.name(), targetNode));
    }

    void bindArg(String patternArgName, NodeArg targetArg) {
        if (argBindings.putIfAbsent(patternArgName, targetArg) == null) {
            targetArgOwners.put(targetArg.name(), patternArgName);
            undoLog.add(new ArgEntry(patternArgName, targetArg));
        }
    }

    boolean containsTarget(Node targetNode) {
        return targetNodes.contains(targetNode);
    }

    boolean containsPattern(PatternNode patternNode) {
        return pathMap.containsKey(patternNode.name());
    }

    /**
     * Returns the target node bound to a pattern node on the path, or null.
     */
    Node boundTarget(PatternNode patternNode) {
        return pathMap.get(patternNode.name());
    }

    /**
     * Returns the target argument bound to a pattern input, or null.
     */
    NodeArg boundArg(String patternArgName) {
        return argBindings.get(patternArgName);
    }

    boolean isTargetArgBound(NodeArg targetArg) {
        return targetArgOwners.containsKey(targetArg.name());
    }

    int size() {
        return pathMap.size();
    }

    void clear() {
        targetNodes.clear();
        pathMap.clear();
        argBindings.clear();
        targetArgOwners.clear();
        undoLog.clear();
    }

    private sealed interface Entry permits NodeEntry, ArgEntry {
        void erase(SearchPath path);
    }

    private record NodeEntry(String patternName, Node targetNode) implements Entry {
        @Override
        public void erase(SearchPath path) {
            path.targetNodes.remove(targetNode);
            path.pathMap.remove(patternName, targetNode);
        }
    }

    private record ArgEntry(String patternArgName, NodeArg targetArg) implements Entry {
        @Override
        public void erase(SearchPath path) {
            path.argBindings.remove(patternArgName, targetArg);
            path.targetArgOwners.remove(targetArg.name(), patternArgName);
        }
    }
}
