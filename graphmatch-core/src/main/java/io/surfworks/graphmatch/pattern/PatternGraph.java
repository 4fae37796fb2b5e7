package io.surfworks.graphmatch.pattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import io.surfworks.graphmatch.constraint.ArgConstraint;
import io.surfworks.graphmatch.constraint.NodeConstraint;
import io.surfworks.graphmatch.graph.Node;
import io.surfworks.graphmatch.graph.NodeArg;
import io.surfworks.graphmatch.graph.OperationGraph;

/**
 * A named operator shape to search for in a larger graph.
 *
 * <p>A PatternGraph is a set of {@link PatternNode}s and {@link PatternInputArg}s
 * wired together by argument name, exactly like the graphs it is matched
 * against: a node listing {@code "t"} as an input is a successor of the node
 * listing {@code "t"} as an output. The wiring is compiled into an
 * {@link OperationGraph} so pattern adjacency and pattern fan-out come from the
 * same graph model the target uses.
 *
 * <p>Example, matching a bias add followed by an activation:
 * <pre>{@code
 * PatternGraph pattern = PatternGraph.builder("bias_relu")
 *     .input(PatternInputArg.of("x"))
 *     .input(PatternInputArg.of("bias").withRanks(1))
 *     .node(PatternNode.of("add", "Add", List.of("x", "bias"), List.of("y")))
 *     .node(PatternNode.of("act", "Relu", List.of("y"), List.of("out")))
 *     .build();
 * }</pre>
 *
 * <p>Per-entity predicates replacing the default comparison can be registered
 * with {@link Builder#nodeConstraint} and {@link Builder#argConstraint}.
 */
public final class PatternGraph {

    private static final Logger LOG = Logger.getLogger(PatternGraph.class.getName());

    /** Placeholder operator type recorded for wildcard nodes in the backing graph. */
    static final String WILDCARD_OP_TYPE = "*";

    private final String name;
    private final Map<String, PatternNode> nodesByName;
    private final Map<String, PatternInputArg> inputsByName;
    private final Map<String, NodeConstraint> nodeConstraints;
    private final Map<String, ArgConstraint> argConstraints;
    private final OperationGraph graph;

    private PatternGraph(
            String name,
            Map<String, PatternNode> nodesByName,
            Map<String, PatternInputArg> inputsByName,
            Map<String, NodeConstraint> nodeConstraints,
            Map<String, ArgConstraint> argConstraints,
            OperationGraph graph) {
        this.name = name;
        this.nodesByName = Collections.unmodifiableMap(nodesByName);
        this.inputsByName = Collections.unmodifiableMap(inputsByName);
        this.nodeConstraints = Collections.unmodifiableMap(nodeConstraints);
        this.argConstraints = Collections.unmodifiableMap(argConstraints);
        this.graph = graph;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    /**
     * Returns the pattern nodes in declaration order.
     */
    public List<PatternNode> nodes() {
        return List.copyOf(nodesByName.values());
    }

    /**
     * Returns the declared pattern inputs in declaration order.
     */
    public List<PatternInputArg> inputs() {
        return List.copyOf(inputsByName.values());
    }

    public boolean isEmpty() {
        return nodesByName.isEmpty();
    }

    /**
     * Looks up a pattern node by name.
     *
     * @throws PatternLookupException if no node with that name was declared
     */
    public PatternNode patternNode(String nodeName) {
        PatternNode node = nodesByName.get(nodeName);
        if (node == null) {
            throw new PatternLookupException(
                    "No node named '" + nodeName + "' in pattern '" + name + "'", nodeName);
        }
        return node;
    }

    public Optional<PatternNode> findPatternNode(String nodeName) {
        return Optional.ofNullable(nodesByName.get(nodeName));
    }

    /**
     * Looks up a pattern input by name.
     *
     * @throws PatternLookupException if no input with that name was declared
     */
    public PatternInputArg inputArg(String argName) {
        PatternInputArg arg = inputsByName.get(argName);
        if (arg == null) {
            throw new PatternLookupException(
                    "No input named '" + argName + "' in pattern '" + name + "'", argName);
        }
        return arg;
    }

    /**
     * Returns the declared input with the given name. Names without a
     * declaration are don't-care slots during matching.
     */
    public Optional<PatternInputArg> findInputArg(String argName) {
        return Optional.ofNullable(inputsByName.get(argName));
    }

    /**
     * Returns the compiled graph of this pattern.
     */
    public OperationGraph graph() {
        return graph;
    }

    /**
     * Returns the node of {@link #graph()} standing for the given pattern node.
     */
    public Node graphNode(PatternNode node) {
        return graph.nodeByName(node.name())
                .orElseThrow(() -> new PatternLookupException(
                        "No node named '" + node.name() + "' in pattern '" + name + "'", node.name()));
    }

    /**
     * Returns the pattern node a node of {@link #graph()} was compiled from.
     */
    public PatternNode patternNode(Node graphNode) {
        return patternNode(graphNode.name());
    }

    /**
     * Returns the out-degree of the node inside this pattern, which is the
     * fan-out requirement of nodes declared with
     * {@link PatternNode#DERIVE_OUTPUT_EDGES}.
     */
    public int derivedOutputEdgeCount(PatternNode node) {
        return graph.outputEdgeCount(graphNode(node));
    }

    /**
     * Returns the first node in topological order, the default match root.
     */
    public Optional<PatternNode> firstNode() {
        List<Node> order = graph.topologicalOrder();
        return order.isEmpty() ? Optional.empty() : Optional.of(patternNode(order.get(0)));
    }

    /**
     * Returns the predicates registered for individual nodes, keyed by node name.
     */
    public Map<String, NodeConstraint> nodeConstraints() {
        return nodeConstraints;
    }

    /**
     * Returns the predicates registered for individual inputs, keyed by input name.
     */
    public Map<String, ArgConstraint> argConstraints() {
        return argConstraints;
    }

    @Override
    public String toString() {
        return String.format("PatternGraph[name=%s, nodes=%d, inputs=%d, customConstraints=%d]",
                name, nodesByName.size(), inputsByName.size(), nodeConstraints.size() + argConstraints.size());
    }

    /**
     * Accumulates pattern declarations.
     */
    public static final class Builder {

        private final String name;
        private final Map<String, PatternNode> nodes = new LinkedHashMap<>();
        private final Map<String, PatternInputArg> inputs = new LinkedHashMap<>();
        private final Map<String, NodeConstraint> nodeConstraints = new LinkedHashMap<>();
        private final Map<String, ArgConstraint> argConstraints = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        /**
         * Declares a pattern node.
         *
         * @throws PatternGraphException if a node with the same name was already declared
         */
        public Builder node(PatternNode node) {
            if (nodes.putIfAbsent(node.name(), node) != null) {
                throw new PatternGraphException(
                        "Duplicate node name '" + node.name() + "' in pattern '" + name + "'");
            }
            return this;
        }

        /**
         * Declares a pattern input argument.
         *
         * @throws PatternGraphException if an input with the same name was already declared
         */
        public Builder input(PatternInputArg arg) {
            if (inputs.putIfAbsent(arg.name(), arg) != null) {
                throw new PatternGraphException(
                        "Duplicate input name '" + arg.name() + "' in pattern '" + name + "'");
            }
            return this;
        }

        /**
         * Replaces the default node comparison for the named pattern node.
         *
         * @throws PatternGraphException if a constraint is already registered for that name
         */
        public Builder nodeConstraint(String nodeName, NodeConstraint constraint) {
            if (nodeConstraints.putIfAbsent(nodeName, constraint) != null) {
                throw new PatternGraphException(
                        "Node constraint for '" + nodeName + "' registered twice in pattern '" + name + "'");
            }
            return this;
        }

        /**
         * Replaces the default argument comparison for the named pattern input.
         *
         * @throws PatternGraphException if a constraint is already registered for that name
         */
        public Builder argConstraint(String argName, ArgConstraint constraint) {
            if (argConstraints.putIfAbsent(argName, constraint) != null) {
                throw new PatternGraphException(
                        "Argument constraint for '" + argName + "' registered twice in pattern '" + name + "'");
            }
            return this;
        }

        /**
         * Validates the declarations and compiles the pattern.
         *
         * @throws PatternGraphException if a constraint names an undeclared entity,
         *         a declared input is produced by a pattern node, or the wiring is cyclic
         */
        public PatternGraph build() {
            for (String nodeName : nodeConstraints.keySet()) {
                if (!nodes.containsKey(nodeName)) {
                    throw new PatternGraphException(
                            "Node constraint registered for undeclared node '" + nodeName + "'");
                }
            }
            for (String argName : argConstraints.keySet()) {
                if (!inputs.containsKey(argName)) {
                    throw new PatternGraphException(
                            "Argument constraint registered for undeclared input '" + argName + "'");
                }
            }

            OperationGraph.Builder graphBuilder = OperationGraph.builder(name);
            for (PatternInputArg input : inputs.values()) {
                graphBuilder.declareArg(input.name(), null, NodeArg.UNKNOWN_RANK);
            }
            for (PatternNode node : nodes.values()) {
                for (String output : node.outputs()) {
                    if (inputs.containsKey(output)) {
                        throw new PatternGraphException(String.format(
                                "Pattern input '%s' is produced by node '%s'", output, node.name()));
                    }
                }
                graphBuilder.addNode(node.name(), representativeOpType(node),
                        node.domain() == null ? Node.DEFAULT_DOMAIN : node.domain(),
                        node.versions().isEmpty() ? 1 : node.versions().get(0),
                        node.inputs(), node.outputs());
            }

            OperationGraph graph;
            try {
                graph = graphBuilder.build();
            } catch (IllegalArgumentException e) {
                throw new PatternGraphException("Invalid wiring in pattern '" + name + "': " + e.getMessage(), e);
            }

            LOG.fine(() -> "Built pattern '" + name + "' with " + nodes.size() + " nodes and "
                    + inputs.size() + " inputs");
            return new PatternGraph(name, new LinkedHashMap<>(nodes), new LinkedHashMap<>(inputs),
                    new LinkedHashMap<>(nodeConstraints), new LinkedHashMap<>(argConstraints), graph);
        }

        private static String representativeOpType(PatternNode node) {
            if (node.isWildcard()) {
                return WILDCARD_OP_TYPE;
            }
            List<String> sorted = new ArrayList<>(node.opTypes());
            Collections.sort(sorted);
            return String.join("|", sorted);
        }
    }
}
