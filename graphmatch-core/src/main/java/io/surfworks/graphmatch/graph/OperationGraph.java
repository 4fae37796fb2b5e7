package io.surfworks.graphmatch.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * In-memory dataflow graph with def-use chain analysis.
 *
 * <p>OperationGraph keeps, for every argument:
 * <ul>
 *   <li>the node that produces it (producer)</li>
 *   <li>the nodes that consume it, one entry per input slot (consumers)</li>
 * </ul>
 * and derives node adjacency and a topological order from those chains when
 * the graph is built. Nodes are never connected explicitly: a node that reads
 * an argument another node writes is a successor of that node.
 *
 * <p>Example:
 * <pre>{@code
 * OperationGraph graph = OperationGraph.builder("mlp")
 *     .addNode("mm", "MatMul", List.of("x", "w"), List.of("xw"))
 *     .addNode("bias", "Add", List.of("xw", "b"), List.of("y"))
 *     .addNode("act", "Relu", List.of("y"), List.of("out"))
 *     .build();
 *
 * Node mm = graph.nodeByName("mm").orElseThrow();
 * List<Node> next = graph.outputNodes(mm);   // [bias]
 * int fanOut = graph.outputEdgeCount(mm);    // 1
 * }</pre>
 *
 * <p>Instances are immutable once built and safe to share.
 */
public final class OperationGraph implements DataflowGraph {

    private final String name;
    private final List<Node> nodes;
    private final Map<String, Node> nodesByName;
    private final Map<String, NodeArg> argsByName;
    private final Map<String, Node> producers;
    private final Map<String, List<Node>> consumerSlots;
    private final List<List<Node>> inputNodes;
    private final List<List<Node>> outputNodes;
    private final int[] outputEdgeCounts;
    private final List<Node> topologicalOrder;

    private OperationGraph(
            String name,
            List<Node> nodes,
            Map<String, NodeArg> argsByName,
            Map<String, Node> producers,
            Map<String, List<Node>> consumerSlots) {
        this.name = name;
        this.nodes = List.copyOf(nodes);
        this.argsByName = Collections.unmodifiableMap(argsByName);
        this.producers = producers;
        this.consumerSlots = consumerSlots;

        this.nodesByName = new HashMap<>();
        for (Node node : nodes) {
            nodesByName.put(node.name(), node);
        }

        this.inputNodes = new ArrayList<>(nodes.size());
        this.outputNodes = new ArrayList<>(nodes.size());
        this.outputEdgeCounts = new int[nodes.size()];
        for (Node node : nodes) {
            Set<Node> in = new LinkedHashSet<>();
            for (NodeArg input : node.inputDefs()) {
                Node producer = producers.get(input.name());
                if (producer != null) {
                    in.add(producer);
                }
            }
            inputNodes.add(List.copyOf(in));

            Set<Node> out = new LinkedHashSet<>();
            int edges = 0;
            for (NodeArg output : node.outputDefs()) {
                List<Node> slots = consumerSlots.getOrDefault(output.name(), List.of());
                out.addAll(slots);
                edges += slots.size();
            }
            outputNodes.add(List.copyOf(out));
            outputEdgeCounts[node.index()] = edges;
        }

        this.topologicalOrder = sortTopologically();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<Node> nodes() {
        return nodes;
    }

    @Override
    public Node node(int index) {
        return nodes.get(index);
    }

    @Override
    public Optional<Node> nodeByName(String nodeName) {
        return Optional.ofNullable(nodesByName.get(nodeName));
    }

    @Override
    public List<Node> topologicalOrder() {
        return topologicalOrder;
    }

    @Override
    public List<Node> inputNodes(Node node) {
        return inputNodes.get(checkOwned(node).index());
    }

    @Override
    public List<Node> outputNodes(Node node) {
        return outputNodes.get(checkOwned(node).index());
    }

    @Override
    public int outputEdgeCount(Node node) {
        return outputEdgeCounts[checkOwned(node).index()];
    }

    @Override
    public Optional<Node> producer(NodeArg arg) {
        return Optional.ofNullable(producers.get(arg.name()));
    }

    @Override
    public List<Node> consumers(NodeArg arg) {
        List<Node> slots = consumerSlots.getOrDefault(arg.name(), List.of());
        return List.copyOf(new LinkedHashSet<>(slots));
    }

    /**
     * Returns the number of input slots reading the given argument.
     *
     * <p>An argument read twice by the same node counts twice.
     */
    public int useCount(NodeArg arg) {
        return consumerSlots.getOrDefault(arg.name(), List.of()).size();
    }

    /**
     * Returns true if the argument is not produced by any node of this graph.
     */
    public boolean isGraphInput(NodeArg arg) {
        return argsByName.containsKey(arg.name()) && !producers.containsKey(arg.name());
    }

    @Override
    public Optional<NodeArg> arg(String argName) {
        return Optional.ofNullable(argsByName.get(argName));
    }

    /**
     * Returns all arguments, in first-mention order.
     */
    public List<NodeArg> args() {
        return List.copyOf(argsByName.values());
    }

    private Node checkOwned(Node node) {
        int index = node.index();
        if (index < 0 || index >= nodes.size()
                || (nodes.get(index) != node && !nodes.get(index).equals(node))) {
            throw new IllegalArgumentException("Node " + node + " does not belong to graph '" + name + "'");
        }
        return node;
    }

    // Kahn's algorithm; among ready nodes the lowest index goes first
    private List<Node> sortTopologically() {
        int[] pending = new int[nodes.size()];
        for (Node node : nodes) {
            pending[node.index()] = inputNodes.get(node.index()).size();
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < pending.length; i++) {
            if (pending[i] == 0) {
                ready.add(i);
            }
        }

        List<Node> order = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            Node node = nodes.get(ready.poll());
            order.add(node);
            for (Node next : outputNodes.get(node.index())) {
                if (--pending[next.index()] == 0) {
                    ready.add(next.index());
                }
            }
        }

        if (order.size() != nodes.size()) {
            throw new IllegalArgumentException("Graph '" + name + "' contains a cycle");
        }
        return List.copyOf(order);
    }

    @Override
    public String toString() {
        return String.format("OperationGraph[name=%s, nodes=%d, args=%d]",
                name, nodes.size(), argsByName.size());
    }

    /**
     * Collects nodes and argument declarations, then wires them by argument name.
     */
    public static final class Builder {

        private final String name;
        private final Map<String, NodeArg> declaredArgs = new LinkedHashMap<>();
        private final List<NodeSpec> specs = new ArrayList<>();
        private final Set<String> nodeNames = new LinkedHashSet<>();

        private Builder(String name) {
            this.name = name;
        }

        /**
         * Attaches type information to an argument.
         *
         * <p>Arguments that are never declared are created untyped.
         *
         * @param argName the argument name
         * @param elementType element type, or null if unknown
         * @param rank tensor rank, or {@link NodeArg#UNKNOWN_RANK}
         * @return this builder
         */
        public Builder declareArg(String argName, String elementType, int rank) {
            declaredArgs.put(argName, new NodeArg(argName, elementType, rank));
            return this;
        }

        public Builder addNode(String nodeName, String opType, List<String> inputs, List<String> outputs) {
            return addNode(nodeName, opType, Node.DEFAULT_DOMAIN, 1, inputs, outputs);
        }

        public Builder addNode(String nodeName, String opType, String domain, int sinceVersion,
                               List<String> inputs, List<String> outputs) {
            if (nodeName == null || nodeName.isEmpty()) {
                throw new IllegalArgumentException("Node name must not be empty");
            }
            if (opType == null || opType.isEmpty()) {
                throw new IllegalArgumentException("Node '" + nodeName + "' has no operator type");
            }
            if (!nodeNames.add(nodeName)) {
                throw new IllegalArgumentException("Duplicate node name '" + nodeName + "' in graph '" + name + "'");
            }
            specs.add(new NodeSpec(nodeName, opType, domain, sinceVersion, List.copyOf(inputs), List.copyOf(outputs)));
            return this;
        }

        /**
         * Builds the graph.
         *
         * @return the wired graph
         * @throws IllegalArgumentException if an argument has two producers or the graph has a cycle
         */
        public OperationGraph build() {
            Map<String, NodeArg> args = new LinkedHashMap<>();
            Map<String, Node> producers = new HashMap<>();
            Map<String, List<Node>> consumerSlots = new HashMap<>();
            List<Node> nodes = new ArrayList<>(specs.size());

            for (NodeSpec spec : specs) {
                List<NodeArg> inputs = new ArrayList<>(spec.inputs().size());
                for (String input : spec.inputs()) {
                    inputs.add(args.computeIfAbsent(input, this::resolveArg));
                }
                List<NodeArg> outputs = new ArrayList<>(spec.outputs().size());
                for (String output : spec.outputs()) {
                    outputs.add(args.computeIfAbsent(output, this::resolveArg));
                }
                nodes.add(new Node(nodes.size(), spec.name(), spec.opType(), spec.domain(),
                        spec.sinceVersion(), inputs, outputs));
            }

            for (Node node : nodes) {
                for (NodeArg output : node.outputDefs()) {
                    Node previous = producers.putIfAbsent(output.name(), node);
                    if (previous != null) {
                        throw new IllegalArgumentException(String.format(
                                "Argument '%s' is produced by both '%s' and '%s'",
                                output.name(), previous.name(), node.name()));
                    }
                }
                for (NodeArg input : node.inputDefs()) {
                    consumerSlots.computeIfAbsent(input.name(), k -> new ArrayList<>()).add(node);
                }
            }

            // Declared but unused arguments are still part of the graph
            for (NodeArg declared : declaredArgs.values()) {
                args.putIfAbsent(declared.name(), declared);
            }

            return new OperationGraph(name, nodes, args, producers, consumerSlots);
        }

        private NodeArg resolveArg(String argName) {
            NodeArg declared = declaredArgs.get(argName);
            return declared != null ? declared : NodeArg.untyped(argName);
        }

        private record NodeSpec(String name, String opType, String domain, int sinceVersion,
                                List<String> inputs, List<String> outputs) {}
    }
}
