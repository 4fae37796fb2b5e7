package io.surfworks.graphmatch.graph;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a dataflow graph.
 *
 * <p>This is the only surface the matcher consumes. Implementations must keep
 * node identity stable for the lifetime of a view: the same {@link Node}
 * instance (or an equal one with the same index) is returned every time.
 * Both the pattern and the target side of a match are exposed through this
 * interface.
 */
public interface DataflowGraph {

    String name();

    /**
     * Returns all nodes ordered by index.
     */
    List<Node> nodes();

    /**
     * Returns the node at the given index.
     *
     * @throws IndexOutOfBoundsException if no such node exists
     */
    Node node(int index);

    Optional<Node> nodeByName(String name);

    /**
     * Returns the nodes in topological order: every node appears after all of
     * the nodes producing its inputs.
     */
    List<Node> topologicalOrder();

    /**
     * Returns the distinct nodes producing inputs of {@code node}, in input slot order.
     */
    List<Node> inputNodes(Node node);

    /**
     * Returns the distinct nodes consuming outputs of {@code node}, in first-use order.
     */
    List<Node> outputNodes(Node node);

    /**
     * Returns the number of (consumer, input slot) edges fed by the outputs of
     * {@code node}. Values that leave the graph without a consumer are not counted.
     */
    int outputEdgeCount(Node node);

    /**
     * Returns the node producing the given argument, if any.
     */
    Optional<Node> producer(NodeArg arg);

    /**
     * Returns the nodes consuming the given argument (empty if none).
     */
    List<Node> consumers(NodeArg arg);

    Optional<NodeArg> arg(String name);

    default int size() {
        return nodes().size();
    }

    default boolean isEmpty() {
        return nodes().isEmpty();
    }
}
