package io.surfworks.graphmatch.graph;

import java.util.List;

/**
 * An operator in a dataflow graph.
 *
 * <p>Nodes are immutable and carry their position in the owning graph as
 * {@code index}, which is what match results hold on to. The domain is the
 * operator namespace (empty for the default one) and {@code sinceVersion} the
 * operator set version the node was defined against.
 *
 * @param index stable position of the node in its graph
 * @param name node name, unique within its graph
 * @param opType operator type, e.g. "Add", "MatMul"
 * @param domain operator domain, empty string for the default domain
 * @param sinceVersion operator set version
 * @param inputDefs ordered input arguments
 * @param outputDefs ordered output arguments
 */
public record Node(
        int index,
        String name,
        String opType,
        String domain,
        int sinceVersion,
        List<NodeArg> inputDefs,
        List<NodeArg> outputDefs
) {

    public static final String DEFAULT_DOMAIN = "";

    public Node {
        inputDefs = List.copyOf(inputDefs);
        outputDefs = List.copyOf(outputDefs);
        domain = domain == null ? DEFAULT_DOMAIN : domain;
    }

    public int inputCount() {
        return inputDefs.size();
    }

    public int outputCount() {
        return outputDefs.size();
    }

    @Override
    public String toString() {
        return name + "#" + index + "(" + (domain.isEmpty() ? "" : domain + ".") + opType + ")";
    }
}
