package io.surfworks.graphmatch.pattern;

import java.util.List;
import java.util.Set;

/**
 * A node of a pattern graph: which operators it accepts and how it is wired.
 *
 * <p>A pattern node accepts any operator whose type is in {@code opTypes}; an
 * empty set is a wildcard. When {@code domain} is null the domain and version
 * are not checked; otherwise the target's domain must equal it and, unless
 * {@code versions} is empty, its version must be listed.
 *
 * <p>{@code outputEdgeCount} is the fan-out the target node must have:
 * <ul>
 *   <li>{@link #DERIVE_OUTPUT_EDGES} (0): derived from this node's own
 *       out-degree inside the pattern graph</li>
 *   <li>a positive value: the target must have exactly that many output edges</li>
 * </ul>
 *
 * @param name unique name inside the pattern
 * @param opTypes accepted operator types, empty for any
 * @param domain required operator domain, or null to skip domain and version checks
 * @param versions accepted operator set versions, empty for any
 * @param inputs names of the arguments this node reads
 * @param outputs names of the arguments this node writes
 * @param outputEdgeCount required fan-out, or {@link #DERIVE_OUTPUT_EDGES}
 */
public record PatternNode(
        String name,
        Set<String> opTypes,
        String domain,
        List<Integer> versions,
        List<String> inputs,
        List<String> outputs,
        int outputEdgeCount
) {

    /**
     * Fan-out sentinel: take the requirement from the pattern graph itself.
     */
    public static final int DERIVE_OUTPUT_EDGES = 0;

    public PatternNode {
        if (name == null || name.isEmpty()) {
            throw new PatternGraphException("Pattern node name must not be empty");
        }
        if (outputEdgeCount < 0) {
            throw new PatternGraphException(
                    "Pattern node '" + name + "' has negative output edge count " + outputEdgeCount);
        }
        opTypes = Set.copyOf(opTypes);
        versions = List.copyOf(versions);
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
    }

    /**
     * Creates a node accepting a single operator type in any domain.
     */
    public static PatternNode of(String name, String opType, List<String> inputs, List<String> outputs) {
        return new PatternNode(name, Set.of(opType), null, List.of(), inputs, outputs, DERIVE_OUTPUT_EDGES);
    }

    /**
     * Creates a node accepting any of the given operator types.
     */
    public static PatternNode anyOf(String name, Set<String> opTypes, List<String> inputs, List<String> outputs) {
        return new PatternNode(name, opTypes, null, List.of(), inputs, outputs, DERIVE_OUTPUT_EDGES);
    }

    /**
     * Creates a node accepting every operator.
     */
    public static PatternNode wildcard(String name, List<String> inputs, List<String> outputs) {
        return new PatternNode(name, Set.of(), null, List.of(), inputs, outputs, DERIVE_OUTPUT_EDGES);
    }

    /**
     * Returns a copy constrained to the given domain and versions.
     */
    public PatternNode withDomain(String newDomain, Integer... newVersions) {
        return new PatternNode(name, opTypes, newDomain, List.of(newVersions), inputs, outputs, outputEdgeCount);
    }

    /**
     * Returns a copy requiring exactly {@code count} output edges, or deriving
     * the requirement when {@code count} is {@link #DERIVE_OUTPUT_EDGES}.
     */
    public PatternNode withOutputEdgeCount(int count) {
        return new PatternNode(name, opTypes, domain, versions, inputs, outputs, count);
    }

    public boolean isWildcard() {
        return opTypes.isEmpty();
    }

    public boolean hasExplicitOutputEdgeCount() {
        return outputEdgeCount != DERIVE_OUTPUT_EDGES;
    }

    public boolean matchesOpType(String opType) {
        return isWildcard() || opTypes.contains(opType);
    }

    public boolean matchesDomainVersion(String targetDomain, int targetVersion) {
        if (domain == null) {
            return true;
        }
        if (!domain.equals(targetDomain)) {
            return false;
        }
        return versions.isEmpty() || versions.contains(targetVersion);
    }
}
