package io.surfworks.graphmatch.graph;

/**
 * A named value flowing along a dataflow edge: %x, %weight, %3.
 *
 * <p>Arguments are identified by name within one graph. Type information is
 * optional; when the producer of a graph does not know it, {@code elementType}
 * is null and {@code rank} is {@link #UNKNOWN_RANK}.
 *
 * @param name the argument name, unique within its graph
 * @param elementType element type such as "f32" or "i64", or null if unknown
 * @param rank tensor rank, or {@link #UNKNOWN_RANK}
 */
public record NodeArg(String name, String elementType, int rank) {

    public static final int UNKNOWN_RANK = -1;

    public NodeArg {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Argument name must not be empty");
        }
        if (rank < UNKNOWN_RANK) {
            throw new IllegalArgumentException("Invalid rank " + rank + " for argument '" + name + "'");
        }
    }

    /**
     * Creates an argument with no type information.
     */
    public static NodeArg untyped(String name) {
        return new NodeArg(name, null, UNKNOWN_RANK);
    }

    public boolean hasElementType() {
        return elementType != null;
    }

    public boolean hasRank() {
        return rank != UNKNOWN_RANK;
    }

    @Override
    public String toString() {
        if (!hasElementType() && !hasRank()) {
            return "%" + name;
        }
        return "%" + name + ":" + (hasElementType() ? elementType : "?") + "[rank=" + (hasRank() ? rank : "?") + "]";
    }
}
