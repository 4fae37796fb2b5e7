package io.surfworks.graphmatch.json;

import java.io.Reader;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import com.google.gson.JsonObject;

import io.surfworks.graphmatch.pattern.PatternGraph;
import io.surfworks.graphmatch.pattern.PatternGraphException;
import io.surfworks.graphmatch.pattern.PatternInputArg;
import io.surfworks.graphmatch.pattern.PatternNode;

/**
 * Reads a pattern definition from JSON.
 *
 * <p>Document layout:
 * <pre>{@code
 * {
 *   "name": "bias_gelu",
 *   "inputs": [ {"name": "x"}, {"name": "bias", "types": ["f16", "f32"], "ranks": [1]} ],
 *   "nodes": [
 *     {"name": "add", "opTypes": ["Add"], "inputs": ["x", "bias"], "outputs": ["y"]},
 *     {"name": "gelu", "opTypes": ["Gelu"], "domain": "com.microsoft", "versions": [1],
 *      "inputs": ["y"], "outputs": ["out"], "outputEdges": 0}
 *   ]
 * }
 * }</pre>
 * An absent or empty {@code opTypes} makes the node a wildcard; an absent
 * {@code domain} skips the domain and version check.
 *
 * <p>Custom constraints cannot be expressed in JSON. Use
 * {@link #readBuilder(Reader)} to obtain the populated builder and register
 * them before building.
 */
public final class PatternGraphJsonReader {

    private static final Logger LOG = Logger.getLogger(PatternGraphJsonReader.class.getName());

    private PatternGraphJsonReader() {}

    public static PatternGraph read(Reader reader) {
        return build(readBuilder(reader));
    }

    public static PatternGraph read(Path path) {
        return build(toBuilder(JsonDocuments.parse(path)));
    }

    public static PatternGraph fromString(String json) {
        return build(toBuilder(JsonDocuments.parse(json)));
    }

    /**
     * Reads the declarations without building, so constraints can still be added.
     */
    public static PatternGraph.Builder readBuilder(Reader reader) {
        return toBuilder(JsonDocuments.parse(reader));
    }

    static PatternGraph.Builder toBuilder(JsonObject root) {
        String name = JsonFields.requireString(root, "name", "$");
        PatternGraph.Builder builder = PatternGraph.builder(name);

        List<JsonObject> inputs = JsonFields.objectList(root, "inputs", "$");
        for (int i = 0; i < inputs.size(); i++) {
            String path = "$.inputs[" + i + "]";
            JsonObject input = inputs.get(i);
            try {
                builder.input(new PatternInputArg(
                        JsonFields.requireString(input, "name", path),
                        JsonFields.stringSet(input, "types", path),
                        Set.copyOf(JsonFields.intList(input, "ranks", path))));
            } catch (PatternGraphException e) {
                throw new GraphDefinitionException(e.getMessage(), path);
            }
        }

        List<JsonObject> nodes = JsonFields.objectList(root, "nodes", "$");
        for (int i = 0; i < nodes.size(); i++) {
            String path = "$.nodes[" + i + "]";
            JsonObject node = nodes.get(i);
            try {
                builder.node(new PatternNode(
                        JsonFields.requireString(node, "name", path),
                        JsonFields.stringSet(node, "opTypes", path),
                        JsonFields.optionalString(node, "domain", null, path),
                        JsonFields.intList(node, "versions", path),
                        JsonFields.stringList(node, "inputs", path),
                        JsonFields.stringList(node, "outputs", path),
                        JsonFields.optionalInt(node, "outputEdges", PatternNode.DERIVE_OUTPUT_EDGES, path)));
            } catch (PatternGraphException e) {
                throw new GraphDefinitionException(e.getMessage(), path);
            }
        }

        LOG.fine(() -> "Read pattern '" + name + "' with " + nodes.size() + " nodes and "
                + inputs.size() + " inputs");
        return builder;
    }

    private static PatternGraph build(PatternGraph.Builder builder) {
        try {
            return builder.build();
        } catch (PatternGraphException e) {
            throw new GraphDefinitionException(e.getMessage(), "$");
        }
    }
}
