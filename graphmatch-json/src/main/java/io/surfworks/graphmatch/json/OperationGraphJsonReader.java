package io.surfworks.graphmatch.json;

import java.io.Reader;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

import com.google.gson.JsonObject;

import io.surfworks.graphmatch.graph.Node;
import io.surfworks.graphmatch.graph.NodeArg;
import io.surfworks.graphmatch.graph.OperationGraph;

/**
 * Reads a dataflow graph from JSON.
 *
 * <p>Document layout:
 * <pre>{@code
 * {
 *   "name": "mlp",
 *   "args": [ {"name": "x", "type": "f32", "rank": 2} ],
 *   "nodes": [
 *     {"name": "mm", "opType": "MatMul", "inputs": ["x", "w"], "outputs": ["xw"]},
 *     {"name": "act", "opType": "Relu", "domain": "", "version": 14,
 *      "inputs": ["xw"], "outputs": ["y"]}
 *   ]
 * }
 * }</pre>
 * {@code args} only carries type information; nodes may refer to arguments
 * that are not listed there.
 */
public final class OperationGraphJsonReader {

    private static final Logger LOG = Logger.getLogger(OperationGraphJsonReader.class.getName());

    private OperationGraphJsonReader() {}

    public static OperationGraph read(Reader reader) {
        return fromJson(JsonDocuments.parse(reader));
    }

    public static OperationGraph read(Path path) {
        return fromJson(JsonDocuments.parse(path));
    }

    public static OperationGraph fromString(String json) {
        return fromJson(JsonDocuments.parse(json));
    }

    static OperationGraph fromJson(JsonObject root) {
        String name = JsonFields.requireString(root, "name", "$");
        OperationGraph.Builder builder = OperationGraph.builder(name);

        List<JsonObject> args = JsonFields.objectList(root, "args", "$");
        for (int i = 0; i < args.size(); i++) {
            String path = "$.args[" + i + "]";
            JsonObject arg = args.get(i);
            try {
                builder.declareArg(
                        JsonFields.requireString(arg, "name", path),
                        JsonFields.optionalString(arg, "type", null, path),
                        JsonFields.optionalInt(arg, "rank", NodeArg.UNKNOWN_RANK, path));
            } catch (IllegalArgumentException e) {
                throw new GraphDefinitionException(e.getMessage(), path);
            }
        }

        List<JsonObject> nodes = JsonFields.objectList(root, "nodes", "$");
        for (int i = 0; i < nodes.size(); i++) {
            String path = "$.nodes[" + i + "]";
            JsonObject node = nodes.get(i);
            try {
                builder.addNode(
                        JsonFields.requireString(node, "name", path),
                        JsonFields.requireString(node, "opType", path),
                        JsonFields.optionalString(node, "domain", Node.DEFAULT_DOMAIN, path),
                        JsonFields.optionalInt(node, "version", 1, path),
                        JsonFields.stringList(node, "inputs", path),
                        JsonFields.stringList(node, "outputs", path));
            } catch (IllegalArgumentException e) {
                throw new GraphDefinitionException(e.getMessage(), path);
            }
        }

        OperationGraph graph;
        try {
            graph = builder.build();
        } catch (IllegalArgumentException e) {
            throw new GraphDefinitionException(e.getMessage(), "$");
        }
        LOG.fine(() -> "Read graph '" + name + "' with " + nodes.size() + " nodes");
        return graph;
    }
}
