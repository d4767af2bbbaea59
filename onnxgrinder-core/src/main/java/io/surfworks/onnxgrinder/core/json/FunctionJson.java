package io.surfworks.onnxgrinder.core.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.surfworks.onnxgrinder.core.framework.FrameworkNode;
import io.surfworks.onnxgrinder.ir.Function;
import io.surfworks.onnxgrinder.ir.Input;
import io.surfworks.onnxgrinder.ir.Node;
import io.surfworks.onnxgrinder.ir.Output;
import io.surfworks.onnxgrinder.ir.Parameter;
import io.surfworks.onnxgrinder.ir.Result;
import io.surfworks.onnxgrinder.ir.SubgraphOwner;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural JSON dump of a {@link Function}.
 *
 * <p>Nodes are numbered in topological order and edges refer to {@code node:output}
 * pairs, so two functions with the same structure and names produce the same text.
 * Nested bodies are dumped inline under their owner.
 */
public final class FunctionJson {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private FunctionJson() {}

    public static String toJson(Function function) {
        return GSON.toJson(toTree(function));
    }

    public static JsonObject toTree(Function function) {
        List<Node> nodes = function.orderedNodes();
        Map<Node, Integer> ids = new IdentityHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            ids.put(nodes.get(i), i);
        }

        JsonObject root = new JsonObject();
        root.addProperty("name", function.name());

        JsonArray parameters = new JsonArray();
        for (Parameter parameter : function.parameters()) {
            parameters.add(parameter.displayName());
        }
        root.add("parameters", parameters);

        JsonArray results = new JsonArray();
        for (Result result : function.results()) {
            results.add(result.displayName());
        }
        root.add("results", results);

        JsonArray nodeArray = new JsonArray();
        for (Node node : nodes) {
            nodeArray.add(nodeTree(node, ids));
        }
        root.add("nodes", nodeArray);
        return root;
    }

    private static JsonObject nodeTree(Node node, Map<Node, Integer> ids) {
        JsonObject obj = new JsonObject();
        obj.addProperty("id", ids.get(node));
        obj.addProperty("type", node.typeName());
        if (node instanceof FrameworkNode frameworkNode) {
            obj.addProperty("operator", frameworkNode.operatorIdentifier());
        }
        obj.addProperty("name", node.displayName());

        JsonArray inputs = new JsonArray();
        for (Input input : node.inputs()) {
            Output source = input.source();
            Integer producer = ids.get(source.node());
            // Sources outside the function body (e.g. values of an enclosing graph)
            inputs.add((producer == null ? "external" : producer.toString()) + ":" + source.index());
        }
        obj.add("inputs", inputs);

        JsonArray outputs = new JsonArray();
        for (Output output : node.outputs()) {
            JsonObject out = new JsonObject();
            out.addProperty("type", output.elementType().typeName());
            out.addProperty("shape", output.shape().toString());
            JsonArray names = new JsonArray();
            output.names().stream().sorted().forEach(names::add);
            out.add("names", names);
            outputs.add(out);
        }
        obj.add("outputs", outputs);

        if (node instanceof SubgraphOwner owner) {
            JsonArray bodies = new JsonArray();
            for (Function body : owner.subgraphFunctions()) {
                bodies.add(toTree(body));
            }
            obj.add("subgraphs", bodies);
        }
        return obj;
    }
}
