package io.surfworks.onnxgrinder.core.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.surfworks.onnxgrinder.ir.ElementType;
import io.surfworks.onnxgrinder.ir.Function;
import io.surfworks.onnxgrinder.ir.OpNode;
import io.surfworks.onnxgrinder.ir.Output;
import io.surfworks.onnxgrinder.ir.Parameter;
import io.surfworks.onnxgrinder.ir.PartialShape;
import io.surfworks.onnxgrinder.ir.SubgraphOpNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FunctionJsonTest {

    private static Function addRelu() {
        Parameter x = new Parameter(ElementType.F32, PartialShape.of(2));
        x.setDisplayName("x");
        x.output(0).setNames(Set.of("x"));
        OpNode add = OpNode.elementwise("Add", List.of(x.output(0), x.output(0)));
        add.setDisplayName("sum");
        OpNode relu = OpNode.elementwise("Relu", List.of(add.output(0)));
        relu.setDisplayName("y");
        relu.output(0).setNames(Set.of("y"));
        Function function = new Function(List.of(relu.output(0)), List.of(x), "g");
        function.result(0).setDisplayName("y/sink_port_0");
        return function;
    }

    @Test
    void treeListsNodesInTopologicalOrder() {
        JsonObject tree = FunctionJson.toTree(addRelu());

        assertEquals("g", tree.get("name").getAsString());
        assertEquals("x", tree.getAsJsonArray("parameters").get(0).getAsString());
        assertEquals("y/sink_port_0", tree.getAsJsonArray("results").get(0).getAsString());

        JsonArray nodes = tree.getAsJsonArray("nodes");
        assertEquals(4, nodes.size());
        assertEquals("Parameter", nodes.get(0).getAsJsonObject().get("type").getAsString());
        JsonObject add = nodes.get(1).getAsJsonObject();
        assertEquals("Add", add.get("type").getAsString());
        assertEquals("0:0", add.getAsJsonArray("inputs").get(1).getAsString());
        JsonObject output = add.getAsJsonArray("outputs").get(0).getAsJsonObject();
        assertEquals("f32", output.get("type").getAsString());
        assertEquals("[2]", output.get("shape").getAsString());
        assertEquals("Result", nodes.get(3).getAsJsonObject().get("type").getAsString());
    }

    @Test
    void identicalStructuresGiveIdenticalText() {
        assertEquals(FunctionJson.toJson(addRelu()), FunctionJson.toJson(addRelu()));
    }

    @Test
    void nestedBodiesAreInlined() {
        Parameter i = new Parameter(ElementType.F32, PartialShape.of(2));
        Function body = new Function(List.of(OpNode.elementwise("Relu", List.of(i.output(0))).output(0)), List.of(i), "body");
        Parameter m = new Parameter(ElementType.I64, PartialShape.scalar());
        Output loop = new SubgraphOpNode("Loop", List.of(m.output(0)), 1, List.of(body)).output(0);
        Function function = new Function(List.of(loop), List.of(m), "main");

        JsonObject tree = FunctionJson.toTree(function);

        JsonObject loopNode = tree.getAsJsonArray("nodes").get(1).getAsJsonObject();
        JsonArray subgraphs = loopNode.getAsJsonArray("subgraphs");
        assertEquals(1, subgraphs.size());
        assertEquals("body", subgraphs.get(0).getAsJsonObject().get("name").getAsString());
        assertTrue(FunctionJson.toJson(function).contains("\"Loop\""));
    }
}
