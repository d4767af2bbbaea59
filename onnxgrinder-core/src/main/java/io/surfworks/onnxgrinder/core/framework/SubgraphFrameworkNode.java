package io.surfworks.onnxgrinder.core.framework;

import io.surfworks.onnxgrinder.core.ConvertedSubgraph;
import io.surfworks.onnxgrinder.core.ops.OnnxModel;
import io.surfworks.onnxgrinder.ir.Function;
import io.surfworks.onnxgrinder.ir.Output;
import io.surfworks.onnxgrinder.ir.Parameter;
import io.surfworks.onnxgrinder.ir.SubgraphOwner;
import io.surfworks.onnxgrinder.model.NodeProto;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Framework node of a control-flow operator.
 *
 * <p>The values captured by the decoded bodies are appended to the declared inputs, each
 * value once, so that the enclosing graph sees them as ordinary consumers. The position of
 * every captured value is remembered; when the node is converted the bodies receive the
 * values those positions read at that time.
 */
public final class SubgraphFrameworkNode extends FrameworkNode implements SubgraphOwner {

    private final Map<String, ConvertedSubgraph> subgraphs;
    private final Map<String, int[]> captureIndices = new LinkedHashMap<>();

    public SubgraphFrameworkNode(NodeProto proto, List<Output> inputs, OnnxModel model,
                                 Map<String, ConvertedSubgraph> subgraphs) {
        super(proto, withCaptures(inputs, subgraphs), inputs.size(), model);
        this.subgraphs = new LinkedHashMap<>(subgraphs);
        List<Output> arguments = inputValues();
        for (Map.Entry<String, ConvertedSubgraph> entry : subgraphs.entrySet()) {
            List<Output> captured = entry.getValue().capturedValues();
            int[] indices = new int[captured.size()];
            for (int i = 0; i < indices.length; i++) {
                indices[i] = indexOf(arguments, captured.get(i));
            }
            captureIndices.put(entry.getKey(), indices);
        }
    }

    private static List<Output> withCaptures(List<Output> inputs, Map<String, ConvertedSubgraph> subgraphs) {
        List<Output> arguments = new ArrayList<>(inputs);
        for (ConvertedSubgraph subgraph : subgraphs.values()) {
            for (Output value : subgraph.capturedValues()) {
                if (indexOf(arguments, value) < 0) {
                    arguments.add(value);
                }
            }
        }
        return arguments;
    }

    private static int indexOf(List<Output> values, Output value) {
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == value) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public List<Function> subgraphFunctions() {
        return subgraphs.values().stream().map(ConvertedSubgraph::function).toList();
    }

    public Map<String, ConvertedSubgraph> subgraphs() {
        return Map.copyOf(subgraphs);
    }

    @Override
    protected Map<String, ConvertedSubgraph> resolveSubgraphs(UnaryOperator<Function> bodyResolver) {
        Map<String, ConvertedSubgraph> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, ConvertedSubgraph> entry : subgraphs.entrySet()) {
            ConvertedSubgraph decoded = entry.getValue();
            int[] indices = captureIndices.get(entry.getKey());
            List<Output> captured = new ArrayList<>(indices.length);
            for (int i = 0; i < indices.length; i++) {
                Output value = input(indices[i]).source();
                // Captured values were still untyped framework outputs when the body was decoded
                Parameter boundary = decoded.captureBindings().get(i).parameter();
                boundary.setElementType(value.elementType());
                boundary.setPartialShape(value.shape());
                captured.add(value);
            }
            Function body = bodyResolver.apply(decoded.function());
            resolved.put(entry.getKey(), new ConvertedSubgraph(body, decoded.captureBindings(), captured));
        }
        return resolved;
    }
}
