package io.surfworks.onnxgrinder.core.framework;

import io.surfworks.onnxgrinder.core.ConvertedSubgraph;
import io.surfworks.onnxgrinder.core.NodeConverter;
import io.surfworks.onnxgrinder.core.OnnxNode;
import io.surfworks.onnxgrinder.core.ops.OnnxModel;
import io.surfworks.onnxgrinder.ir.ElementType;
import io.surfworks.onnxgrinder.ir.Function;
import io.surfworks.onnxgrinder.ir.Node;
import io.surfworks.onnxgrinder.ir.Output;
import io.surfworks.onnxgrinder.ir.PartialShape;
import io.surfworks.onnxgrinder.model.NodeProto;

import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Placeholder for an ONNX node whose conversion is deferred.
 *
 * <p>The node keeps the source {@link NodeProto} and the model it belongs to, reads its
 * declared inputs and has one output of unknown type and shape per declared output.
 */
public class FrameworkNode extends Node {

    public static final String TYPE_NAME = "FrameworkNode";

    private final NodeProto proto;
    private final OnnxModel model;
    private final int declaredInputCount;

    public FrameworkNode(NodeProto proto, List<Output> inputs, OnnxModel model) {
        this(proto, inputs, inputs.size(), model);
    }

    protected FrameworkNode(NodeProto proto, List<Output> arguments, int declaredInputCount, OnnxModel model) {
        super(arguments);
        this.proto = proto;
        this.model = model;
        this.declaredInputCount = declaredInputCount;
        for (int i = 0; i < proto.outputs().size(); i++) {
            addOutput(ElementType.DYNAMIC, PartialShape.dynamic());
        }
    }

    @Override
    public String typeName() {
        return TYPE_NAME;
    }

    public NodeProto proto() {
        return proto;
    }

    public String opType() {
        return proto.opType();
    }

    public String domain() {
        return proto.domain();
    }

    public String operatorIdentifier() {
        return OnnxModel.operatorIdentifier(proto);
    }

    public OnnxModel model() {
        return model;
    }

    /**
     * Current sources of the inputs the source node declares.
     */
    public List<Output> declaredInputs() {
        return inputValues().subList(0, declaredInputCount);
    }

    /**
     * Run the real conversion of this node against its current inputs.
     *
     * @param bodyResolver resolves the framework nodes of a nested body
     */
    public List<Output> convert(UnaryOperator<Function> bodyResolver) {
        OnnxNode node = new OnnxNode(proto, declaredInputs(), resolveSubgraphs(bodyResolver));
        return NodeConverter.convert(model, node);
    }

    protected Map<String, ConvertedSubgraph> resolveSubgraphs(UnaryOperator<Function> bodyResolver) {
        return Map.of();
    }

    @Override
    public String toString() {
        return TYPE_NAME + "<" + operatorIdentifier() + ">[" + displayName() + "]";
    }
}
