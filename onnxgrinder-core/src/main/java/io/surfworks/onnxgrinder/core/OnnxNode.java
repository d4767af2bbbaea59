package io.surfworks.onnxgrinder.core;

import io.surfworks.onnxgrinder.model.AttributeProto;
import io.surfworks.onnxgrinder.model.NodeProto;
import io.surfworks.onnxgrinder.ir.NullNode;
import io.surfworks.onnxgrinder.ir.Output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An ONNX node as seen by an operator factory: the source node, its inputs resolved to IR
 * values and its nested graphs already converted.
 *
 * <p>An input with an empty name is a skipped optional input and resolves to a null value
 * (see {@link NullNode}).
 */
public final class OnnxNode {

    private final NodeProto proto;
    private final List<Output> inputs;
    private final Map<String, ConvertedSubgraph> subgraphs;

    public OnnxNode(NodeProto proto, List<Output> inputs, Map<String, ConvertedSubgraph> subgraphs) {
        this.proto = proto;
        this.inputs = List.copyOf(inputs);
        this.subgraphs = Collections.unmodifiableMap(new LinkedHashMap<>(subgraphs));
    }

    /**
     * Resolve the node's input names through {@code scope}.
     *
     * @throws UnknownSymbolException if a non-empty input name is not bound
     */
    public static OnnxNode resolve(NodeProto proto, SymbolScope scope, Map<String, ConvertedSubgraph> subgraphs) {
        List<Output> values = new ArrayList<>(proto.inputs().size());
        for (String name : proto.inputs()) {
            values.add(name.isEmpty() ? NullNode.create() : scope.get(name));
        }
        return new OnnxNode(proto, values, subgraphs);
    }

    public NodeProto proto() {
        return proto;
    }

    public String name() {
        return proto.name();
    }

    public String domain() {
        return proto.domain();
    }

    public String opType() {
        return proto.opType();
    }

    public List<String> outputNames() {
        return proto.outputs();
    }

    public int declaredOutputCount() {
        return proto.outputs().size();
    }

    public List<Output> inputs() {
        return inputs;
    }

    public Output input(int index) {
        if (index >= inputs.size()) {
            throw new NodeValidationException(this,
                    "Input " + index + " requested but the node has " + inputs.size() + " inputs");
        }
        return inputs.get(index);
    }

    public int inputCount() {
        return inputs.size();
    }

    /**
     * Whether input {@code index} is present and not a skipped optional input.
     */
    public boolean hasInput(int index) {
        return index < inputs.size() && !NullNode.isNull(inputs.get(index));
    }

    public Map<String, ConvertedSubgraph> subgraphs() {
        return subgraphs;
    }

    /**
     * The converted nested graph of attribute {@code attributeName}.
     *
     * @throws NodeValidationException if the node has no such graph attribute
     */
    public ConvertedSubgraph subgraph(String attributeName) {
        ConvertedSubgraph subgraph = subgraphs.get(attributeName);
        if (subgraph == null) {
            throw new NodeValidationException(this, "Missing graph attribute '" + attributeName + "'");
        }
        return subgraph;
    }

    public boolean hasAttribute(String attributeName) {
        return proto.attribute(attributeName).isPresent();
    }

    public Optional<AttributeProto> attribute(String attributeName) {
        return proto.attribute(attributeName);
    }

    public long attributeInt(String attributeName, long defaultValue) {
        return proto.attribute(attributeName).map(AttributeProto::i).orElse(defaultValue);
    }

    public float attributeFloat(String attributeName, float defaultValue) {
        return proto.attribute(attributeName).map(AttributeProto::f).orElse(defaultValue);
    }

    public String attributeString(String attributeName, String defaultValue) {
        return proto.attribute(attributeName).map(AttributeProto::s).orElse(defaultValue);
    }

    public List<Long> attributeInts(String attributeName) {
        return proto.attribute(attributeName).map(AttributeProto::ints).orElse(List.of());
    }

    /**
     * Context prefix for error messages about this node.
     */
    public String errorPrefix() {
        return "While validating ONNX node '" + this + "'";
    }

    @Override
    public String toString() {
        String type = domain().isEmpty() ? opType() : domain() + "." + opType();
        return "<Node(" + type + "): " + (name().isEmpty() ? "-" : name()) + ">";
    }
}
