package io.surfworks.onnxgrinder.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A dataflow graph: nodes in topological order, initializers, declared inputs and outputs.
 */
public record GraphProto(
        String name,
        List<NodeProto> nodes,
        List<TensorProto> initializers,
        List<ValueInfoProto> inputs,
        List<ValueInfoProto> outputs,
        List<ValueInfoProto> valueInfos
) {

    public GraphProto {
        name = name == null ? "" : name;
        nodes = List.copyOf(nodes);
        initializers = List.copyOf(initializers);
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        valueInfos = List.copyOf(valueInfos);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public List<String> outputNames() {
        return outputs.stream().map(ValueInfoProto::name).toList();
    }

    /**
     * Fluent builder, mostly for assembling graphs in code.
     */
    public static final class Builder {
        private final String name;
        private final List<NodeProto> nodes = new ArrayList<>();
        private final List<TensorProto> initializers = new ArrayList<>();
        private final List<ValueInfoProto> inputs = new ArrayList<>();
        private final List<ValueInfoProto> outputs = new ArrayList<>();
        private final List<ValueInfoProto> valueInfos = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name cannot be null");
        }

        public Builder node(NodeProto node) {
            nodes.add(node);
            return this;
        }

        public Builder initializer(TensorProto tensor) {
            initializers.add(tensor);
            return this;
        }

        public Builder input(ValueInfoProto input) {
            inputs.add(input);
            return this;
        }

        public Builder output(ValueInfoProto output) {
            outputs.add(output);
            return this;
        }

        public Builder output(String outputName) {
            return output(ValueInfoProto.untyped(outputName));
        }

        public Builder valueInfo(ValueInfoProto info) {
            valueInfos.add(info);
            return this;
        }

        public GraphProto build() {
            return new GraphProto(name, nodes, initializers, inputs, outputs, valueInfos);
        }
    }
}
