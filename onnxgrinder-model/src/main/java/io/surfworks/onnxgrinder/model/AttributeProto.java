package io.surfworks.onnxgrinder.model;

import java.util.List;
import java.util.Objects;

/**
 * Node attribute. Only the field selected by {@code type} is meaningful.
 */
public record AttributeProto(
        String name,
        Type type,
        float f,
        long i,
        String s,
        TensorProto t,
        GraphProto g,
        List<Float> floats,
        List<Long> ints,
        List<String> strings,
        List<GraphProto> graphs
) {

    /**
     * Attribute types with their onnx.proto codes.
     */
    public enum Type {
        UNDEFINED(0),
        FLOAT(1),
        INT(2),
        STRING(3),
        TENSOR(4),
        GRAPH(5),
        FLOATS(6),
        INTS(7),
        STRINGS(8),
        TENSORS(9),
        GRAPHS(10);

        private final int code;

        Type(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }

        public static Type fromCode(int code) {
            for (Type type : values()) {
                if (type.code == code) {
                    return type;
                }
            }
            return UNDEFINED;
        }
    }

    public AttributeProto {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        s = s == null ? "" : s;
        floats = floats == null ? List.of() : List.copyOf(floats);
        ints = ints == null ? List.of() : List.copyOf(ints);
        strings = strings == null ? List.of() : List.copyOf(strings);
        graphs = graphs == null ? List.of() : List.copyOf(graphs);
    }

    public static AttributeProto ofFloat(String name, float value) {
        return new AttributeProto(name, Type.FLOAT, value, 0, null, null, null, null, null, null, null);
    }

    public static AttributeProto ofInt(String name, long value) {
        return new AttributeProto(name, Type.INT, 0f, value, null, null, null, null, null, null, null);
    }

    public static AttributeProto ofString(String name, String value) {
        return new AttributeProto(name, Type.STRING, 0f, 0, value, null, null, null, null, null, null);
    }

    public static AttributeProto ofTensor(String name, TensorProto value) {
        return new AttributeProto(name, Type.TENSOR, 0f, 0, null, value, null, null, null, null, null);
    }

    public static AttributeProto ofGraph(String name, GraphProto value) {
        return new AttributeProto(name, Type.GRAPH, 0f, 0, null, null, value, null, null, null, null);
    }

    public static AttributeProto ofInts(String name, List<Long> values) {
        return new AttributeProto(name, Type.INTS, 0f, 0, null, null, null, null, values, null, null);
    }

    public boolean isGraph() {
        return type == Type.GRAPH && g != null;
    }
}
