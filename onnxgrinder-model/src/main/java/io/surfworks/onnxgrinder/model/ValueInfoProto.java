package io.surfworks.onnxgrinder.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declared graph input or output: name, element type and (possibly partial) shape.
 *
 * @param name     value name
 * @param elemType ONNX data type code, {@link OnnxDataType#UNDEFINED} if not declared
 * @param shape    dimensions, or null when the rank is unknown
 */
public record ValueInfoProto(
        String name,
        int elemType,
        List<Dimension> shape
) {

    public ValueInfoProto {
        Objects.requireNonNull(name, "name cannot be null");
        shape = shape == null ? null : List.copyOf(shape);
    }

    /**
     * A tensor value; negative dimensions become unnamed dynamic dimensions.
     */
    public static ValueInfoProto tensor(String name, int elemType, long... dims) {
        List<Dimension> shape = new ArrayList<>(dims.length);
        for (long d : dims) {
            shape.add(d < 0 ? Dimension.param("") : Dimension.of(d));
        }
        return new ValueInfoProto(name, elemType, shape);
    }

    /**
     * A value with neither type nor shape; typical for declared graph outputs.
     */
    public static ValueInfoProto untyped(String name) {
        return new ValueInfoProto(name, OnnxDataType.UNDEFINED, null);
    }

    public boolean hasShape() {
        return shape != null;
    }

    /**
     * A single dimension: either a concrete value or a symbolic parameter.
     */
    public record Dimension(Long value, String param) {

        public static Dimension of(long value) {
            return new Dimension(value, null);
        }

        public static Dimension param(String param) {
            return new Dimension(null, param);
        }

        public boolean isKnown() {
            return value != null;
        }
    }
}
