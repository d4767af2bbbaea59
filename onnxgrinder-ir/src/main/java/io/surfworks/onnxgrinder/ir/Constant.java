package io.surfworks.onnxgrinder.ir;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;
import java.util.Objects;

/**
 * A node holding an immutable tensor value.
 *
 * <p>Data is stored little-endian, densely packed in row-major order.
 */
public final class Constant extends Node {

    private final byte[] data;

    public Constant(ElementType elementType, PartialShape shape, byte[] data) {
        super(List.of());
        Objects.requireNonNull(data, "data cannot be null");
        if (!elementType.hasFixedSize()) {
            throw new IllegalArgumentException("Constants need a fixed-size element type, got " + elementType);
        }
        if (!shape.isStatic()) {
            throw new IllegalArgumentException("Constants need a static shape, got " + shape);
        }
        long expected;
        try {
            expected = Math.multiplyExact(shape.elementCount(), (long) elementType.byteSize());
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Constant of " + elementType + shape + " is too large", e);
        }
        if (data.length != expected) {
            throw new IllegalArgumentException(
                    "Constant of " + elementType + shape + " needs " + expected + " bytes, got " + data.length);
        }
        this.data = data.clone();
        addOutput(elementType, shape);
    }

    /**
     * A scalar zero of the given type.
     */
    public static Constant zero(ElementType elementType) {
        return new Constant(elementType, PartialShape.scalar(), new byte[elementType.byteSize()]);
    }

    /**
     * Whether {@code value} is produced by a constant node.
     */
    public static boolean isConstant(Output value) {
        return value.node() instanceof Constant;
    }

    @Override
    public String typeName() {
        return "Constant";
    }

    public ElementType elementType() {
        return output(0).elementType();
    }

    public PartialShape shape() {
        return output(0).shape();
    }

    public int byteSize() {
        return data.length;
    }

    /**
     * Read-only little-endian view of the data.
     */
    public ByteBuffer data() {
        return ByteBuffer.wrap(data).asReadOnlyBuffer().order(ByteOrder.LITTLE_ENDIAN);
    }
}
