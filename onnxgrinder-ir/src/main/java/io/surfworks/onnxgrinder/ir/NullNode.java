package io.surfworks.onnxgrinder.ir;

import java.util.List;

/**
 * Marker for an absent optional value. It has one output that carries no tensor identity
 * and is never a function output.
 */
public final class NullNode extends Node {

    public NullNode() {
        super(List.of());
        addOutput(ElementType.DYNAMIC, PartialShape.dynamic());
    }

    public static Output create() {
        return new NullNode().output(0);
    }

    public static boolean isNull(Output value) {
        return value.node() instanceof NullNode;
    }

    @Override
    public String typeName() {
        return "NullNode";
    }
}
