package io.surfworks.onnxgrinder.ir;

import java.util.List;

/**
 * A formal input of a {@link Function}: a node with no data producer.
 */
public final class Parameter extends Node {

    public Parameter(ElementType elementType, PartialShape shape) {
        super(List.of());
        addOutput(elementType, shape);
    }

    @Override
    public String typeName() {
        return "Parameter";
    }

    public ElementType elementType() {
        return output(0).elementType();
    }

    public void setElementType(ElementType elementType) {
        output(0).setElementType(elementType);
    }

    public PartialShape shape() {
        return output(0).shape();
    }

    public void setPartialShape(PartialShape shape) {
        output(0).setShape(shape);
    }
}
