package io.surfworks.onnxgrinder.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Generic operation node produced by operator factories.
 *
 * <p>Outputs start with a dynamic type and shape; factories that know better set them
 * through {@link Output#setElementType} and {@link Output#setShape}.
 */
public class OpNode extends Node {

    private final String opType;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public OpNode(String opType, List<Output> arguments, int outputCount) {
        super(arguments);
        this.opType = Objects.requireNonNull(opType, "opType cannot be null");
        for (int i = 0; i < outputCount; i++) {
            addOutput(ElementType.DYNAMIC, PartialShape.dynamic());
        }
    }

    /**
     * Single-output operation whose result has the type and shape of its first argument.
     */
    public static OpNode elementwise(String opType, List<Output> arguments) {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException(opType + " needs at least one argument");
        }
        OpNode node = new OpNode(opType, arguments, 1);
        node.output(0).setElementType(arguments.get(0).elementType());
        node.output(0).setShape(arguments.get(0).shape());
        return node;
    }

    @Override
    public String typeName() {
        return opType;
    }

    public Map<String, Object> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public OpNode setAttribute(String name, Object value) {
        attributes.put(name, value);
        return this;
    }
}
