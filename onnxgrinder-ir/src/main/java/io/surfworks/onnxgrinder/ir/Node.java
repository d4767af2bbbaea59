package io.surfworks.onnxgrinder.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class of every IR node.
 *
 * <p>A node reads its arguments through {@link Input} edges and produces one or more
 * {@link Output} values. The display name is a human-readable label; it carries no
 * semantics and may be overwritten at any time.
 */
public abstract class Node {

    private final List<Input> inputs = new ArrayList<>();
    private final List<Output> outputs = new ArrayList<>();
    private String displayName = "";

    protected Node(List<Output> arguments) {
        for (int i = 0; i < arguments.size(); i++) {
            inputs.add(new Input(this, i, arguments.get(i)));
        }
    }

    /**
     * Operator type of this node, e.g. {@code "Parameter"} or {@code "Add"}.
     */
    public abstract String typeName();

    protected final Output addOutput(ElementType elementType, PartialShape shape) {
        Output output = new Output(this, outputs.size(), elementType, shape);
        outputs.add(output);
        return output;
    }

    public String displayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = Objects.requireNonNull(displayName, "displayName cannot be null");
    }

    public List<Input> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    public Input input(int index) {
        return inputs.get(index);
    }

    public int inputCount() {
        return inputs.size();
    }

    /**
     * Current sources of all inputs, in slot order.
     */
    public List<Output> inputValues() {
        List<Output> values = new ArrayList<>(inputs.size());
        for (Input input : inputs) {
            values.add(input.source());
        }
        return values;
    }

    public List<Output> outputs() {
        return Collections.unmodifiableList(outputs);
    }

    public Output output(int index) {
        return outputs.get(index);
    }

    public int outputCount() {
        return outputs.size();
    }

    /**
     * Disconnect all inputs from their sources. Used when a node is replaced and must stop
     * counting as a consumer.
     */
    public void detach() {
        for (Input input : inputs) {
            input.disconnect();
        }
    }

    @Override
    public String toString() {
        return typeName() + "[" + displayName + "]";
    }
}
