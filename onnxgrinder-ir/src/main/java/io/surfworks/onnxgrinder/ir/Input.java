package io.surfworks.onnxgrinder.ir;

import java.util.Objects;

/**
 * A consuming edge: input slot {@code index} of {@code node}, reading from a source output.
 */
public final class Input {

    private final Node node;
    private final int index;
    private Output source;

    Input(Node node, int index, Output source) {
        this.node = node;
        this.index = index;
        this.source = Objects.requireNonNull(source, "source cannot be null");
        source.addTarget(this);
    }

    public Node node() {
        return node;
    }

    public int index() {
        return index;
    }

    public Output source() {
        return source;
    }

    /**
     * Read from {@code newSource} instead of the current source.
     */
    public void replaceSourceOutput(Output newSource) {
        Objects.requireNonNull(newSource, "newSource cannot be null");
        if (newSource == source) {
            return;
        }
        source.removeTarget(this);
        source = newSource;
        newSource.addTarget(this);
    }

    void disconnect() {
        source.removeTarget(this);
    }

    @Override
    public String toString() {
        return node.typeName() + "[" + node.displayName() + "].in" + index + " <- " + source;
    }
}
