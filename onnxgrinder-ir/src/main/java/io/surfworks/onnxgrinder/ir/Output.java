package io.surfworks.onnxgrinder.ir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A value produced by a node: the unit of connection in the IR graph.
 *
 * <p>Each output has exactly one producing node, an element type, a partial shape, a set of
 * tensor names and zero or more consuming {@link Input} edges. Outputs are compared by
 * identity.
 */
public final class Output {

    private final Node node;
    private final int index;
    private ElementType elementType;
    private PartialShape shape;
    private final Set<String> names = new LinkedHashSet<>();
    private final List<Input> targets = new ArrayList<>();

    Output(Node node, int index, ElementType elementType, PartialShape shape) {
        this.node = node;
        this.index = index;
        this.elementType = Objects.requireNonNull(elementType, "elementType cannot be null");
        this.shape = Objects.requireNonNull(shape, "shape cannot be null");
    }

    /**
     * The producing node.
     */
    public Node node() {
        return node;
    }

    /**
     * Position of this output among the producing node's outputs.
     */
    public int index() {
        return index;
    }

    public ElementType elementType() {
        return elementType;
    }

    public void setElementType(ElementType elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType cannot be null");
    }

    public PartialShape shape() {
        return shape;
    }

    public void setShape(PartialShape shape) {
        this.shape = Objects.requireNonNull(shape, "shape cannot be null");
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(names);
    }

    /**
     * Replace all tensor names of this value.
     */
    public void setNames(Collection<String> newNames) {
        names.clear();
        names.addAll(newNames);
    }

    public void addNames(Collection<String> newNames) {
        names.addAll(newNames);
    }

    public boolean hasName(String name) {
        return names.contains(name);
    }

    /**
     * Edges currently reading from this value, in connection order.
     */
    public List<Input> targetInputs() {
        return List.copyOf(targets);
    }

    /**
     * Redirect every consumer of this value to {@code replacement}.
     */
    public void replaceAllUses(Output replacement) {
        for (Input target : List.copyOf(targets)) {
            target.replaceSourceOutput(replacement);
        }
    }

    void addTarget(Input input) {
        targets.add(input);
    }

    void removeTarget(Input input) {
        targets.remove(input);
    }

    @Override
    public String toString() {
        return node.typeName() + "[" + node.displayName() + "]:" + index + " " + elementType + shape;
    }
}
