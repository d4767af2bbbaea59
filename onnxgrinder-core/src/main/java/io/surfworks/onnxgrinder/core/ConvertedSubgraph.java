package io.surfworks.onnxgrinder.core;

import io.surfworks.onnxgrinder.ir.Function;
import io.surfworks.onnxgrinder.ir.Output;

import java.util.List;

/**
 * A nested graph converted (or decoded) for its owning control-flow node.
 *
 * <p>{@code capturedValues.get(i)} is the enclosing-scope value bound to
 * {@code captureBindings.get(i).parameter()}. An operator factory feeds these values to the
 * node it builds so the body can be instantiated without converting it again.
 *
 * @param function        the body
 * @param captureBindings boundary parameters in creation order
 * @param capturedValues  enclosing-scope values, parallel to the bindings
 */
public record ConvertedSubgraph(Function function, List<CaptureBinding> captureBindings, List<Output> capturedValues) {

    public ConvertedSubgraph {
        captureBindings = List.copyOf(captureBindings);
        capturedValues = List.copyOf(capturedValues);
        if (captureBindings.size() != capturedValues.size()) {
            throw new IllegalArgumentException("Got " + captureBindings.size() + " capture bindings but "
                    + capturedValues.size() + " captured values");
        }
    }

    public boolean hasCaptures() {
        return !captureBindings.isEmpty();
    }
}
