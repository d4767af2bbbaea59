package io.surfworks.onnxgrinder.core;

import io.surfworks.onnxgrinder.ir.Parameter;

import java.util.Objects;

/**
 * A boundary parameter of a subgraph and the enclosing-scope name it stands for.
 *
 * @param parameter  the synthesized subgraph parameter
 * @param parentName name of the captured value in the enclosing scope chain
 */
public record CaptureBinding(Parameter parameter, String parentName) {

    public CaptureBinding {
        Objects.requireNonNull(parameter, "parameter cannot be null");
        Objects.requireNonNull(parentName, "parentName cannot be null");
    }
}
