package io.surfworks.onnxgrinder.ir;

import java.util.List;

/**
 * Sink node marking one output of a {@link Function}.
 */
public final class Result extends Node {

    public Result(Output value) {
        super(List.of(value));
    }

    @Override
    public String typeName() {
        return "Result";
    }

    /**
     * The value this result exposes.
     */
    public Output value() {
        return input(0).source();
    }
}
