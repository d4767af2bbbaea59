package io.surfworks.onnxgrinder.ir;

import java.util.List;

/**
 * Control-flow operation (loop, conditional) carrying one or more nested bodies.
 */
public class SubgraphOpNode extends OpNode implements SubgraphOwner {

    private final List<Function> bodies;

    public SubgraphOpNode(String opType, List<Output> arguments, int outputCount, List<Function> bodies) {
        super(opType, arguments, outputCount);
        this.bodies = List.copyOf(bodies);
    }

    @Override
    public List<Function> subgraphFunctions() {
        return bodies;
    }
}
