package io.surfworks.onnxgrinder.ir;

import java.util.List;

/**
 * Implemented by nodes that carry nested function bodies, such as loops and conditionals.
 * Such nodes may read values captured by their bodies as extra inputs.
 */
public interface SubgraphOwner {

    List<Function> subgraphFunctions();
}
