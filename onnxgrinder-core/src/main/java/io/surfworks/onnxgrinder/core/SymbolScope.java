package io.surfworks.onnxgrinder.core;

import io.surfworks.onnxgrinder.ir.Output;

/**
 * Name lookup contract shared by every scope level.
 */
public interface SymbolScope {

    boolean contains(String name);

    /**
     * @throws UnknownSymbolException if the name is not bound in this scope or its ancestors
     */
    Output get(String name);
}
