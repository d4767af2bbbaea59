package io.surfworks.onnxgrinder.core;

import io.surfworks.onnxgrinder.ir.Output;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Values of one graph scope, keyed by ONNX value name. Re-inserting a name replaces the
 * previous binding.
 */
public final class GraphCache implements SymbolScope {

    private final Map<String, Output> values = new LinkedHashMap<>();

    @Override
    public boolean contains(String name) {
        return values.containsKey(name);
    }

    @Override
    public Output get(String name) {
        Output value = values.get(name);
        if (value == null) {
            throw new UnknownSymbolException(name);
        }
        return value;
    }

    public void put(String name, Output value) {
        values.put(name, value);
    }

    public void remove(String name) {
        values.remove(name);
    }

    /**
     * Bound names in first-insertion order.
     */
    public List<String> names() {
        return List.copyOf(values.keySet());
    }

    public int size() {
        return values.size();
    }
}
