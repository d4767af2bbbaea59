package io.surfworks.onnxgrinder.core;

/**
 * A value name could not be resolved in the whole scope chain. Indicates a malformed graph,
 * typically one whose nodes are not in topological order.
 */
public class UnknownSymbolException extends OnnxImportException {

    private final String symbol;

    public UnknownSymbolException(String symbol) {
        super("Value '" + symbol + "' is not defined in this graph or any enclosing graph");
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
