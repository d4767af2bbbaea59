package io.surfworks.onnxgrinder.core;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One or more operators of a graph have no registered conversion.
 *
 * <p>Operators are identified as {@code domain.OpType}, or plain {@code OpType} for the
 * default domain. The message lists every distinct identifier in sorted order.
 */
public class UnsupportedOperatorException extends OnnxImportException {

    private final SortedSet<String> operators;

    public UnsupportedOperatorException(Collection<String> operators) {
        this(new TreeSet<>(operators));
    }

    private UnsupportedOperatorException(SortedSet<String> operators) {
        super("The following ONNX operations are not supported: " + String.join(", ", operators));
        this.operators = Collections.unmodifiableSortedSet(operators);
    }

    public SortedSet<String> getOperators() {
        return operators;
    }
}
