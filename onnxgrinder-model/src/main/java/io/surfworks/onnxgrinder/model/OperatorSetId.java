package io.surfworks.onnxgrinder.model;

import java.util.Objects;

/**
 * Operator set import: a domain and the opset version the model was written against.
 * The empty domain is the default ONNX domain.
 */
public record OperatorSetId(String domain, long version) {

    public OperatorSetId {
        Objects.requireNonNull(domain, "domain cannot be null");
    }

    public static OperatorSetId defaultDomain(long version) {
        return new OperatorSetId("", version);
    }
}
