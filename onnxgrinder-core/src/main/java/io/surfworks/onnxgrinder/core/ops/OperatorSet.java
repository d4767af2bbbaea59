package io.surfworks.onnxgrinder.core.ops;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The factories of one domain at one opset version.
 */
public final class OperatorSet {

    private final String domain;
    private final long version;
    private final Map<String, OperatorFactory> factories;

    OperatorSet(String domain, long version, Map<String, OperatorFactory> factories) {
        this.domain = domain;
        this.version = version;
        this.factories = Map.copyOf(factories);
    }

    public String domain() {
        return domain;
    }

    public long version() {
        return version;
    }

    public boolean contains(String opType) {
        return factories.containsKey(opType);
    }

    public Optional<OperatorFactory> get(String opType) {
        return Optional.ofNullable(factories.get(opType));
    }

    public Set<String> opTypes() {
        return factories.keySet();
    }

    @Override
    public String toString() {
        return "OperatorSet[" + (domain.isEmpty() ? "ai.onnx" : domain) + " v" + version
                + ", " + factories.size() + " operators]";
    }
}
