package io.surfworks.onnxgrinder.core.ops;

import io.surfworks.onnxgrinder.core.UnsupportedOperatorException;
import io.surfworks.onnxgrinder.model.NodeProto;
import io.surfworks.onnxgrinder.model.OperatorSetId;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Binds a graph to the operator sets it imports and resolves its nodes to factories.
 *
 * <p>Domains that the model uses without importing them can be enabled afterwards with
 * {@link #enableOpsetDomain(String)}; they get the latest version the registry knows.
 */
public final class OnnxModel {

    private static final Logger LOG = Logger.getLogger(OnnxModel.class.getName());

    private final OperatorRegistry registry;
    private final List<OperatorSetId> opsetImports;
    private final Map<String, OperatorSet> opsets = new HashMap<>();

    public OnnxModel(List<OperatorSetId> opsetImports, OperatorRegistry registry) {
        this.registry = registry;
        this.opsetImports = List.copyOf(opsetImports);
        for (OperatorSetId id : opsetImports) {
            registry.ensureDomain(id.domain());
            opsets.put(OperatorRegistry.normalizeDomain(id.domain()), registry.operatorSet(id.domain(), id.version()));
        }
    }

    /**
     * Identifier of a node's operator: {@code domain.OpType}, or {@code OpType} in the
     * default domain.
     */
    public static String operatorIdentifier(String domain, String opType) {
        String key = OperatorRegistry.normalizeDomain(domain);
        return (key.isEmpty() ? "" : key + ".") + opType;
    }

    public static String operatorIdentifier(NodeProto node) {
        return operatorIdentifier(node.domain(), node.opType());
    }

    public List<OperatorSetId> opsetImports() {
        return opsetImports;
    }

    public OperatorRegistry registry() {
        return registry;
    }

    /**
     * Domains currently bound, imported or enabled.
     */
    public Set<String> enabledDomains() {
        return Set.copyOf(opsets.keySet());
    }

    public boolean isOperatorAvailable(NodeProto node) {
        OperatorSet set = opsets.get(OperatorRegistry.normalizeDomain(node.domain()));
        return set != null && set.contains(node.opType());
    }

    /**
     * Bind {@code domain} at the registry's latest version if it is not bound yet.
     * Does nothing, apart from logging, when no operator of the domain is registered.
     */
    public void enableOpsetDomain(String domain) {
        String key = OperatorRegistry.normalizeDomain(domain);
        if (opsets.containsKey(key)) {
            return;
        }
        if (!registry.ensureDomain(key)) {
            LOG.warning("Domain '" + key + "' is not imported by the model and no operator provider registers it");
            return;
        }
        OptionalLong latest = registry.latestVersion(key);
        if (latest.isPresent()) {
            opsets.put(key, registry.operatorSet(key, latest.getAsLong()));
            LOG.fine("Enabled domain '" + key + "' at version " + latest.getAsLong());
        }
    }

    /**
     * @throws UnsupportedOperatorException if the operator is not bound
     */
    public OperatorFactory getOperator(String opType, String domain) {
        OperatorSet set = opsets.get(OperatorRegistry.normalizeDomain(domain));
        if (set == null) {
            throw new UnsupportedOperatorException(List.of(operatorIdentifier(domain, opType)));
        }
        return set.get(opType).orElseThrow(() ->
                new UnsupportedOperatorException(List.of(operatorIdentifier(domain, opType))));
    }
}
