package io.surfworks.onnxgrinder.core.ops;

import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Operator factories keyed by (domain, op type, since-version).
 *
 * <p>A factory registered with since-version {@code v} serves every opset version
 * {@code >= v} until a later registration for the same operator supersedes it.
 *
 * <p>Domains can also be provided lazily: a provider registered for a domain runs the first
 * time that domain is requested through {@link #ensureDomain(String)}, and may register
 * operators of any domain.
 */
public final class OperatorRegistry {

    private static final Logger LOG = Logger.getLogger(OperatorRegistry.class.getName());

    /** Alias of the default ONNX domain */
    public static final String AI_ONNX_DOMAIN = "ai.onnx";

    private final Map<String, Map<String, NavigableMap<Long, OperatorFactory>>> factories = new HashMap<>();
    private final Map<String, Consumer<OperatorRegistry>> providers = new HashMap<>();

    /**
     * Map {@code ai.onnx} to the empty default domain.
     */
    public static String normalizeDomain(String domain) {
        if (domain == null || domain.equals(AI_ONNX_DOMAIN)) {
            return "";
        }
        return domain;
    }

    public OperatorRegistry register(String domain, String opType, long sinceVersion, OperatorFactory factory) {
        Objects.requireNonNull(opType, "opType cannot be null");
        Objects.requireNonNull(factory, "factory cannot be null");
        if (sinceVersion < 1) {
            throw new IllegalArgumentException("sinceVersion must be at least 1, got " + sinceVersion);
        }
        factories.computeIfAbsent(normalizeDomain(domain), d -> new HashMap<>())
                .computeIfAbsent(opType, t -> new TreeMap<>())
                .put(sinceVersion, factory);
        return this;
    }

    /**
     * Register a provider that populates {@code domain} on first use.
     */
    public OperatorRegistry registerDomainProvider(String domain, Consumer<OperatorRegistry> provider) {
        providers.put(normalizeDomain(domain), Objects.requireNonNull(provider, "provider cannot be null"));
        return this;
    }

    public boolean hasDomain(String domain) {
        return factories.containsKey(normalizeDomain(domain));
    }

    /**
     * Make sure {@code domain} is populated, running its provider if it has one and has not
     * run yet.
     *
     * @return whether the domain has any registered operator afterwards
     */
    public boolean ensureDomain(String domain) {
        String key = normalizeDomain(domain);
        Consumer<OperatorRegistry> provider = providers.remove(key);
        if (provider != null) {
            LOG.fine("Loading operators for domain '" + key + "'");
            try {
                provider.accept(this);
            } catch (RuntimeException e) {
                // Keep the provider so a later request can load the domain again
                providers.putIfAbsent(key, provider);
                throw e;
            }
        }
        return factories.containsKey(key);
    }

    /**
     * Greatest since-version registered in the domain.
     */
    public OptionalLong latestVersion(String domain) {
        Map<String, NavigableMap<Long, OperatorFactory>> byType = factories.get(normalizeDomain(domain));
        if (byType == null) {
            return OptionalLong.empty();
        }
        return byType.values().stream().mapToLong(NavigableMap::lastKey).max();
    }

    /**
     * Operators of {@code domain} as seen by a model importing {@code version}: for every op
     * type, the factory with the greatest since-version not above {@code version}.
     */
    public OperatorSet operatorSet(String domain, long version) {
        String key = normalizeDomain(domain);
        Map<String, OperatorFactory> selected = new HashMap<>();
        Map<String, NavigableMap<Long, OperatorFactory>> byType = factories.getOrDefault(key, Map.of());
        for (Map.Entry<String, NavigableMap<Long, OperatorFactory>> entry : byType.entrySet()) {
            Map.Entry<Long, OperatorFactory> match = entry.getValue().floorEntry(version);
            if (match != null) {
                selected.put(entry.getKey(), match.getValue());
            }
        }
        return new OperatorSet(key, version, selected);
    }
}
