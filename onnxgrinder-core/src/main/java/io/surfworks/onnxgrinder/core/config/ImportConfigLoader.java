package io.surfworks.onnxgrinder.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Loads and saves {@link ImportConfig} as JSON.
 *
 * <p>Keys: {@code externalDataDir}, {@code strictInitializers},
 * {@code lazyDomainRegistration}. Missing keys keep their defaults.
 */
public final class ImportConfigLoader {

    private static final Logger LOG = Logger.getLogger(ImportConfigLoader.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    private ImportConfigLoader() {
    }

    /**
     * Loads configuration from a file.
     *
     * <p>If the file doesn't exist or cannot be parsed, returns defaults.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     */
    public static ImportConfig load(Path configFile) {
        ImportConfig config = ImportConfig.defaults();
        if (Files.exists(configFile)) {
            config = loadFromFile(configFile, config);
        }
        return config;
    }

    /**
     * Saves configuration to a file, creating parent directories as needed.
     *
     * @throws IOException if saving fails
     */
    public static void save(ImportConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ObjectNode root = JSON.createObjectNode();
        if (config.externalDataDir() != null) {
            root.put("externalDataDir", config.externalDataDir().toString());
        }
        root.put("strictInitializers", config.strictInitializers());
        root.put("lazyDomainRegistration", config.lazyDomainRegistration());

        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
    }

    private static ImportConfig loadFromFile(Path configFile, ImportConfig base) {
        try {
            JsonNode root = JSON.readTree(configFile.toFile());
            if (root == null || !root.isObject()) {
                LOG.warning("Ignoring " + configFile + ": expected a JSON object");
                return base;
            }

            ImportConfig config = base;
            if (root.has("externalDataDir")) {
                config = config.withExternalDataDir(Path.of(root.get("externalDataDir").asText()));
            }
            config = config.withStrictInitializers(
                    getBooleanOrDefault(root, "strictInitializers", base.strictInitializers()));
            config = config.withLazyDomainRegistration(
                    getBooleanOrDefault(root, "lazyDomainRegistration", base.lazyDomainRegistration()));
            return config;

        } catch (IOException e) {
            LOG.warning("Failed to read " + configFile + ", using defaults: " + e.getMessage());
            return base;
        }
    }

    private static boolean getBooleanOrDefault(JsonNode node, String field, boolean defaultValue) {
        if (node.has(field)) {
            return node.get(field).asBoolean(defaultValue);
        }
        return defaultValue;
    }
}
