package io.surfworks.onnxgrinder.core.config;

import java.nio.file.Path;

/**
 * Configuration of an ONNX import.
 *
 * @param externalDataDir        directory external tensor data is resolved against; null to use
 *                               the directory of the model file
 * @param strictInitializers     fail instead of substituting a zero scalar when an initializer
 *                               cannot be decoded
 * @param lazyDomainRegistration enable domains that a graph uses without importing them
 */
public record ImportConfig(
        Path externalDataDir,
        boolean strictInitializers,
        boolean lazyDomainRegistration
) {

    /** Config file name looked up next to a model */
    public static final String CONFIG_FILE = "onnxgrinder.json";

    /**
     * Returns the default configuration: lenient initializers, lazy domain registration on.
     */
    public static ImportConfig defaults() {
        return new ImportConfig(null, false, true);
    }

    /**
     * Returns a new config with the specified external data directory.
     */
    public ImportConfig withExternalDataDir(Path dir) {
        return new ImportConfig(dir, strictInitializers, lazyDomainRegistration);
    }

    /**
     * Returns a new config with strict initializer decoding switched on or off.
     */
    public ImportConfig withStrictInitializers(boolean strict) {
        return new ImportConfig(externalDataDir, strict, lazyDomainRegistration);
    }

    /**
     * Returns a new config with lazy domain registration switched on or off.
     */
    public ImportConfig withLazyDomainRegistration(boolean lazy) {
        return new ImportConfig(externalDataDir, strictInitializers, lazy);
    }
}
