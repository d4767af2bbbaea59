package io.surfworks.onnxgrinder.core;

import io.surfworks.onnxgrinder.core.config.ImportConfig;
import io.surfworks.onnxgrinder.core.framework.FrameworkNodeResolver;
import io.surfworks.onnxgrinder.core.ops.OnnxModel;
import io.surfworks.onnxgrinder.core.ops.OperatorRegistry;
import io.surfworks.onnxgrinder.core.telemetry.TelemetryListener;
import io.surfworks.onnxgrinder.ir.Function;
import io.surfworks.onnxgrinder.model.ModelProto;
import io.surfworks.onnxgrinder.model.OnnxReader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point for importing ONNX models.
 *
 * <p>Usage:
 * <pre>{@code
 * OnnxImporter importer = new OnnxImporter(registry);
 * Function function = importer.importModel(Path.of("model.onnx"));
 * }</pre>
 *
 * <p>External tensor data is resolved against {@link ImportConfig#externalDataDir()}, or
 * against the directory of the model file when none is configured.
 */
public final class OnnxImporter {

    private static final Logger LOG = Logger.getLogger(OnnxImporter.class.getName());

    private final OperatorRegistry registry;
    private final ImportConfig config;
    private final TelemetryListener telemetry;

    public OnnxImporter(OperatorRegistry registry) {
        this(registry, ImportConfig.defaults(), null);
    }

    /**
     * @param telemetry receives per-operator node counts; may be null
     */
    public OnnxImporter(OperatorRegistry registry, ImportConfig config, TelemetryListener telemetry) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.telemetry = telemetry;
    }

    public ImportConfig config() {
        return config;
    }

    /**
     * Read and convert a model file.
     *
     * @throws IOException if the file cannot be read
     */
    public Function importModel(Path modelPath) throws IOException {
        ModelProto model = OnnxReader.load(modelPath);
        LOG.fine(() -> "Importing " + modelPath + " produced by " + model.producer());
        return builder(model, baseDirectory(modelPath)).convert();
    }

    /**
     * Read a model file into a function of framework nodes.
     *
     * @throws IOException if the file cannot be read
     */
    public Function decodeModel(Path modelPath) throws IOException {
        ModelProto model = OnnxReader.load(modelPath);
        return builder(model, baseDirectory(modelPath)).decode();
    }

    public Function importModel(ModelProto model) {
        return builder(model, config.externalDataDir()).convert();
    }

    public Function decodeModel(ModelProto model) {
        return builder(model, config.externalDataDir()).decode();
    }

    /**
     * Convert the framework nodes of a function produced by {@link #decodeModel}.
     */
    public Function resolve(Function decoded) {
        return new FrameworkNodeResolver().resolve(decoded);
    }

    /**
     * Builder for the main graph of {@code model}, with external data resolved against
     * {@code baseDirectory}.
     */
    public GraphBuilder builder(ModelProto model, Path baseDirectory) {
        OnnxModel onnxModel = new OnnxModel(model.opsetImports(), registry);
        return new GraphBuilder(model.graph(), onnxModel, config.withExternalDataDir(baseDirectory), telemetry);
    }

    private Path baseDirectory(Path modelPath) {
        if (config.externalDataDir() != null) {
            return config.externalDataDir();
        }
        return modelPath.toAbsolutePath().getParent();
    }
}
