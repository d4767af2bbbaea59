package io.surfworks.onnxgrinder.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Top-level ONNX model: metadata, opset imports and the main graph.
 */
public record ModelProto(
        long irVersion,
        String producerName,
        String producerVersion,
        String domain,
        long modelVersion,
        String docString,
        GraphProto graph,
        List<OperatorSetId> opsetImports,
        Map<String, String> metadata
) {

    /** IR version written by ONNX 1.14 and later */
    public static final long DEFAULT_IR_VERSION = 9;

    public ModelProto {
        Objects.requireNonNull(graph, "graph cannot be null");
        producerName = producerName == null ? "" : producerName;
        producerVersion = producerVersion == null ? "" : producerVersion;
        domain = domain == null ? "" : domain;
        docString = docString == null ? "" : docString;
        opsetImports = List.copyOf(opsetImports);
        metadata = Map.copyOf(metadata);
    }

    public static ModelProto of(GraphProto graph, List<OperatorSetId> opsetImports) {
        return new ModelProto(DEFAULT_IR_VERSION, "", "", "", 0, "", graph, opsetImports, Map.of());
    }

    public String producer() {
        return producerName + " " + producerVersion;
    }
}
