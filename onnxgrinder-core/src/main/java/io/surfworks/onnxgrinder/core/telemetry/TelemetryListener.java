package io.surfworks.onnxgrinder.core.telemetry;

/**
 * Receives import statistics. Transport and aggregation are up to the implementation.
 */
@FunctionalInterface
public interface TelemetryListener {

    /** Category of per-operator node counts */
    String OP_COUNT = "op_count";

    /** Prefix of the action of per-operator node counts */
    String OP_PREFIX = "onnx_";

    /**
     * @param category event category, e.g. {@link #OP_COUNT}
     * @param action   what was counted, e.g. {@code onnx_Conv}
     * @param value    the count
     */
    void sendEvent(String category, String action, long value);
}
