package io.surfworks.onnxgrinder.core;

/**
 * Base class of every failure raised while importing an ONNX graph.
 */
public class OnnxImportException extends RuntimeException {

    public OnnxImportException(String message) {
        super(message);
    }

    public OnnxImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
