package io.surfworks.onnxgrinder.model;

/**
 * Thrown when bytes cannot be decoded as an ONNX protobuf message.
 */
public class OnnxFormatException extends RuntimeException {

    private final long offset;

    public OnnxFormatException(String message) {
        super(message);
        this.offset = -1;
    }

    public OnnxFormatException(String message, long offset) {
        super(String.format("%s at byte %d", message, offset));
        this.offset = offset;
    }

    /**
     * Byte position where decoding failed, or -1 if unknown.
     */
    public long getOffset() {
        return offset;
    }
}
