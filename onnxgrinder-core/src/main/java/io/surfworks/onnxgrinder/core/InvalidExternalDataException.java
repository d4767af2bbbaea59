package io.surfworks.onnxgrinder.core;

/**
 * An initializer references external data that does not exist or cannot be read as
 * described. Always fatal: no placeholder is substituted.
 */
public class InvalidExternalDataException extends OnnxImportException {

    private final String tensorName;

    public InvalidExternalDataException(String tensorName, String message) {
        super("Invalid external data for tensor '" + tensorName + "': " + message);
        this.tensorName = tensorName;
    }

    public InvalidExternalDataException(String tensorName, String message, Throwable cause) {
        super("Invalid external data for tensor '" + tensorName + "': " + message, cause);
        this.tensorName = tensorName;
    }

    public String getTensorName() {
        return tensorName;
    }
}
