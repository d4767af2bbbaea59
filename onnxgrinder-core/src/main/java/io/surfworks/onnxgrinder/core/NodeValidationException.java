package io.surfworks.onnxgrinder.core;

/**
 * Raised by operator factories when a node is invalid for its operator. The message
 * already identifies the node, so the builders rethrow it unchanged.
 */
public class NodeValidationException extends OnnxImportException {

    private final String domain;
    private final String opType;
    private final String nodeName;

    public NodeValidationException(OnnxNode node, String message) {
        super(node.errorPrefix() + ":\n" + message);
        this.domain = node.domain();
        this.opType = node.opType();
        this.nodeName = node.name();
    }

    public String getDomain() {
        return domain;
    }

    public String getOpType() {
        return opType;
    }

    public String getNodeName() {
        return nodeName;
    }
}
