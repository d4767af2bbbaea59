package io.surfworks.onnxgrinder.core;

/**
 * Converting a node failed. Carries the operator identity and node name so the caller can
 * locate the node in the source graph.
 */
public class NodeConversionException extends OnnxImportException {

    private final String domain;
    private final String opType;
    private final String nodeName;

    public NodeConversionException(OnnxNode node, String message) {
        super(node.errorPrefix() + ":\n" + message);
        this.domain = node.domain();
        this.opType = node.opType();
        this.nodeName = node.name();
    }

    public NodeConversionException(OnnxNode node, Throwable cause) {
        super(node.errorPrefix() + ":\n" + cause.getMessage(), cause);
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
