package io.surfworks.onnxgrinder.core;

import io.surfworks.onnxgrinder.core.ops.OperatorRegistry;
import io.surfworks.onnxgrinder.ir.Node;
import io.surfworks.onnxgrinder.ir.NullNode;
import io.surfworks.onnxgrinder.ir.Output;
import io.surfworks.onnxgrinder.model.NodeProto;

import java.util.List;
import java.util.Set;

/**
 * Display and tensor names for converted values.
 *
 * <p>Only outputs with a declared counterpart are named. Display names may be written
 * several times for one IR node; the last write wins.
 */
public final class NodeNaming {

    public static final String IDENTITY_OP = "Identity";

    /** Separator between a graph output name and the output index in result names */
    public static final String SINK_PORT = "/sink_port_";

    private NodeNaming() {}

    public static boolean isIdentity(NodeProto node) {
        return IDENTITY_OP.equals(node.opType()) && OperatorRegistry.normalizeDomain(node.domain()).isEmpty();
    }

    /**
     * Name {@code outputs} after the declared outputs of {@code node}.
     */
    public static void assignNames(NodeProto node, List<Output> outputs) {
        int named = Math.min(outputs.size(), node.outputs().size());
        if (isIdentity(node)) {
            for (int i = 0; i < named; i++) {
                String outputName = node.outputs().get(i);
                if (!outputName.isEmpty() && !NullNode.isNull(outputs.get(i))) {
                    outputs.get(i).addNames(Set.of(outputName));
                }
            }
            return;
        }

        boolean common = commonNodeForAllOutputs(outputs);
        for (int i = 0; i < named; i++) {
            String outputName = node.outputs().get(i);
            if (outputName.isEmpty()) {
                continue;
            }
            Output output = outputs.get(i);
            Node producer = output.node();
            if (!node.hasName()) {
                producer.setDisplayName(outputName);
            } else if (common) {
                producer.setDisplayName(node.name());
            } else {
                producer.setDisplayName(node.name() + "_" + outputName);
            }
            if (!NullNode.isNull(output)) {
                output.setNames(Set.of(outputName));
            }
        }
    }

    /**
     * Whether every output is produced by the same IR node.
     */
    public static boolean commonNodeForAllOutputs(List<Output> outputs) {
        if (outputs.isEmpty()) {
            return false;
        }
        Node first = outputs.get(0).node();
        for (Output output : outputs) {
            if (output.node() != first) {
                return false;
            }
        }
        return true;
    }

    /**
     * Name of the result exposing {@code source} as graph output {@code outputName}.
     */
    public static String resultName(String outputName, Output source) {
        return outputName + SINK_PORT + source.index();
    }

    /**
     * Graph output name a result name was derived from.
     */
    public static String outputName(String resultName) {
        int at = resultName.lastIndexOf(SINK_PORT);
        return at < 0 ? resultName : resultName.substring(0, at);
    }
}
