package io.surfworks.onnxgrinder.core;

import io.surfworks.onnxgrinder.core.ops.OnnxModel;
import io.surfworks.onnxgrinder.core.ops.OperatorFactory;
import io.surfworks.onnxgrinder.ir.Output;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Dispatches a node to its operator factory and normalizes failures.
 *
 * <p>{@link NodeValidationException} passes through unchanged. Other runtime exceptions
 * are wrapped in {@link NodeConversionException}. Errors are logged and rethrown as they are.
 */
public final class NodeConverter {

    private static final Logger LOG = Logger.getLogger(NodeConverter.class.getName());

    private NodeConverter() {}

    public static List<Output> convert(OnnxModel model, OnnxNode node) {
        OperatorFactory factory = model.getOperator(node.opType(), node.domain());
        List<Output> outputs;
        try {
            outputs = factory.convert(node);
        } catch (NodeValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new NodeConversionException(node, e);
        } catch (Error e) {
            LOG.log(Level.SEVERE, node.errorPrefix() + ": Unhandled exception type " + e.getClass().getName(), e);
            throw e;
        }

        int required = requiredOutputCount(node);
        if (outputs == null || outputs.size() < required) {
            throw new NodeConversionException(node, "Operator produced "
                    + (outputs == null ? 0 : outputs.size()) + " outputs but the node declares " + required);
        }
        return outputs;
    }

    // Trailing outputs with empty names are skipped optional outputs
    private static int requiredOutputCount(OnnxNode node) {
        List<String> names = node.outputNames();
        int required = names.size();
        while (required > 0 && names.get(required - 1).isEmpty()) {
            required--;
        }
        return required;
    }
}
