package io.surfworks.onnxgrinder.core.ops;

import io.surfworks.onnxgrinder.core.OnnxNode;
import io.surfworks.onnxgrinder.ir.Output;

import java.util.List;

/**
 * Converts one ONNX node into IR values.
 *
 * <p>The returned list holds one value per node output, in order. It may be longer than the
 * node's declared output list when trailing optional outputs were omitted from the model.
 */
@FunctionalInterface
public interface OperatorFactory {

    List<Output> convert(OnnxNode node);
}
