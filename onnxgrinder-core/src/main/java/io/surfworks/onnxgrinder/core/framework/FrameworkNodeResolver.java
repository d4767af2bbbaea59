package io.surfworks.onnxgrinder.core.framework;

import io.surfworks.onnxgrinder.core.GraphBuilder;
import io.surfworks.onnxgrinder.core.NodeNaming;
import io.surfworks.onnxgrinder.ir.Function;
import io.surfworks.onnxgrinder.ir.Node;
import io.surfworks.onnxgrinder.ir.Output;
import io.surfworks.onnxgrinder.ir.Parameter;
import io.surfworks.onnxgrinder.ir.Result;

import java.util.List;
import java.util.logging.Logger;

/**
 * Converts the framework nodes of a decoded function.
 *
 * <p>Nodes are resolved in topological order, so every framework node sees converted
 * inputs. Nested bodies are resolved before their owner. The decoded function is consumed:
 * its framework nodes and results are detached and a new function is returned.
 */
public final class FrameworkNodeResolver {

    private static final Logger LOG = Logger.getLogger(FrameworkNodeResolver.class.getName());

    /**
     * Resolve a function produced by {@link GraphBuilder#decode()}. Parameters nothing
     * reads after resolution are pruned the way {@link GraphBuilder#convert()} prunes them.
     */
    public Function resolve(Function decoded) {
        return resolveBody(decoded, true);
    }

    private Function resolveBody(Function decoded, boolean prune) {
        int resolved = 0;
        for (Node node : decoded.orderedNodes()) {
            if (!(node instanceof FrameworkNode frameworkNode)) {
                continue;
            }
            List<Output> outputs = frameworkNode.convert(body -> resolveBody(body, false));
            int count = Math.min(frameworkNode.outputCount(), outputs.size());
            for (int i = 0; i < count; i++) {
                frameworkNode.output(i).replaceAllUses(outputs.get(i));
            }
            frameworkNode.detach();
            NodeNaming.assignNames(frameworkNode.proto(), outputs);
            resolved++;
        }

        List<Output> values = decoded.outputs();
        for (Result result : decoded.results()) {
            result.detach();
        }

        List<Parameter> parameters = decoded.parameters();
        Object owner = decoded.runtimeInfo().get(GraphBuilder.ONNX_GRAPH_KEY);
        if (prune && owner instanceof GraphBuilder builder) {
            builder.removeDanglingParameters();
            parameters = builder.parameters();
        }

        Function function = new Function(values, parameters, decoded.name());
        for (int i = 0; i < values.size(); i++) {
            String outputName = NodeNaming.outputName(decoded.result(i).displayName());
            function.result(i).setDisplayName(NodeNaming.resultName(outputName, values.get(i)));
        }
        int total = resolved;
        LOG.fine(() -> "Resolved " + total + " framework nodes in '" + decoded.name() + "'");
        return function;
    }
}
