package io.surfworks.onnxgrinder.core;

import io.surfworks.onnxgrinder.core.config.ImportConfig;
import io.surfworks.onnxgrinder.core.framework.FrameworkNode;
import io.surfworks.onnxgrinder.core.framework.SubgraphFrameworkNode;
import io.surfworks.onnxgrinder.core.ops.OnnxModel;
import io.surfworks.onnxgrinder.core.telemetry.TelemetryListener;
import io.surfworks.onnxgrinder.core.tensor.OnnxTypes;
import io.surfworks.onnxgrinder.core.tensor.TensorDecoder;
import io.surfworks.onnxgrinder.ir.Constant;
import io.surfworks.onnxgrinder.ir.ElementType;
import io.surfworks.onnxgrinder.ir.Function;
import io.surfworks.onnxgrinder.ir.NullNode;
import io.surfworks.onnxgrinder.ir.Output;
import io.surfworks.onnxgrinder.ir.Parameter;
import io.surfworks.onnxgrinder.model.AttributeProto;
import io.surfworks.onnxgrinder.model.GraphProto;
import io.surfworks.onnxgrinder.model.NodeProto;
import io.surfworks.onnxgrinder.model.TensorProto;
import io.surfworks.onnxgrinder.model.ValueInfoProto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Builds an IR {@link Function} from an ONNX graph.
 *
 * <p>Construction decodes the initializers, creates parameters for the declared inputs and
 * checks that every operator of the graph is available, so a builder that exists is known
 * to have all its conversions. A builder then runs exactly one pass:
 * <ul>
 *   <li>{@link #convert()} dispatches every node to its operator factory and returns a
 *       fully connected function;</li>
 *   <li>{@link #decode()} wraps every node in a {@link FrameworkNode} so that conversion
 *       can happen later, see {@code FrameworkNodeResolver}.</li>
 * </ul>
 *
 * <p>Nodes are visited in declaration order, which ONNX requires to be topological.
 */
public class GraphBuilder implements SymbolScope {

    private static final Logger LOG = Logger.getLogger(GraphBuilder.class.getName());

    /** Runtime-info key under which a decoded function references its builder */
    public static final String ONNX_GRAPH_KEY = "onnx_graph";

    private final GraphProto graph;
    private final OnnxModel model;
    private final ImportConfig config;
    private final TensorDecoder decoder;
    private final TelemetryListener telemetry;
    private final GraphCache cache = new GraphCache();
    private final List<Parameter> parameters = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private boolean passStarted;

    /**
     * @param telemetry receives per-operator node counts; may be null
     * @throws InvalidExternalDataException if an initializer references broken external data
     * @throws UnsupportedOperatorException if some operators have no registered factory
     */
    public GraphBuilder(GraphProto graph, OnnxModel model, ImportConfig config, TelemetryListener telemetry) {
        this(graph, model, config, new TensorDecoder(config.externalDataDir()), telemetry);
    }

    protected GraphBuilder(GraphProto graph, OnnxModel model, ImportConfig config,
                           TensorDecoder decoder, TelemetryListener telemetry) {
        this.graph = Objects.requireNonNull(graph, "graph cannot be null");
        this.model = Objects.requireNonNull(model, "model cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.decoder = Objects.requireNonNull(decoder, "decoder cannot be null");
        this.telemetry = telemetry;

        createInitializers();
        createParameters();
        validateOperators();
    }

    // ==================== Construction ====================

    private void createInitializers() {
        for (TensorProto tensor : graph.initializers()) {
            if (!tensor.hasName()) {
                continue;
            }
            Constant constant;
            try {
                constant = decoder.decode(tensor);
            } catch (InvalidExternalDataException e) {
                throw e;
            } catch (OnnxImportException e) {
                if (config.strictInitializers()) {
                    throw e;
                }
                String warning = "Initializer '" + tensor.name() + "' replaced by a zero scalar: " + e.getMessage();
                LOG.warning(warning);
                warnings.add(warning);
                constant = Constant.zero(placeholderType(tensor));
            }
            constant.setDisplayName(tensor.name());
            constant.output(0).setNames(Set.of(tensor.name()));
            cache.put(tensor.name(), constant.output(0));
        }
    }

    private static ElementType placeholderType(TensorProto tensor) {
        try {
            ElementType type = OnnxTypes.elementType(tensor.dataType());
            return type.hasFixedSize() ? type : ElementType.F32;
        } catch (OnnxImportException e) {
            return ElementType.F32;
        }
    }

    private void createParameters() {
        for (ValueInfoProto input : graph.inputs()) {
            if (cache.contains(input.name())) {
                // Shadowed by an initializer
                continue;
            }
            Parameter parameter = new Parameter(OnnxTypes.elementType(input.elemType()), OnnxTypes.shape(input));
            parameter.setDisplayName(input.name());
            parameter.output(0).setNames(Set.of(input.name()));
            cache.put(input.name(), parameter.output(0));
            parameters.add(parameter);
        }
    }

    private void validateOperators() {
        Map<String, NodeProto> unknown = new TreeMap<>();
        Map<String, Long> opCounts = new TreeMap<>();
        for (NodeProto node : graph.nodes()) {
            if (telemetry != null) {
                opCounts.merge(node.opType(), 1L, Long::sum);
            }
            if (!model.isOperatorAvailable(node)) {
                unknown.putIfAbsent(OnnxModel.operatorIdentifier(node), node);
                if (config.lazyDomainRegistration()) {
                    model.enableOpsetDomain(node.domain());
                }
            }
        }
        if (telemetry != null) {
            opCounts.forEach((opType, count) ->
                    telemetry.sendEvent(TelemetryListener.OP_COUNT, TelemetryListener.OP_PREFIX + opType, count));
        }

        // Domains enabled during the scan may have supplied some operators; one more look
        unknown.values().removeIf(model::isOperatorAvailable);
        if (!unknown.isEmpty()) {
            throw new UnsupportedOperatorException(unknown.keySet());
        }
    }

    // ==================== Symbol lookup ====================

    @Override
    public boolean contains(String name) {
        return cache.contains(name);
    }

    @Override
    public Output get(String name) {
        return cache.get(name);
    }

    // ==================== Passes ====================

    /**
     * Convert every node and assemble the function.
     *
     * @throws IllegalStateException if this builder already ran a pass
     */
    public Function convert() {
        beginPass("convert");
        convertNodes();
        removeDanglingParameters();
        Function function = createFunction();
        LOG.fine(() -> "Converted graph '" + graph.name() + "': " + graph.nodes().size() + " nodes, "
                + function.parameters().size() + " parameters, " + function.outputCount() + " results");
        return function;
    }

    /**
     * Wrap every node in a framework node and assemble the function. The function's
     * runtime info references this builder under {@link #ONNX_GRAPH_KEY}.
     *
     * @throws IllegalStateException if this builder already ran a pass
     */
    public Function decode() {
        beginPass("decode");
        decodeNodes();
        Function function = createFunction();
        function.runtimeInfo().put(ONNX_GRAPH_KEY, this);
        return function;
    }

    protected final void beginPass(String pass) {
        if (passStarted) {
            throw new IllegalStateException("Graph '" + graph.name() + "' was already built; cannot " + pass + " again");
        }
        passStarted = true;
    }

    protected void convertNodes() {
        for (NodeProto node : graph.nodes()) {
            Map<String, ConvertedSubgraph> subgraphs = new LinkedHashMap<>();
            for (AttributeProto attribute : node.graphAttributes()) {
                SubgraphBuilder body = new SubgraphBuilder(attribute.g(), this);
                Function function = body.convert();
                subgraphs.put(attribute.name(), new ConvertedSubgraph(function, body.captureBindings(), body.inputsFromParent()));
            }
            OnnxNode onnxNode = OnnxNode.resolve(node, this, subgraphs);
            List<Output> outputs = localizeOutputs(NodeConverter.convert(model, onnxNode));
            NodeNaming.assignNames(node, outputs);
            insertOutputs(node, outputs);
        }
    }

    protected void decodeNodes() {
        for (NodeProto node : graph.nodes()) {
            Map<String, ConvertedSubgraph> subgraphs = new LinkedHashMap<>();
            for (AttributeProto attribute : node.graphAttributes()) {
                SubgraphBuilder body = new SubgraphBuilder(attribute.g(), this);
                Function function = body.decode();
                subgraphs.put(attribute.name(), new ConvertedSubgraph(function, body.captureBindings(), body.inputsFromParent()));
            }
            OnnxNode onnxNode = OnnxNode.resolve(node, this, subgraphs);
            FrameworkNode frameworkNode = subgraphs.isEmpty()
                    ? new FrameworkNode(node, onnxNode.inputs(), model)
                    : new SubgraphFrameworkNode(node, onnxNode.inputs(), model, subgraphs);
            List<Output> outputs = localizeOutputs(frameworkNode.outputs());
            NodeNaming.assignNames(node, outputs);
            insertOutputs(node, outputs);
        }
    }

    /**
     * Outputs of a converted node as this graph will name and bind them. A top-level graph
     * owns every value it can reach, so they are returned unchanged.
     */
    protected List<Output> localizeOutputs(List<Output> outputs) {
        return outputs;
    }

    private void insertOutputs(NodeProto node, List<Output> outputs) {
        // Extra produced outputs have no declared name to be found under
        int count = Math.min(outputs.size(), node.outputs().size());
        for (int i = 0; i < count; i++) {
            String name = node.outputs().get(i);
            if (!name.isEmpty()) {
                cache.put(name, outputs.get(i));
            }
        }
    }

    /**
     * Drop parameters that nothing reads, unless one of their names is a declared graph
     * output. Pruned parameters are also removed from the cache.
     */
    public void removeDanglingParameters() {
        Set<String> outputNames = new HashSet<>(graph.outputNames());
        Iterator<Parameter> it = parameters.iterator();
        while (it.hasNext()) {
            Parameter parameter = it.next();
            Output value = parameter.output(0);
            if (!value.targetInputs().isEmpty()) {
                continue;
            }
            if (value.names().stream().anyMatch(outputNames::contains)) {
                continue;
            }
            it.remove();
            String name = parameter.displayName();
            if (cache.contains(name) && cache.get(name) == value) {
                cache.remove(name);
            }
            LOG.fine(() -> "Removed dangling parameter '" + name + "'");
        }
    }

    protected Function createFunction() {
        List<Output> values = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (ValueInfoProto output : graph.outputs()) {
            Output value = resolveOutput(output.name());
            if (NullNode.isNull(value)) {
                continue;
            }
            values.add(value);
            names.add(output.name());
        }
        Function function = new Function(values, parameters, graph.name());
        for (int i = 0; i < values.size(); i++) {
            function.result(i).setDisplayName(NodeNaming.resultName(names.get(i), values.get(i)));
        }
        return function;
    }

    /**
     * Value of a declared graph output.
     */
    protected Output resolveOutput(String name) {
        return get(name);
    }

    protected final void addParameter(Parameter parameter) {
        parameters.add(parameter);
    }

    // ==================== Accessors ====================

    public GraphProto graph() {
        return graph;
    }

    public OnnxModel model() {
        return model;
    }

    public ImportConfig config() {
        return config;
    }

    protected TensorDecoder decoder() {
        return decoder;
    }

    protected TelemetryListener telemetry() {
        return telemetry;
    }

    protected GraphCache cache() {
        return cache;
    }

    /**
     * Every name this builder can resolve, nearest scope first.
     */
    protected List<String> visibleNames() {
        return cache.names();
    }

    /**
     * Current parameter list, in declaration order followed by any boundary parameters.
     */
    public List<Parameter> parameters() {
        return Collections.unmodifiableList(parameters);
    }

    /**
     * Degradation warnings raised during construction.
     */
    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }
}
