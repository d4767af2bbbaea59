package io.surfworks.onnxgrinder.core;

import io.surfworks.onnxgrinder.ir.Constant;
import io.surfworks.onnxgrinder.ir.Function;
import io.surfworks.onnxgrinder.ir.Input;
import io.surfworks.onnxgrinder.ir.Node;
import io.surfworks.onnxgrinder.ir.Output;
import io.surfworks.onnxgrinder.ir.Parameter;
import io.surfworks.onnxgrinder.ir.SubgraphOwner;
import io.surfworks.onnxgrinder.model.GraphProto;
import io.surfworks.onnxgrinder.model.NodeProto;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Builder of a nested graph (loop body, conditional branch) with visibility into its
 * enclosing graphs.
 *
 * <p>Names are resolved in the local cache first, then through the parent chain. After the
 * body is built, every edge that reads a non-constant value of an enclosing graph is
 * redirected to a boundary {@link Parameter}, and the pair (parameter, enclosing name) is
 * recorded as a {@link CaptureBinding}. The owning control-flow operator uses the bindings
 * to feed the captured values on each instantiation.
 *
 * <p>Unlike a top-level graph, a subgraph keeps all of its declared inputs: they are
 * positional and the owning operator relies on their order.
 */
public class SubgraphBuilder extends GraphBuilder {

    private static final Logger LOG = Logger.getLogger(SubgraphBuilder.class.getName());

    private final GraphBuilder parent;
    private final Map<String, CaptureBinding> bindings = new LinkedHashMap<>();
    private Map<Output, String> enclosingValues;

    public SubgraphBuilder(GraphProto graph, GraphBuilder parent) {
        super(graph, parent.model(), parent.config(), parent.decoder(), parent.telemetry());
        this.parent = Objects.requireNonNull(parent, "parent cannot be null");
    }

    public GraphBuilder parent() {
        return parent;
    }

    @Override
    public boolean contains(String name) {
        return cache().contains(name) || parent.contains(name);
    }

    @Override
    public Output get(String name) {
        if (cache().contains(name)) {
            return cache().get(name);
        }
        return parent.get(name);
    }

    @Override
    public Function convert() {
        beginPass("convert");
        convertNodes();
        findInputsFromParent();
        return createFunction();
    }

    @Override
    public Function decode() {
        beginPass("decode");
        decodeNodes();
        findInputsFromParent();
        Function function = createFunction();
        function.runtimeInfo().put(ONNX_GRAPH_KEY, this);
        return function;
    }

    /**
     * Redirect every edge that reads a non-constant enclosing value to a boundary
     * parameter.
     *
     * <p>The first sweep visits, per source node in declaration order, every IR node its
     * conversion built, stopping at enclosing values, and rewires each edge reading one.
     * Control-flow nodes are only swept over their declared inputs there. The second sweep
     * covers the remaining edges of control-flow nodes: captures of their own bodies,
     * which have no declared input name.
     */
    public void findInputsFromParent() {
        Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Node> owners = new ArrayList<>();
        for (NodeProto node : graph().nodes()) {
            for (Node built : builtNodes(node, visited)) {
                int declared = built.inputCount();
                if (built instanceof SubgraphOwner) {
                    owners.add(built);
                    declared = Math.min(declared, node.inputs().size());
                }
                for (int k = 0; k < declared; k++) {
                    capture(built.input(k));
                }
            }
        }

        for (Node owner : owners) {
            for (Input edge : owner.inputs()) {
                capture(edge);
            }
        }
    }

    /**
     * Refresh the type and shape of every boundary parameter from the enclosing value it
     * is bound to.
     */
    public void inferInputsFromParent() {
        for (CaptureBinding binding : bindings.values()) {
            Output value = parent.get(binding.parentName());
            binding.parameter().setElementType(value.elementType());
            binding.parameter().setPartialShape(value.shape());
        }
    }

    /**
     * Enclosing values currently bound to the boundary parameters, in binding order.
     */
    public List<Output> inputsFromParent() {
        List<Output> values = new ArrayList<>(bindings.size());
        for (CaptureBinding binding : bindings.values()) {
            values.add(parent.get(binding.parentName()));
        }
        return values;
    }

    public List<CaptureBinding> captureBindings() {
        return List.copyOf(bindings.values());
    }

    /**
     * A declared output that names an enclosing value is exposed through a boundary
     * parameter as well; enclosing constants are returned as they are.
     */
    @Override
    protected Output resolveOutput(String name) {
        if (!cache().contains(name) && parent.contains(name)) {
            Output fromParent = parent.get(name);
            if (!Constant.isConstant(fromParent)) {
                return boundaryParameter(name, fromParent).node().output(0);
            }
        }
        return super.resolveOutput(name);
    }

    /**
     * Enclosing values are replaced by boundary parameters before the node is named, so
     * naming never touches an enclosing graph. An enclosing constant is copied instead.
     */
    @Override
    protected List<Output> localizeOutputs(List<Output> outputs) {
        List<Output> local = new ArrayList<>(outputs.size());
        for (Output value : outputs) {
            String name = enclosingValues().get(value);
            if (name == null) {
                local.add(value);
            } else if (Constant.isConstant(value)) {
                local.add(copyOf((Constant) value.node()));
            } else {
                local.add(boundaryParameter(name, value));
            }
        }
        return local;
    }

    @Override
    protected List<String> visibleNames() {
        List<String> names = new ArrayList<>(super.visibleNames());
        names.addAll(parent.visibleNames());
        return names;
    }

    private void capture(Input edge) {
        Output value = edge.source();
        if (Constant.isConstant(value)) {
            return;
        }
        String name = enclosingValues().get(value);
        if (name != null) {
            edge.replaceSourceOutput(boundaryParameter(name, value));
        }
    }

    // IR nodes built for a source node and not claimed by an earlier one, producers first
    private List<Node> builtNodes(NodeProto node, Set<Node> visited) {
        List<Node> built = new ArrayList<>();
        Deque<Node> pending = new ArrayDeque<>();
        for (String outputName : node.outputs()) {
            if (!outputName.isEmpty() && cache().contains(outputName)) {
                pending.addLast(cache().get(outputName).node());
            }
        }
        while (!pending.isEmpty()) {
            Node current = pending.removeFirst();
            if (!visited.add(current)) {
                continue;
            }
            built.add(current);
            for (Input edge : current.inputs()) {
                if (!enclosingValues().containsKey(edge.source())) {
                    pending.addLast(edge.source().node());
                }
            }
        }
        return built;
    }

    /**
     * Values of the enclosing graphs this body can reach, each with the name it is captured
     * under. Names the body references come first, so a capture keeps the name the body
     * uses. The enclosing graphs do not change while a body is built.
     */
    private Map<Output, String> enclosingValues() {
        if (enclosingValues == null) {
            List<String> candidates = new ArrayList<>();
            for (NodeProto node : graph().nodes()) {
                candidates.addAll(node.inputs());
            }
            candidates.addAll(graph().outputNames());
            candidates.addAll(parent.visibleNames());

            Map<Output, String> values = new IdentityHashMap<>();
            for (String name : candidates) {
                if (!name.isEmpty() && parent.contains(name)) {
                    values.putIfAbsent(parent.get(name), name);
                }
            }
            enclosingValues = values;
        }
        return enclosingValues;
    }

    private static Output copyOf(Constant constant) {
        byte[] data = new byte[constant.byteSize()];
        constant.data().get(data);
        Constant copy = new Constant(constant.elementType(), constant.shape(), data);
        copy.setDisplayName(constant.displayName());
        copy.output(0).setNames(constant.output(0).names());
        return copy.output(0);
    }

    private Output boundaryParameter(String parentName, Output fromParent) {
        CaptureBinding existing = bindings.get(parentName);
        if (existing != null) {
            return existing.parameter().output(0);
        }
        for (CaptureBinding binding : bindings.values()) {
            if (parent.get(binding.parentName()) == fromParent) {
                return binding.parameter().output(0);
            }
        }
        Parameter parameter = new Parameter(fromParent.elementType(), fromParent.shape());
        parameter.setDisplayName(parentName);
        parameter.output(0).setNames(Set.of(parentName));
        cache().put(parentName, parameter.output(0));
        addParameter(parameter);
        bindings.put(parentName, new CaptureBinding(parameter, parentName));
        LOG.fine(() -> "Graph '" + graph().name() + "' captures '" + parentName + "' from its enclosing graph");
        return parameter.output(0);
    }
}
