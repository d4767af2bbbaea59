package io.surfworks.onnxgrinder.ir;

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

/**
 * A closed dataflow graph: ordered parameters, ordered results and the nodes between them.
 */
public final class Function {

    private final String name;
    private final List<Parameter> parameters;
    private final List<Result> results;
    private final Map<String, Object> runtimeInfo = new LinkedHashMap<>();

    /**
     * Create a function whose results wrap {@code outputs}, in order.
     */
    public Function(List<Output> outputs, List<Parameter> parameters, String name) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.parameters = List.copyOf(parameters);
        List<Result> sinks = new ArrayList<>(outputs.size());
        for (Output output : outputs) {
            sinks.add(new Result(output));
        }
        this.results = Collections.unmodifiableList(sinks);
    }

    public String name() {
        return name;
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    public Parameter parameter(int index) {
        return parameters.get(index);
    }

    public List<Result> results() {
        return results;
    }

    public Result result(int index) {
        return results.get(index);
    }

    /**
     * Values exposed by the results, in result order.
     */
    public List<Output> outputs() {
        List<Output> values = new ArrayList<>(results.size());
        for (Result result : results) {
            values.add(result.value());
        }
        return values;
    }

    public int outputCount() {
        return results.size();
    }

    /**
     * Mutable side-table for passes that need to attach data to the function.
     */
    public Map<String, Object> runtimeInfo() {
        return runtimeInfo;
    }

    /**
     * All nodes of the body in topological order: parameters first, then every node
     * reachable backwards from the results, ending with the results themselves.
     * The order depends only on the graph structure.
     */
    public List<Node> orderedNodes() {
        Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Node> order = new ArrayList<>();
        for (Parameter parameter : parameters) {
            visited.add(parameter);
            order.add(parameter);
        }
        for (Result result : results) {
            visit(result, visited, order);
        }
        return order;
    }

    private static void visit(Node root, Set<Node> visited, List<Node> order) {
        if (!visited.add(root)) {
            return;
        }
        // Iterative post-order so deep graphs do not overflow the stack
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root));
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.next < frame.node.inputCount()) {
                Node producer = frame.node.input(frame.next++).source().node();
                if (visited.add(producer)) {
                    stack.push(new Frame(producer));
                }
            } else {
                stack.pop();
                order.add(frame.node);
            }
        }
    }

    private static final class Frame {
        private final Node node;
        private int next;

        Frame(Node node) {
            this.node = node;
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Function '").append(name).append("'\n");
        sb.append("  Parameters: ").append(parameters.size()).append("\n");
        sb.append("  Results: ").append(results.size()).append("\n");
        sb.append("  Nodes:\n");
        List<Node> nodes = orderedNodes();
        for (int i = 0; i < nodes.size(); i++) {
            sb.append("    [").append(i).append("] ").append(nodes.get(i)).append("\n");
        }
        return sb.toString();
    }
}
