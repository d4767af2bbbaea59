package io.surfworks.onnxgrinder.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Graph node (operation).
 *
 * @param name       optional node name, empty if absent
 * @param opType     operator type, e.g. {@code "Conv"}
 * @param domain     operator domain, empty for the default ONNX domain
 * @param inputs     input value names; an empty name is a skipped optional input
 * @param outputs    output value names; trailing optional outputs may be omitted
 * @param attributes attributes, including nested graphs of control-flow operators
 */
public record NodeProto(
        String name,
        String opType,
        String domain,
        List<String> inputs,
        List<String> outputs,
        List<AttributeProto> attributes
) {

    public NodeProto {
        Objects.requireNonNull(opType, "opType cannot be null");
        name = name == null ? "" : name;
        domain = domain == null ? "" : domain;
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        attributes = List.copyOf(attributes);
    }

    /**
     * Unnamed node in the default domain with no attributes.
     */
    public static NodeProto of(String opType, List<String> inputs, List<String> outputs) {
        return new NodeProto("", opType, "", inputs, outputs, List.of());
    }

    public NodeProto withName(String newName) {
        return new NodeProto(newName, opType, domain, inputs, outputs, attributes);
    }

    public NodeProto withDomain(String newDomain) {
        return new NodeProto(name, opType, newDomain, inputs, outputs, attributes);
    }

    public NodeProto withAttribute(AttributeProto attribute) {
        List<AttributeProto> attrs = new ArrayList<>(attributes);
        attrs.add(attribute);
        return new NodeProto(name, opType, domain, inputs, outputs, attrs);
    }

    public boolean hasName() {
        return !name.isEmpty();
    }

    public Optional<AttributeProto> attribute(String attributeName) {
        return attributes.stream().filter(a -> a.name().equals(attributeName)).findFirst();
    }

    /**
     * Attributes holding a nested graph, in declaration order.
     */
    public List<AttributeProto> graphAttributes() {
        return attributes.stream().filter(AttributeProto::isGraph).toList();
    }

    public boolean hasSubgraphs() {
        return attributes.stream().anyMatch(AttributeProto::isGraph);
    }
}
