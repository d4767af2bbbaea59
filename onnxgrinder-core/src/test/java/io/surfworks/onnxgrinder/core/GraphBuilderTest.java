package io.surfworks.onnxgrinder.core;

import io.surfworks.onnxgrinder.core.config.ImportConfig;
import io.surfworks.onnxgrinder.core.json.FunctionJson;
import io.surfworks.onnxgrinder.core.ops.OnnxModel;
import io.surfworks.onnxgrinder.ir.Constant;
import io.surfworks.onnxgrinder.ir.ElementType;
import io.surfworks.onnxgrinder.ir.Function;
import io.surfworks.onnxgrinder.ir.Node;
import io.surfworks.onnxgrinder.ir.Output;
import io.surfworks.onnxgrinder.ir.Parameter;
import io.surfworks.onnxgrinder.ir.PartialShape;
import io.surfworks.onnxgrinder.model.GraphProto;
import io.surfworks.onnxgrinder.model.NodeProto;
import io.surfworks.onnxgrinder.model.OnnxDataType;
import io.surfworks.onnxgrinder.model.TensorProto;
import io.surfworks.onnxgrinder.model.ValueInfoProto;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphBuilderTest {

    private static ValueInfoProto f32(String name, long... dims) {
        return ValueInfoProto.tensor(name, OnnxDataType.FLOAT, dims);
    }

    private static GraphBuilder builder(GraphProto graph) {
        return new GraphBuilder(graph, TestOperators.model(), ImportConfig.defaults(), null);
    }

    private static Function convert(GraphProto graph) {
        return builder(graph).convert();
    }

    // x -> Add(x, W) -> Relu -> y
    private static GraphProto chain() {
        return GraphProto.builder("chain")
                .initializer(TensorProto.ofFloats("W", List.of(2L), 1f, 2f))
                .input(f32("x", 2))
                .node(NodeProto.of("Add", List.of("x", "W"), List.of("sum")))
                .node(NodeProto.of("Relu", List.of("sum"), List.of("y")))
                .output("y")
                .build();
    }

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        void initializersBecomeNamedConstants() {
            GraphBuilder builder = builder(chain());

            Output w = builder.get("W");
            assertInstanceOf(Constant.class, w.node());
            assertEquals("W", w.node().displayName());
            assertEquals(Set.of("W"), w.names());
            assertEquals(PartialShape.of(2), w.shape());
            assertTrue(builder.warnings().isEmpty());
        }

        @Test
        void declaredInputsBecomeParametersInOrder() {
            GraphProto graph = GraphProto.builder("inputs")
                    .input(f32("x", 2, -1))
                    .input(ValueInfoProto.tensor("n", OnnxDataType.INT64))
                    .node(NodeProto.of("Add", List.of("x", "x"), List.of("y")))
                    .output("y")
                    .build();

            GraphBuilder builder = builder(graph);

            List<Parameter> parameters = builder.parameters();
            assertEquals(2, parameters.size());
            assertEquals("x", parameters.get(0).displayName());
            assertEquals(ElementType.F32, parameters.get(0).elementType());
            assertEquals(PartialShape.of(2, PartialShape.DYNAMIC_DIMENSION), parameters.get(0).shape());
            assertEquals("n", parameters.get(1).displayName());
            assertEquals(PartialShape.scalar(), parameters.get(1).shape());
        }

        @Test
        void inputShadowedByInitializerIsNotAParameter() {
            GraphProto graph = GraphProto.builder("shadowed")
                    .initializer(TensorProto.ofFloats("W", List.of(2L), 1f, 2f))
                    .input(f32("x", 2))
                    .input(f32("W", 2))
                    .node(NodeProto.of("Add", List.of("x", "W"), List.of("y")))
                    .output("y")
                    .build();

            GraphBuilder builder = builder(graph);

            assertEquals(1, builder.parameters().size());
            assertInstanceOf(Constant.class, builder.get("W").node());
        }

        @Test
        void undecodableInitializerDegradesToZeroScalar() {
            // 3 floats declared, 2 present
            TensorProto broken = TensorProto.ofFloats("bad", List.of(3L), 1f, 2f);
            GraphProto graph = GraphProto.builder("degraded")
                    .initializer(broken)
                    .input(f32("x", 2))
                    .node(NodeProto.of("Relu", List.of("x"), List.of("y")))
                    .output("y")
                    .build();

            GraphBuilder builder = builder(graph);

            Output bad = builder.get("bad");
            Constant constant = assertInstanceOf(Constant.class, bad.node());
            assertEquals(ElementType.F32, constant.elementType());
            assertEquals(PartialShape.scalar(), constant.shape());
            assertEquals(0f, constant.data().getFloat(0));
            assertEquals(1, builder.warnings().size());
            assertTrue(builder.warnings().get(0).contains("'bad'"));
        }

        @Test
        void oversizedInitializerDegradesToZeroScalar() {
            long huge = 1L << 32;
            GraphProto graph = GraphProto.builder("oversized")
                    .initializer(TensorProto.raw("T", OnnxDataType.FLOAT, List.of(huge, huge), new byte[0]))
                    .input(f32("x", 2))
                    .node(NodeProto.of("Relu", List.of("x"), List.of("y")))
                    .output("y")
                    .build();

            GraphBuilder builder = builder(graph);

            Constant constant = assertInstanceOf(Constant.class, builder.get("T").node());
            assertEquals(PartialShape.scalar(), constant.shape());
            assertEquals(1, builder.warnings().size());
            assertTrue(builder.warnings().get(0).contains("'T'"));
        }

        @Test
        void strictInitializersRejectUndecodableTensor() {
            GraphProto graph = GraphProto.builder("strict")
                    .initializer(TensorProto.ofFloats("bad", List.of(3L), 1f, 2f))
                    .build();

            ImportConfig strict = ImportConfig.defaults().withStrictInitializers(true);
            OnnxImportException e = assertThrows(OnnxImportException.class,
                    () -> new GraphBuilder(graph, TestOperators.model(), strict, null));
            assertFalse(e instanceof InvalidExternalDataException);
        }

        @Test
        void brokenExternalDataIsFatal() {
            TensorProto external = TensorProto.external("weights", OnnxDataType.FLOAT, List.of(4L),
                    Map.of("location", "does-not-exist.bin"));
            GraphProto graph = GraphProto.builder("external")
                    .initializer(external)
                    .input(f32("x", 4))
                    .node(NodeProto.of("Add", List.of("x", "weights"), List.of("y")))
                    .output("y")
                    .build();

            InvalidExternalDataException e = assertThrows(InvalidExternalDataException.class, () -> convert(graph));
            assertEquals("weights", e.getTensorName());
        }

        @Test
        void unnamedInitializersAreIgnored() {
            GraphProto graph = GraphProto.builder("unnamed")
                    .initializer(TensorProto.ofFloats("", List.of(1L), 1f))
                    .input(f32("x", 1))
                    .node(NodeProto.of("Relu", List.of("x"), List.of("y")))
                    .output("y")
                    .build();

            GraphBuilder builder = builder(graph);

            assertEquals(List.of("x"), builder.cache().names());
        }
    }

    @Nested
    @DisplayName("Operator availability")
    class AvailabilityTests {

        @Test
        void singleUnknownOperatorIsReported() {
            GraphProto graph = GraphProto.builder("unknown")
                    .input(f32("x", 2))
                    .node(NodeProto.of("FancyOp", List.of("x"), List.of("y")).withDomain("org.unknown"))
                    .output("y")
                    .build();

            UnsupportedOperatorException e = assertThrows(UnsupportedOperatorException.class, () -> convert(graph));
            assertEquals(Set.of("org.unknown.FancyOp"), e.getOperators());
            assertEquals("The following ONNX operations are not supported: org.unknown.FancyOp", e.getMessage());
        }

        @Test
        void everyDistinctUnknownOperatorIsReported() {
            GraphProto graph = GraphProto.builder("unknown")
                    .input(f32("x", 2))
                    .node(NodeProto.of("FancyOp", List.of("x"), List.of("a")).withDomain("org.unknown"))
                    .node(NodeProto.of("Weird", List.of("a"), List.of("b")))
                    .node(NodeProto.of("FancyOp", List.of("b"), List.of("y")).withDomain("org.unknown"))
                    .output("y")
                    .build();

            UnsupportedOperatorException e = assertThrows(UnsupportedOperatorException.class, () -> convert(graph));
            assertEquals(List.of("Weird", "org.unknown.FancyOp"), List.copyOf(e.getOperators()));
            assertEquals("The following ONNX operations are not supported: Weird, org.unknown.FancyOp", e.getMessage());
        }

        @Test
        void unimportedDomainIsEnabledFromProvider() {
            var registry = TestOperators.registry();
            registry.registerDomainProvider(TestOperators.CUSTOM_DOMAIN, r -> r.register(TestOperators.CUSTOM_DOMAIN,
                    "Scale", 1, node -> List.of(node.input(0))));
            GraphProto graph = GraphProto.builder("custom")
                    .input(f32("x", 2))
                    .node(NodeProto.of("Scale", List.of("x"), List.of("s")).withDomain(TestOperators.CUSTOM_DOMAIN))
                    .node(NodeProto.of("Relu", List.of("s"), List.of("y")))
                    .output("y")
                    .build();

            Function function = new GraphBuilder(graph, TestOperators.model(registry), ImportConfig.defaults(), null).convert();

            assertEquals(1, function.outputCount());
        }

        @Test
        void lazyRegistrationCanBeSwitchedOff() {
            var registry = TestOperators.registry();
            registry.registerDomainProvider(TestOperators.CUSTOM_DOMAIN, r -> r.register(TestOperators.CUSTOM_DOMAIN,
                    "Scale", 1, node -> List.of(node.input(0))));
            GraphProto graph = GraphProto.builder("custom")
                    .input(f32("x", 2))
                    .node(NodeProto.of("Scale", List.of("x"), List.of("y")).withDomain(TestOperators.CUSTOM_DOMAIN))
                    .output("y")
                    .build();
            ImportConfig config = ImportConfig.defaults().withLazyDomainRegistration(false);

            UnsupportedOperatorException e = assertThrows(UnsupportedOperatorException.class,
                    () -> new GraphBuilder(graph, TestOperators.model(registry), config, null));
            assertEquals(Set.of("com.example.Scale"), e.getOperators());
        }

        @Test
        void domainsAreRetriedOnlyOnce() {
            // The provider of com.a also registers com.b. A com.b node scanned before any com.a
            // node misses it: com.b was already tried, found empty, and is not tried again.
            GraphProto graph = GraphProto.builder("order")
                    .input(f32("x", 2))
                    .node(NodeProto.of("OpB", List.of("x"), List.of("b")).withDomain("com.b"))
                    .node(NodeProto.of("OpA", List.of("b"), List.of("y")).withDomain("com.a"))
                    .output("y")
                    .build();

            UnsupportedOperatorException e = assertThrows(UnsupportedOperatorException.class,
                    () -> new GraphBuilder(graph, TestOperators.model(crossDomainRegistry()), ImportConfig.defaults(), null));
            assertEquals(Set.of("com.b.OpB"), e.getOperators());
        }

        @Test
        void domainRegisteredByEarlierProviderIsFound() {
            GraphProto graph = GraphProto.builder("order")
                    .input(f32("x", 2))
                    .node(NodeProto.of("OpA", List.of("x"), List.of("a")).withDomain("com.a"))
                    .node(NodeProto.of("OpB", List.of("a"), List.of("y")).withDomain("com.b"))
                    .output("y")
                    .build();

            Function function = new GraphBuilder(graph, TestOperators.model(crossDomainRegistry()),
                    ImportConfig.defaults(), null).convert();

            assertEquals(1, function.outputCount());
        }

        private static io.surfworks.onnxgrinder.core.ops.OperatorRegistry crossDomainRegistry() {
            var registry = TestOperators.registry();
            registry.registerDomainProvider("com.a", r -> {
                r.register("com.a", "OpA", 1, node -> List.of(node.input(0)));
                r.register("com.b", "OpB", 1, node -> List.of(node.input(0)));
            });
            return registry;
        }

        @Test
        void telemetryReceivesNodeCountsPerOperator() {
            GraphProto graph = GraphProto.builder("counted")
                    .input(f32("x", 2))
                    .node(NodeProto.of("Add", List.of("x", "x"), List.of("a")))
                    .node(NodeProto.of("Relu", List.of("a"), List.of("b")))
                    .node(NodeProto.of("Add", List.of("b", "b"), List.of("y")))
                    .output("y")
                    .build();
            List<String> events = new java.util.ArrayList<>();

            new GraphBuilder(graph, TestOperators.model(), ImportConfig.defaults(),
                    (category, action, value) -> events.add(category + " " + action + " " + value));

            assertEquals(List.of("op_count onnx_Add 2", "op_count onnx_Relu 1"), events);
        }
    }

    @Nested
    @DisplayName("Conversion")
    class ConversionTests {

        @Test
        void convertChain() {
            Function function = convert(chain());

            assertEquals("chain", function.name());
            assertEquals(1, function.parameters().size());
            assertEquals(1, function.outputCount());
            assertEquals("y/sink_port_0", function.result(0).displayName());

            Output y = function.result(0).value();
            assertEquals("Relu", y.node().typeName());
            assertEquals("y", y.node().displayName());
            assertEquals(Set.of("y"), y.names());
            assertEquals(ElementType.F32, y.elementType());

            Node add = y.node().input(0).source().node();
            assertEquals("Add", add.typeName());
            assertSame(function.parameter(0).output(0), add.input(0).source());
        }

        @Test
        void namedNodeWithCommonProducerKeepsNodeName() {
            NodeProto split = NodeProto.of("Split", List.of("x"), List.of("a", "b")).withName("split1");
            GraphProto graph = GraphProto.builder("split")
                    .input(f32("x", 4))
                    .node(split)
                    .output("a")
                    .output("b")
                    .build();

            Function function = convert(graph);

            Output a = function.result(0).value();
            Output b = function.result(1).value();
            assertSame(a.node(), b.node());
            assertEquals("split1", a.node().displayName());
            assertEquals(Set.of("a"), a.names());
            assertEquals(Set.of("b"), b.names());
            assertEquals("a/sink_port_0", function.result(0).displayName());
            assertEquals("b/sink_port_1", function.result(1).displayName());
        }

        @Test
        void namedNodeWithDistinctProducersSuffixesOutputName() {
            NodeProto dual = NodeProto.of("DualOutput", List.of("x"), List.of("p", "q")).withName("dual");
            GraphProto graph = GraphProto.builder("dual")
                    .input(f32("x", 4))
                    .node(dual)
                    .output("p")
                    .output("q")
                    .build();

            Function function = convert(graph);

            assertEquals("dual_p", function.result(0).value().node().displayName());
            assertEquals("dual_q", function.result(1).value().node().displayName());
        }

        @Test
        void unnamedNodeTakesLastOutputName() {
            GraphProto graph = GraphProto.builder("split")
                    .input(f32("x", 4))
                    .node(NodeProto.of("Split", List.of("x"), List.of("a", "b")))
                    .output("a")
                    .output("b")
                    .build();

            Function function = convert(graph);

            assertEquals("b", function.result(0).value().node().displayName());
        }

        @Test
        void identityKeepsDeclaredOutputName() {
            GraphProto graph = GraphProto.builder("identity")
                    .input(f32("x", 2))
                    .node(NodeProto.of("Identity", List.of("x"), List.of("y")))
                    .output("y")
                    .build();

            Function function = convert(graph);

            Output y = function.result(0).value();
            assertTrue(y.hasName("y"));
            assertEquals("x", y.node().displayName());
            assertEquals("y/sink_port_0", function.result(0).displayName());
            // Unread apart from the result, but named like a graph output
            assertEquals(1, function.parameters().size());
        }

        @Test
        void trailingOmittedOutputsAreNotCached() {
            GraphProto graph = GraphProto.builder("dropout")
                    .input(f32("x", 4))
                    .node(NodeProto.of("Dropout", List.of("x"), List.of("d_out", "d_mask")))
                    .output("d_out")
                    .build();
            GraphBuilder builder = builder(graph);

            Function function = builder.convert();

            assertEquals(3, function.result(0).value().node().outputCount());
            assertEquals(List.of("x", "d_out", "d_mask"), builder.cache().names());
        }

        @Test
        void skippedOptionalOutputsAreNotCached() {
            GraphProto graph = GraphProto.builder("dropout")
                    .input(f32("x", 4))
                    .node(NodeProto.of("Dropout", List.of("x"), List.of("d_out", "", "aux")))
                    .output("d_out")
                    .output("aux")
                    .build();
            GraphBuilder builder = builder(graph);

            Function function = builder.convert();

            assertEquals(List.of("x", "d_out", "aux"), builder.cache().names());
            assertEquals("aux/sink_port_2", function.result(1).displayName());
        }

        @Test
        void danglingParametersArePruned() {
            GraphProto graph = GraphProto.builder("pruned")
                    .input(f32("x", 2))
                    .input(f32("unused", 2))
                    .node(NodeProto.of("Relu", List.of("x"), List.of("y")))
                    .output("y")
                    .build();
            GraphBuilder builder = builder(graph);

            Function function = builder.convert();

            assertEquals(List.of("x"), function.parameters().stream().map(Node::displayName).toList());
            assertFalse(builder.contains("unused"));
        }

        @Test
        void absentOptionalOutputsAreSkipped() {
            GraphProto graph = GraphProto.builder("optional")
                    .input(f32("x", 2))
                    .node(NodeProto.of("Relu", List.of("x"), List.of("y")))
                    .node(NodeProto.of("Identity", List.of(""), List.of("none")))
                    .output("y")
                    .output("none")
                    .build();

            Function function = convert(graph);

            assertEquals(1, function.outputCount());
            assertEquals("y/sink_port_0", function.result(0).displayName());
        }

        @Test
        void conversionIsDeterministic() {
            GraphProto graph = GraphProto.builder("twice")
                    .initializer(TensorProto.ofFloats("W", List.of(4L), 1f, 2f, 3f, 4f))
                    .input(f32("x", 4))
                    .input(f32("unused", 4))
                    .node(NodeProto.of("Add", List.of("x", "W"), List.of("s")))
                    .node(NodeProto.of("Split", List.of("s"), List.of("a", "b")).withName("split"))
                    .node(NodeProto.of("DualOutput", List.of("a"), List.of("p", "q")).withName("dual"))
                    .node(NodeProto.of("Mul", List.of("p", "b"), List.of("y")))
                    .output("y")
                    .output("q")
                    .build();

            assertEquals(FunctionJson.toJson(convert(graph)), FunctionJson.toJson(convert(graph)));
        }

        @Test
        void builderRunsOnlyOnePass() {
            GraphBuilder builder = builder(chain());
            builder.convert();

            assertThrows(IllegalStateException.class, builder::convert);
            assertThrows(IllegalStateException.class, builder::decode);
        }
    }

    @Nested
    @DisplayName("Conversion failures")
    class FailureTests {

        private GraphProto single(NodeProto node) {
            return GraphProto.builder("failing")
                    .input(f32("x", 2))
                    .node(node)
                    .output("y")
                    .build();
        }

        @Test
        void factoryExceptionIsWrappedWithNodeContext() {
            NodeProto node = NodeProto.of("FailingOp", List.of("x"), List.of("y")).withName("bad_node");

            NodeConversionException e = assertThrows(NodeConversionException.class, () -> convert(single(node)));
            assertEquals("FailingOp", e.getOpType());
            assertEquals("", e.getDomain());
            assertEquals("bad_node", e.getNodeName());
            assertInstanceOf(IllegalArgumentException.class, e.getCause());
            assertTrue(e.getMessage().startsWith("While validating ONNX node '<Node(FailingOp): bad_node>'"));
            assertTrue(e.getMessage().contains("input rank must be 2"));
        }

        @Test
        void validationFailurePassesThroughUnchanged() {
            NodeProto node = NodeProto.of("ValidatingOp", List.of("x"), List.of("y")).withName("v");

            NodeValidationException e = assertThrows(NodeValidationException.class, () -> convert(single(node)));
            assertEquals("While validating ONNX node '<Node(ValidatingOp): v>':\nattribute 'axis' is required",
                    e.getMessage());
        }

        @Test
        void errorsAreRethrownUnchanged() {
            NodeProto node = NodeProto.of("ErrorOp", List.of("x"), List.of("y"));

            AssertionError e = assertThrows(AssertionError.class, () -> convert(single(node)));
            assertEquals("corrupted state", e.getMessage());
        }

        @Test
        void missingOutputsAreRejected() {
            NodeProto node = NodeProto.of("ShortOp", List.of("x"), List.of("y"));

            NodeConversionException e = assertThrows(NodeConversionException.class, () -> convert(single(node)));
            assertTrue(e.getMessage().contains("produced 0 outputs"));
        }

        @Test
        void unknownSymbolIsReported() {
            NodeProto node = NodeProto.of("Add", List.of("x", "missing"), List.of("y"));

            UnknownSymbolException e = assertThrows(UnknownSymbolException.class, () -> convert(single(node)));
            assertEquals("missing", e.getSymbol());
        }

        @Test
        void unknownOperatorLookupFails() {
            OnnxModel model = TestOperators.model();

            assertThrows(UnsupportedOperatorException.class, () -> model.getOperator("Conv", ""));
        }
    }
}
