package io.surfworks.onnxgrinder.core.ops;

import io.surfworks.onnxgrinder.core.UnsupportedOperatorException;
import io.surfworks.onnxgrinder.model.NodeProto;
import io.surfworks.onnxgrinder.model.OperatorSetId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OperatorRegistryTest {

    private static final OperatorFactory V1 = node -> List.of();
    private static final OperatorFactory V13 = node -> List.of();

    @Nested
    @DisplayName("Versioning")
    class VersionTests {

        @Test
        void latestRegistrationNotAboveOpsetWins() {
            OperatorRegistry registry = new OperatorRegistry()
                    .register("", "Softmax", 1, V1)
                    .register("", "Softmax", 13, V13);

            assertSame(V1, registry.operatorSet("", 12).get("Softmax").orElseThrow());
            assertSame(V13, registry.operatorSet("", 13).get("Softmax").orElseThrow());
            assertSame(V13, registry.operatorSet("", 18).get("Softmax").orElseThrow());
        }

        @Test
        void operatorNewerThanOpsetIsAbsent() {
            OperatorRegistry registry = new OperatorRegistry().register("", "Gelu", 20, V1);

            assertFalse(registry.operatorSet("", 17).contains("Gelu"));
        }

        @Test
        void aiOnnxIsTheDefaultDomain() {
            OperatorRegistry registry = new OperatorRegistry().register("ai.onnx", "Relu", 6, V1);

            assertTrue(registry.hasDomain(""));
            assertTrue(registry.operatorSet("", 13).contains("Relu"));
            assertEquals("", registry.operatorSet("ai.onnx", 13).domain());
        }

        @Test
        void latestVersionOfDomain() {
            OperatorRegistry registry = new OperatorRegistry()
                    .register("com.example", "A", 1, V1)
                    .register("com.example", "B", 3, V1);

            assertEquals(OptionalLong.of(3), registry.latestVersion("com.example"));
            assertEquals(OptionalLong.empty(), registry.latestVersion("com.other"));
        }

        @Test
        void sinceVersionMustBePositive() {
            assertThrows(IllegalArgumentException.class, () -> new OperatorRegistry().register("", "Relu", 0, V1));
        }
    }

    @Nested
    @DisplayName("Model binding")
    class ModelTests {

        @Test
        void availabilityFollowsImportedOpset() {
            OperatorRegistry registry = new OperatorRegistry().register("", "Gelu", 20, V1);
            OnnxModel old = new OnnxModel(List.of(OperatorSetId.defaultDomain(17)), registry);
            OnnxModel recent = new OnnxModel(List.of(OperatorSetId.defaultDomain(20)), registry);
            NodeProto gelu = NodeProto.of("Gelu", List.of("x"), List.of("y"));

            assertFalse(old.isOperatorAvailable(gelu));
            assertTrue(recent.isOperatorAvailable(gelu));
        }

        @Test
        void enablingDomainRunsProviderOnce() {
            AtomicInteger calls = new AtomicInteger();
            OperatorRegistry registry = new OperatorRegistry().registerDomainProvider("com.example", r -> {
                calls.incrementAndGet();
                r.register("com.example", "Custom", 2, V1);
            });
            OnnxModel model = new OnnxModel(List.of(OperatorSetId.defaultDomain(13)), registry);
            NodeProto custom = NodeProto.of("Custom", List.of("x"), List.of("y")).withDomain("com.example");

            assertFalse(model.isOperatorAvailable(custom));
            model.enableOpsetDomain("com.example");
            model.enableOpsetDomain("com.example");

            assertTrue(model.isOperatorAvailable(custom));
            assertEquals(1, calls.get());
            assertTrue(model.enabledDomains().contains("com.example"));
        }

        @Test
        void failedProviderCanRunAgain() {
            AtomicInteger calls = new AtomicInteger();
            OperatorRegistry registry = new OperatorRegistry().registerDomainProvider("com.example", r -> {
                if (calls.incrementAndGet() == 1) {
                    throw new IllegalStateException("operator library not ready");
                }
                r.register("com.example", "Custom", 1, V1);
            });

            assertThrows(IllegalStateException.class, () -> registry.ensureDomain("com.example"));
            assertFalse(registry.hasDomain("com.example"));

            assertTrue(registry.ensureDomain("com.example"));
            assertTrue(registry.ensureDomain("com.example"));
            assertEquals(2, calls.get());
        }

        @Test
        void importedDomainsRunTheirProvider() {
            OperatorRegistry registry = new OperatorRegistry().registerDomainProvider("com.example",
                    r -> r.register("com.example", "Custom", 1, V1));
            OnnxModel model = new OnnxModel(List.of(new OperatorSetId("com.example", 1)), registry);

            assertSame(V1, model.getOperator("Custom", "com.example"));
        }

        @Test
        void enablingUnknownDomainDoesNothing() {
            OnnxModel model = new OnnxModel(List.of(OperatorSetId.defaultDomain(13)), new OperatorRegistry());

            model.enableOpsetDomain("org.nowhere");

            assertFalse(model.enabledDomains().contains("org.nowhere"));
        }

        @Test
        void missingOperatorIsUnsupported() {
            OnnxModel model = new OnnxModel(List.of(OperatorSetId.defaultDomain(13)), new OperatorRegistry());

            UnsupportedOperatorException e = assertThrows(UnsupportedOperatorException.class,
                    () -> model.getOperator("Conv", "com.vendor"));
            assertEquals("The following ONNX operations are not supported: com.vendor.Conv", e.getMessage());
        }

        @Test
        void operatorIdentifiers() {
            assertEquals("Conv", OnnxModel.operatorIdentifier("", "Conv"));
            assertEquals("Conv", OnnxModel.operatorIdentifier("ai.onnx", "Conv"));
            assertEquals("com.microsoft.Attention", OnnxModel.operatorIdentifier("com.microsoft", "Attention"));
        }
    }
}
