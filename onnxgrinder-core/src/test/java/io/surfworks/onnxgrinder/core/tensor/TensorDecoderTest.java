package io.surfworks.onnxgrinder.core.tensor;

import io.surfworks.onnxgrinder.core.InvalidExternalDataException;
import io.surfworks.onnxgrinder.core.OnnxImportException;
import io.surfworks.onnxgrinder.ir.Constant;
import io.surfworks.onnxgrinder.ir.ElementType;
import io.surfworks.onnxgrinder.ir.PartialShape;
import io.surfworks.onnxgrinder.model.OnnxDataType;
import io.surfworks.onnxgrinder.model.TensorProto;
import io.surfworks.onnxgrinder.model.ValueInfoProto;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TensorDecoderTest {

    @TempDir
    Path tempDir;

    private static byte[] floats(float... values) {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * 4).order(ByteOrder.LITTLE_ENDIAN);
        for (float v : values) {
            buffer.putFloat(v);
        }
        return buffer.array();
    }

    @Nested
    @DisplayName("Inline data")
    class InlineTests {

        @Test
        void decodeRawFloats() {
            Constant constant = new TensorDecoder(null).decode(TensorProto.ofFloats("w", List.of(2L, 2L), 1f, 2f, 3f, 4f));

            assertEquals(ElementType.F32, constant.elementType());
            assertEquals(PartialShape.of(2, 2), constant.shape());
            assertEquals(3f, constant.data().getFloat(8));
        }

        @Test
        void decodeTypedInt64() {
            Constant constant = new TensorDecoder(null).decode(TensorProto.ofLongs("shape", List.of(3L), 1, -1, 7));

            assertEquals(ElementType.I64, constant.elementType());
            assertEquals(-1L, constant.data().getLong(8));
        }

        @Test
        void decodeBoolsFromInt32Field() {
            TensorProto mask = new TensorProto("mask", OnnxDataType.BOOL, List.of(3L), null,
                    List.of(), List.of(1, 0, 1), List.of(), List.of(), null, Map.of());

            Constant constant = new TensorDecoder(null).decode(mask);

            assertEquals(3, constant.byteSize());
            assertEquals(1, constant.data().get(2));
        }

        @Test
        void decodeEmptyTensor() {
            Constant constant = new TensorDecoder(null).decode(TensorProto.ofFloats("empty", List.of(0L)));

            assertEquals(0, constant.byteSize());
        }

        @Test
        void sizeMismatchIsRecoverable() {
            OnnxImportException e = assertThrows(OnnxImportException.class,
                    () -> new TensorDecoder(null).decode(TensorProto.ofFloats("w", List.of(4L), 1f)));
            assertFalse(e instanceof InvalidExternalDataException);
        }

        @Test
        void overflowingElementCountIsRecoverable() {
            // 2^32 * 2^32 wraps to zero in long arithmetic and would match the empty data
            long huge = 1L << 32;
            TensorProto tensor = TensorProto.raw("T", OnnxDataType.FLOAT, List.of(huge, huge), new byte[0]);

            OnnxImportException e = assertThrows(OnnxImportException.class,
                    () -> new TensorDecoder(null).decode(tensor));
            assertFalse(e instanceof InvalidExternalDataException);
            assertTrue(e.getMessage().contains("too large"));
        }

        @Test
        void stringTensorsAreUnsupported() {
            TensorProto strings = TensorProto.raw("s", OnnxDataType.STRING, List.of(1L), new byte[]{'a'});

            assertThrows(OnnxImportException.class, () -> new TensorDecoder(null).decode(strings));
        }
    }

    @Nested
    @DisplayName("External data")
    class ExternalTests {

        private TensorProto external(Map<String, String> info, long... dims) {
            List<Long> shape = java.util.Arrays.stream(dims).boxed().toList();
            return TensorProto.external("weights", OnnxDataType.FLOAT, shape, info);
        }

        @Test
        void readWholeFile() throws IOException {
            Files.write(tempDir.resolve("weights.bin"), floats(1f, 2f));

            Constant constant = new TensorDecoder(tempDir).decode(external(Map.of("location", "weights.bin"), 2));

            assertEquals(2f, constant.data().getFloat(4));
        }

        @Test
        void readRangeWithOffsetAndLength() throws IOException {
            Files.write(tempDir.resolve("packed.bin"), floats(9f, 1f, 2f, 9f));

            Constant constant = new TensorDecoder(tempDir).decode(
                    external(Map.of("location", "packed.bin", "offset", "4", "length", "8"), 2));

            assertEquals(1f, constant.data().getFloat(0));
            assertEquals(2f, constant.data().getFloat(4));
        }

        @Test
        void missingFileIsInvalid() {
            InvalidExternalDataException e = assertThrows(InvalidExternalDataException.class,
                    () -> new TensorDecoder(tempDir).decode(external(Map.of("location", "absent.bin"), 2)));
            assertEquals("weights", e.getTensorName());
        }

        @Test
        void missingLocationIsInvalid() {
            assertThrows(InvalidExternalDataException.class,
                    () -> new TensorDecoder(tempDir).decode(external(Map.of("offset", "0"), 2)));
        }

        @Test
        void locationOutsideBaseDirectoryIsInvalid() throws IOException {
            Path base = Files.createDirectory(tempDir.resolve("model"));
            Files.write(tempDir.resolve("secret.bin"), floats(1f, 2f));

            InvalidExternalDataException e = assertThrows(InvalidExternalDataException.class,
                    () -> new TensorDecoder(base).decode(external(Map.of("location", "../secret.bin"), 2)));
            assertTrue(e.getMessage().contains("outside"));
        }

        @Test
        void rangeBeyondFileIsInvalid() throws IOException {
            Files.write(tempDir.resolve("short.bin"), floats(1f));

            assertThrows(InvalidExternalDataException.class, () -> new TensorDecoder(tempDir).decode(
                    external(Map.of("location", "short.bin", "offset", "0", "length", "8"), 2)));
        }

        @Test
        void malformedOffsetIsInvalid() throws IOException {
            Files.write(tempDir.resolve("weights.bin"), floats(1f, 2f));

            assertThrows(InvalidExternalDataException.class, () -> new TensorDecoder(tempDir).decode(
                    external(Map.of("location", "weights.bin", "offset", "four"), 2)));
        }
    }

    @Test
    void declaredShapes() {
        assertEquals(PartialShape.dynamic(), OnnxTypes.shape(ValueInfoProto.untyped("y")));
        assertEquals(PartialShape.of(PartialShape.DYNAMIC_DIMENSION, 3),
                OnnxTypes.shape(ValueInfoProto.tensor("x", OnnxDataType.FLOAT, -1, 3)));
        assertEquals(ElementType.DYNAMIC, OnnxTypes.elementType(OnnxDataType.UNDEFINED));
        assertThrows(OnnxImportException.class, () -> OnnxTypes.elementType(OnnxDataType.COMPLEX64));
    }
}
