package io.surfworks.onnxgrinder.core.tensor;

import io.surfworks.onnxgrinder.core.InvalidExternalDataException;
import io.surfworks.onnxgrinder.core.OnnxImportException;
import io.surfworks.onnxgrinder.ir.Constant;
import io.surfworks.onnxgrinder.ir.ElementType;
import io.surfworks.onnxgrinder.ir.PartialShape;
import io.surfworks.onnxgrinder.model.TensorProto;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Decodes serialized tensors into IR constants.
 *
 * <p>Data is taken from {@code raw_data}, from the typed repeated fields, or from an
 * external file. External locations are resolved against the base directory and must not
 * leave it.
 */
public final class TensorDecoder {

    private static final Logger LOG = Logger.getLogger(TensorDecoder.class.getName());

    public static final String LOCATION_KEY = "location";
    public static final String OFFSET_KEY = "offset";
    public static final String LENGTH_KEY = "length";

    private final Path baseDirectory;

    /**
     * @param baseDirectory directory external data locations are relative to; null if the
     *                      model has no location on disk
     */
    public TensorDecoder(Path baseDirectory) {
        this.baseDirectory = baseDirectory == null ? null : baseDirectory.toAbsolutePath().normalize();
    }

    public Path baseDirectory() {
        return baseDirectory;
    }

    /**
     * @throws InvalidExternalDataException if the tensor's external data reference is
     *                                      malformed or unreadable
     * @throws OnnxImportException          if the tensor cannot be represented as a constant
     */
    public Constant decode(TensorProto tensor) {
        ElementType elementType = OnnxTypes.elementType(tensor.dataType());
        if (!elementType.hasFixedSize()) {
            throw new OnnxImportException("Tensor '" + tensor.name() + "' has unsupported element type " + elementType);
        }
        for (long dim : tensor.dims()) {
            if (dim < 0) {
                throw new OnnxImportException("Tensor '" + tensor.name() + "' has negative dimension " + dim);
            }
        }
        PartialShape shape = PartialShape.of(tensor.dims());
        long expected;
        try {
            expected = Math.multiplyExact(shape.elementCount(), (long) elementType.byteSize());
        } catch (ArithmeticException e) {
            throw new OnnxImportException("Tensor '" + tensor.name() + "' of " + elementType + shape
                    + " is too large to hold", e);
        }

        byte[] data = tensor.isExternal() ? readExternal(tensor) : readInline(tensor, elementType);
        if (data.length != expected) {
            throw new OnnxImportException(String.format(
                    "Tensor '%s' of %s%s needs %d bytes but holds %d",
                    tensor.name(), elementType, shape, expected, data.length));
        }
        return new Constant(elementType, shape, data);
    }

    private static byte[] readInline(TensorProto tensor, ElementType elementType) {
        if (tensor.hasRawData()) {
            return tensor.rawData();
        }
        if (!tensor.floatData().isEmpty()) {
            ByteBuffer buffer = allocate(tensor.floatData().size() * Float.BYTES);
            tensor.floatData().forEach(buffer::putFloat);
            return buffer.array();
        }
        if (!tensor.doubleData().isEmpty()) {
            ByteBuffer buffer = allocate(tensor.doubleData().size() * Double.BYTES);
            tensor.doubleData().forEach(buffer::putDouble);
            return buffer.array();
        }
        if (!tensor.int64Data().isEmpty()) {
            int width = elementType.byteSize();
            ByteBuffer buffer = allocate(tensor.int64Data().size() * width);
            for (long v : tensor.int64Data()) {
                if (width == Long.BYTES) {
                    buffer.putLong(v);
                } else {
                    buffer.putInt((int) v);
                }
            }
            return buffer.array();
        }
        if (!tensor.int32Data().isEmpty()) {
            // int32_data also carries the narrow integer, bool and 16-bit float types
            int width = elementType.byteSize();
            ByteBuffer buffer = allocate(tensor.int32Data().size() * width);
            for (int v : tensor.int32Data()) {
                switch (width) {
                    case 1 -> buffer.put((byte) v);
                    case 2 -> buffer.putShort((short) v);
                    case 4 -> buffer.putInt(v);
                    default -> buffer.putLong(v);
                }
            }
            return buffer.array();
        }
        return new byte[0];
    }

    private byte[] readExternal(TensorProto tensor) {
        Map<String, String> info = tensor.externalData();
        String location = info.get(LOCATION_KEY);
        if (location == null || location.isEmpty()) {
            throw new InvalidExternalDataException(tensor.name(), "no location given");
        }
        if (baseDirectory == null) {
            throw new InvalidExternalDataException(tensor.name(),
                    "location '" + location + "' cannot be resolved without a model directory");
        }
        Path file = baseDirectory.resolve(location).normalize();
        if (!file.startsWith(baseDirectory)) {
            throw new InvalidExternalDataException(tensor.name(),
                    "location '" + location + "' points outside " + baseDirectory);
        }
        if (!Files.isRegularFile(file)) {
            throw new InvalidExternalDataException(tensor.name(), "file " + file + " does not exist");
        }

        long offset = parseField(tensor, info, OFFSET_KEY, 0);
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long fileSize = channel.size();
            long length = parseField(tensor, info, LENGTH_KEY, fileSize - offset);
            if (offset < 0 || length < 0 || offset + length > fileSize) {
                throw new InvalidExternalDataException(tensor.name(), String.format(
                        "range [%d, %d) exceeds the %d bytes of %s", offset, offset + length, fileSize, file));
            }
            if (length > Integer.MAX_VALUE) {
                throw new InvalidExternalDataException(tensor.name(), length + " bytes is too large to load");
            }
            ByteBuffer buffer = ByteBuffer.allocate((int) length);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer, offset + buffer.position()) < 0) {
                    throw new InvalidExternalDataException(tensor.name(), "unexpected end of " + file);
                }
            }
            LOG.fine(() -> "Loaded " + length + " bytes for '" + tensor.name() + "' from " + file);
            return buffer.array();
        } catch (IOException e) {
            throw new InvalidExternalDataException(tensor.name(), "cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    private static long parseField(TensorProto tensor, Map<String, String> info, String key, long fallback) {
        String value = info.get(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidExternalDataException(tensor.name(), "malformed " + key + " '" + value + "'", e);
        }
    }

    private static ByteBuffer allocate(int size) {
        return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    }
}
