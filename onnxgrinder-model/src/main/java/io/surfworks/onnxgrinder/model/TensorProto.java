package io.surfworks.onnxgrinder.model;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serialized tensor, used for initializers and tensor attributes.
 *
 * <p>Data lives in exactly one place: {@code rawData}, one of the typed lists, or an
 * external file described by {@code externalData} when {@code dataLocation} is
 * {@link DataLocation#EXTERNAL}.
 *
 * @param name         tensor name (may be empty)
 * @param dataType     ONNX data type code
 * @param dims         dimensions
 * @param rawData      little-endian raw bytes, or null
 * @param floatData    float_data field
 * @param int32Data    int32_data field (also carries 8/16-bit and bool values)
 * @param int64Data    int64_data field
 * @param doubleData   double_data field
 * @param dataLocation where the data lives
 * @param externalData external data entries ({@code location}, {@code offset}, {@code length})
 */
public record TensorProto(
        String name,
        int dataType,
        List<Long> dims,
        byte[] rawData,
        List<Float> floatData,
        List<Integer> int32Data,
        List<Long> int64Data,
        List<Double> doubleData,
        DataLocation dataLocation,
        Map<String, String> externalData
) {

    public enum DataLocation {
        DEFAULT,
        EXTERNAL
    }

    public TensorProto {
        Objects.requireNonNull(name, "name cannot be null");
        dims = List.copyOf(dims);
        floatData = List.copyOf(floatData);
        int32Data = List.copyOf(int32Data);
        int64Data = List.copyOf(int64Data);
        doubleData = List.copyOf(doubleData);
        dataLocation = dataLocation == null ? DataLocation.DEFAULT : dataLocation;
        externalData = Map.copyOf(externalData);
    }

    /**
     * Tensor backed by raw little-endian bytes.
     */
    public static TensorProto raw(String name, int dataType, List<Long> dims, byte[] rawData) {
        return new TensorProto(name, dataType, dims, rawData,
                List.of(), List.of(), List.of(), List.of(), DataLocation.DEFAULT, Map.of());
    }

    /**
     * FLOAT tensor backed by raw bytes.
     */
    public static TensorProto ofFloats(String name, List<Long> dims, float... values) {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float v : values) {
            buffer.putFloat(v);
        }
        return raw(name, OnnxDataType.FLOAT, dims, buffer.array());
    }

    /**
     * INT64 tensor stored in the typed int64_data field.
     */
    public static TensorProto ofLongs(String name, List<Long> dims, long... values) {
        return new TensorProto(name, OnnxDataType.INT64, dims, null,
                List.of(), List.of(), Arrays.stream(values).boxed().toList(), List.of(),
                DataLocation.DEFAULT, Map.of());
    }

    /**
     * Tensor whose data lives in an external file.
     */
    public static TensorProto external(String name, int dataType, List<Long> dims, Map<String, String> externalData) {
        return new TensorProto(name, dataType, dims, null,
                List.of(), List.of(), List.of(), List.of(), DataLocation.EXTERNAL, externalData);
    }

    public boolean hasName() {
        return !name.isEmpty();
    }

    public boolean hasRawData() {
        return rawData != null && rawData.length > 0;
    }

    public boolean isExternal() {
        return dataLocation == DataLocation.EXTERNAL;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TensorProto other)) return false;
        return name.equals(other.name)
                && dataType == other.dataType
                && dims.equals(other.dims)
                && Arrays.equals(rawData, other.rawData)
                && floatData.equals(other.floatData)
                && int32Data.equals(other.int32Data)
                && int64Data.equals(other.int64Data)
                && doubleData.equals(other.doubleData)
                && dataLocation == other.dataLocation
                && externalData.equals(other.externalData);
    }

    @Override
    public int hashCode() {
        int result = name.hashCode();
        result = 31 * result + dataType;
        result = 31 * result + dims.hashCode();
        result = 31 * result + Arrays.hashCode(rawData);
        result = 31 * result + dataLocation.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return String.format("TensorProto[%s: %s %s%s]",
                name, OnnxDataType.name(dataType), dims, isExternal() ? " external" : "");
    }
}
