package io.surfworks.onnxgrinder.model;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decoder for the ONNX protobuf format.
 *
 * <p>Only the fields the importer needs are decoded; everything else is skipped by wire
 * type. Repeated scalar fields are accepted in both packed and unpacked encodings.
 *
 * <p>Example usage:
 * <pre>{@code
 * ModelProto model = OnnxReader.load(Path.of("model.onnx"));
 * System.out.println("Producer: " + model.producer());
 * model.graph().nodes().forEach(System.out::println);
 * }</pre>
 */
public final class OnnxReader {

    private OnnxReader() {}

    /**
     * Load an ONNX model from file.
     */
    public static ModelProto load(Path path) throws IOException {
        return parse(Files.readAllBytes(path));
    }

    /**
     * Decode an ONNX model from its serialized bytes.
     *
     * @throws OnnxFormatException if the bytes are not a well-formed protobuf message
     */
    public static ModelProto parse(byte[] bytes) {
        return parseModel(new ProtobufParser(ByteBuffer.wrap(bytes)));
    }

    private static ModelProto parseModel(ProtobufParser parser) {
        long irVersion = 0;
        String producerName = "";
        String producerVersion = "";
        String domain = "";
        long modelVersion = 0;
        String docString = "";
        GraphProto graph = null;
        List<OperatorSetId> opsetImports = new ArrayList<>();
        Map<String, String> metadata = new LinkedHashMap<>();

        while (parser.hasMore()) {
            int tag = parser.readTag();
            int fieldNumber = tag >>> 3;
            int wireType = tag & 0x7;

            switch (fieldNumber) {
                case 1 -> irVersion = parser.readVarint();
                case 2 -> producerName = parser.readString();
                case 3 -> producerVersion = parser.readString();
                case 4 -> domain = parser.readString();
                case 5 -> modelVersion = parser.readVarint();
                case 6 -> docString = parser.readString();
                case 7 -> graph = parseGraph(parser.readMessage());
                case 8 -> opsetImports.add(parseOpsetId(parser.readMessage()));
                case 14 -> {
                    String[] entry = parseStringEntry(parser.readMessage());
                    if (!entry[0].isEmpty()) {
                        metadata.put(entry[0], entry[1]);
                    }
                }
                default -> parser.skip(wireType);
            }
        }

        if (graph == null) {
            graph = GraphProto.builder("").build();
        }
        return new ModelProto(irVersion, producerName, producerVersion, domain, modelVersion, docString,
                graph, opsetImports, metadata);
    }

    private static GraphProto parseGraph(ProtobufParser parser) {
        String name = "";
        List<NodeProto> nodes = new ArrayList<>();
        List<TensorProto> initializers = new ArrayList<>();
        List<ValueInfoProto> inputs = new ArrayList<>();
        List<ValueInfoProto> outputs = new ArrayList<>();
        List<ValueInfoProto> valueInfos = new ArrayList<>();

        while (parser.hasMore()) {
            int tag = parser.readTag();
            int fieldNumber = tag >>> 3;
            int wireType = tag & 0x7;

            switch (fieldNumber) {
                case 1 -> nodes.add(parseNode(parser.readMessage()));
                case 2 -> name = parser.readString();
                case 5 -> initializers.add(parseTensor(parser.readMessage()));
                case 11 -> inputs.add(parseValueInfo(parser.readMessage()));
                case 12 -> outputs.add(parseValueInfo(parser.readMessage()));
                case 13 -> valueInfos.add(parseValueInfo(parser.readMessage()));
                default -> parser.skip(wireType);
            }
        }

        return new GraphProto(name, nodes, initializers, inputs, outputs, valueInfos);
    }

    private static NodeProto parseNode(ProtobufParser parser) {
        List<String> inputs = new ArrayList<>();
        List<String> outputs = new ArrayList<>();
        List<AttributeProto> attributes = new ArrayList<>();
        String name = "";
        String opType = "";
        String domain = "";

        while (parser.hasMore()) {
            int tag = parser.readTag();
            int fieldNumber = tag >>> 3;
            int wireType = tag & 0x7;

            switch (fieldNumber) {
                case 1 -> inputs.add(parser.readString());
                case 2 -> outputs.add(parser.readString());
                case 3 -> name = parser.readString();
                case 4 -> opType = parser.readString();
                case 5 -> attributes.add(parseAttribute(parser.readMessage()));
                case 7 -> domain = parser.readString();
                default -> parser.skip(wireType);
            }
        }

        return new NodeProto(name, opType, domain, inputs, outputs, attributes);
    }

    private static AttributeProto parseAttribute(ProtobufParser parser) {
        String name = "";
        int typeCode = 0;
        float f = 0f;
        long i = 0;
        String s = "";
        TensorProto t = null;
        GraphProto g = null;
        List<Float> floats = new ArrayList<>();
        List<Long> ints = new ArrayList<>();
        List<String> strings = new ArrayList<>();
        List<GraphProto> graphs = new ArrayList<>();

        while (parser.hasMore()) {
            int tag = parser.readTag();
            int fieldNumber = tag >>> 3;
            int wireType = tag & 0x7;

            switch (fieldNumber) {
                case 1 -> name = parser.readString();
                case 2 -> f = parser.readFloat();
                case 3 -> i = parser.readVarint();
                case 4 -> s = parser.readString();
                case 5 -> t = parseTensor(parser.readMessage());
                case 6 -> g = parseGraph(parser.readMessage());
                case 7 -> parser.readFloats(wireType, floats);
                case 8 -> parser.readVarints(wireType, ints);
                case 9 -> strings.add(parser.readString());
                case 11 -> graphs.add(parseGraph(parser.readMessage()));
                case 20 -> typeCode = (int) parser.readVarint();
                default -> parser.skip(wireType);
            }
        }

        AttributeProto.Type type = AttributeProto.Type.fromCode(typeCode);
        if (type == AttributeProto.Type.UNDEFINED && g != null) {
            // Writers before IR version 4 did not emit the type field
            type = AttributeProto.Type.GRAPH;
        }
        return new AttributeProto(name, type, f, i, s, t, g, floats, ints, strings, graphs);
    }

    private static TensorProto parseTensor(ProtobufParser parser) {
        List<Long> dims = new ArrayList<>();
        int dataType = OnnxDataType.UNDEFINED;
        String name = "";
        byte[] rawData = null;
        List<Float> floatData = new ArrayList<>();
        List<Integer> int32Data = new ArrayList<>();
        List<Long> int64Data = new ArrayList<>();
        List<Double> doubleData = new ArrayList<>();
        TensorProto.DataLocation dataLocation = TensorProto.DataLocation.DEFAULT;
        Map<String, String> externalData = new LinkedHashMap<>();

        while (parser.hasMore()) {
            int tag = parser.readTag();
            int fieldNumber = tag >>> 3;
            int wireType = tag & 0x7;

            switch (fieldNumber) {
                case 1 -> parser.readVarints(wireType, dims);
                case 2 -> dataType = (int) parser.readVarint();
                case 4 -> parser.readFloats(wireType, floatData);
                case 5 -> {
                    List<Long> values = new ArrayList<>();
                    parser.readVarints(wireType, values);
                    values.forEach(v -> int32Data.add(v.intValue()));
                }
                case 7 -> parser.readVarints(wireType, int64Data);
                case 8 -> name = parser.readString();
                case 9 -> rawData = parser.readByteArray();
                case 10 -> parser.readDoubles(wireType, doubleData);
                case 13 -> {
                    String[] entry = parseStringEntry(parser.readMessage());
                    externalData.put(entry[0], entry[1]);
                }
                case 14 -> dataLocation = parser.readVarint() == 1
                        ? TensorProto.DataLocation.EXTERNAL
                        : TensorProto.DataLocation.DEFAULT;
                default -> parser.skip(wireType);
            }
        }

        return new TensorProto(name, dataType, dims, rawData, floatData, int32Data, int64Data, doubleData,
                dataLocation, externalData);
    }

    private static ValueInfoProto parseValueInfo(ProtobufParser parser) {
        String name = "";
        int elemType = OnnxDataType.UNDEFINED;
        List<ValueInfoProto.Dimension> shape = null;

        while (parser.hasMore()) {
            int tag = parser.readTag();
            int fieldNumber = tag >>> 3;
            int wireType = tag & 0x7;

            switch (fieldNumber) {
                case 1 -> name = parser.readString();
                case 2 -> {
                    // TypeProto: only tensor_type (field 1) is decoded
                    ProtobufParser typeParser = parser.readMessage();
                    while (typeParser.hasMore()) {
                        int typeTag = typeParser.readTag();
                        if ((typeTag >>> 3) != 1) {
                            typeParser.skip(typeTag & 0x7);
                            continue;
                        }
                        ProtobufParser tensorParser = typeParser.readMessage();
                        while (tensorParser.hasMore()) {
                            int tensorTag = tensorParser.readTag();
                            int tensorField = tensorTag >>> 3;
                            if (tensorField == 1) {
                                elemType = (int) tensorParser.readVarint();
                            } else if (tensorField == 2) {
                                shape = parseShape(tensorParser.readMessage());
                            } else {
                                tensorParser.skip(tensorTag & 0x7);
                            }
                        }
                    }
                }
                default -> parser.skip(wireType);
            }
        }

        return new ValueInfoProto(name, elemType, shape);
    }

    private static List<ValueInfoProto.Dimension> parseShape(ProtobufParser parser) {
        List<ValueInfoProto.Dimension> shape = new ArrayList<>();
        while (parser.hasMore()) {
            int tag = parser.readTag();
            if ((tag >>> 3) != 1) {
                parser.skip(tag & 0x7);
                continue;
            }
            ProtobufParser dimParser = parser.readMessage();
            ValueInfoProto.Dimension dim = ValueInfoProto.Dimension.param("");
            while (dimParser.hasMore()) {
                int dimTag = dimParser.readTag();
                int dimField = dimTag >>> 3;
                if (dimField == 1) dim = ValueInfoProto.Dimension.of(dimParser.readVarint());
                else if (dimField == 2) dim = ValueInfoProto.Dimension.param(dimParser.readString());
                else dimParser.skip(dimTag & 0x7);
            }
            shape.add(dim);
        }
        return shape;
    }

    private static OperatorSetId parseOpsetId(ProtobufParser parser) {
        String domain = "";
        long version = 0;

        while (parser.hasMore()) {
            int tag = parser.readTag();
            int fieldNumber = tag >>> 3;
            int wireType = tag & 0x7;

            switch (fieldNumber) {
                case 1 -> domain = parser.readString();
                case 2 -> version = parser.readVarint();
                default -> parser.skip(wireType);
            }
        }

        return new OperatorSetId(domain, version);
    }

    private static String[] parseStringEntry(ProtobufParser parser) {
        String key = "";
        String value = "";
        while (parser.hasMore()) {
            int tag = parser.readTag();
            int fieldNumber = tag >>> 3;
            if (fieldNumber == 1) key = parser.readString();
            else if (fieldNumber == 2) value = parser.readString();
            else parser.skip(tag & 0x7);
        }
        return new String[]{key, value};
    }

    /**
     * Minimal protobuf wire-format parser over a byte buffer slice.
     */
    private static final class ProtobufParser {
        private static final int WIRE_VARINT = 0;
        private static final int WIRE_FIXED64 = 1;
        private static final int WIRE_LENGTH_DELIMITED = 2;
        private static final int WIRE_FIXED32 = 5;

        private final ByteBuffer data;

        ProtobufParser(ByteBuffer data) {
            this.data = data.slice().order(ByteOrder.LITTLE_ENDIAN);
        }

        boolean hasMore() {
            return data.hasRemaining();
        }

        int readTag() {
            return (int) readVarint();
        }

        long readVarint() {
            long result = 0;
            int shift = 0;
            while (true) {
                if (!data.hasRemaining()) {
                    throw new OnnxFormatException("Truncated varint", data.position());
                }
                if (shift >= 64) {
                    throw new OnnxFormatException("Malformed varint", data.position());
                }
                byte b = data.get();
                result |= (long) (b & 0x7F) << shift;
                if ((b & 0x80) == 0) {
                    return result;
                }
                shift += 7;
            }
        }

        private int readLength() {
            long length = readVarint();
            if (length < 0 || length > data.remaining()) {
                throw new OnnxFormatException("Length " + length + " exceeds remaining " + data.remaining()
                        + " bytes", data.position());
            }
            return (int) length;
        }

        String readString() {
            return new String(readByteArray(), StandardCharsets.UTF_8);
        }

        byte[] readByteArray() {
            int length = readLength();
            byte[] bytes = new byte[length];
            data.get(bytes);
            return bytes;
        }

        ProtobufParser readMessage() {
            int length = readLength();
            ByteBuffer slice = data.slice();
            slice.limit(length);
            data.position(data.position() + length);
            return new ProtobufParser(slice);
        }

        float readFloat() {
            ensure(4);
            return data.getFloat();
        }

        double readDouble() {
            ensure(8);
            return data.getDouble();
        }

        void readVarints(int wireType, List<Long> into) {
            if (wireType == WIRE_LENGTH_DELIMITED) {
                ProtobufParser packed = readMessage();
                while (packed.hasMore()) {
                    into.add(packed.readVarint());
                }
            } else {
                into.add(readVarint());
            }
        }

        void readFloats(int wireType, List<Float> into) {
            if (wireType == WIRE_LENGTH_DELIMITED) {
                ProtobufParser packed = readMessage();
                while (packed.hasMore()) {
                    into.add(packed.readFloat());
                }
            } else {
                into.add(readFloat());
            }
        }

        void readDoubles(int wireType, List<Double> into) {
            if (wireType == WIRE_LENGTH_DELIMITED) {
                ProtobufParser packed = readMessage();
                while (packed.hasMore()) {
                    into.add(packed.readDouble());
                }
            } else {
                into.add(readDouble());
            }
        }

        private void ensure(int bytes) {
            if (data.remaining() < bytes) {
                throw new OnnxFormatException("Truncated fixed-width field", data.position());
            }
        }

        void skip(int wireType) {
            switch (wireType) {
                case WIRE_VARINT -> readVarint();
                case WIRE_FIXED64 -> {
                    ensure(8);
                    data.position(data.position() + 8);
                }
                case WIRE_LENGTH_DELIMITED -> {
                    int length = readLength();
                    data.position(data.position() + length);
                }
                case WIRE_FIXED32 -> {
                    ensure(4);
                    data.position(data.position() + 4);
                }
                default -> throw new OnnxFormatException("Unknown wire type: " + wireType, data.position());
            }
        }
    }
}
