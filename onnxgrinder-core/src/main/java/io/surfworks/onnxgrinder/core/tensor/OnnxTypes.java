package io.surfworks.onnxgrinder.core.tensor;

import io.surfworks.onnxgrinder.core.OnnxImportException;
import io.surfworks.onnxgrinder.ir.ElementType;
import io.surfworks.onnxgrinder.ir.PartialShape;
import io.surfworks.onnxgrinder.model.OnnxDataType;
import io.surfworks.onnxgrinder.model.ValueInfoProto;

import java.util.ArrayList;
import java.util.List;

/**
 * Mapping from ONNX type information to IR element types and shapes.
 */
public final class OnnxTypes {

    private OnnxTypes() {}

    /**
     * IR element type of an ONNX data type code. {@code UNDEFINED} maps to
     * {@link ElementType#DYNAMIC}.
     *
     * @throws OnnxImportException for complex and unknown codes
     */
    public static ElementType elementType(int dataType) {
        return switch (dataType) {
            case OnnxDataType.UNDEFINED -> ElementType.DYNAMIC;
            case OnnxDataType.FLOAT -> ElementType.F32;
            case OnnxDataType.DOUBLE -> ElementType.F64;
            case OnnxDataType.FLOAT16 -> ElementType.F16;
            case OnnxDataType.BFLOAT16 -> ElementType.BF16;
            case OnnxDataType.INT8 -> ElementType.I8;
            case OnnxDataType.INT16 -> ElementType.I16;
            case OnnxDataType.INT32 -> ElementType.I32;
            case OnnxDataType.INT64 -> ElementType.I64;
            case OnnxDataType.UINT8 -> ElementType.U8;
            case OnnxDataType.UINT16 -> ElementType.U16;
            case OnnxDataType.UINT32 -> ElementType.U32;
            case OnnxDataType.UINT64 -> ElementType.U64;
            case OnnxDataType.BOOL -> ElementType.BOOLEAN;
            case OnnxDataType.STRING -> ElementType.STRING;
            default -> throw new OnnxImportException(
                    "Unsupported ONNX data type: " + OnnxDataType.name(dataType));
        };
    }

    /**
     * Declared shape of a value; unknown rank when no shape is declared and a dynamic
     * dimension for every symbolic or missing one.
     */
    public static PartialShape shape(ValueInfoProto info) {
        if (!info.hasShape()) {
            return PartialShape.dynamic();
        }
        List<Long> dims = new ArrayList<>(info.shape().size());
        for (ValueInfoProto.Dimension dim : info.shape()) {
            dims.add(dim.isKnown() ? dim.value() : PartialShape.DYNAMIC_DIMENSION);
        }
        return PartialShape.of(dims);
    }
}
