package io.surfworks.onnxgrinder.ir;

/**
 * Element types of IR values.
 *
 * <p>{@link #DYNAMIC} marks a value whose element type is not known yet, e.g. the outputs
 * of a framework node or a parameter declared without a type.
 */
public enum ElementType {

    DYNAMIC("dynamic", 0, false),

    // Floating point
    F16("f16", 2, true),
    BF16("bf16", 2, true),
    F32("f32", 4, true),
    F64("f64", 8, true),

    // Signed integers
    I8("i8", 1, false),
    I16("i16", 2, false),
    I32("i32", 4, false),
    I64("i64", 8, false),

    // Unsigned integers
    U8("u8", 1, false),
    U16("u16", 2, false),
    U32("u32", 4, false),
    U64("u64", 8, false),

    BOOLEAN("boolean", 1, false),

    // Variable-length, no fixed byte size
    STRING("string", -1, false);

    private final String typeName;
    private final int byteSize;
    private final boolean floating;

    ElementType(String typeName, int byteSize, boolean floating) {
        this.typeName = typeName;
        this.byteSize = byteSize;
        this.floating = floating;
    }

    /**
     * Bytes per element, 0 for {@link #DYNAMIC} and -1 for {@link #STRING}.
     */
    public int byteSize() {
        return byteSize;
    }

    public boolean isFloating() {
        return floating;
    }

    public boolean isDynamic() {
        return this == DYNAMIC;
    }

    /**
     * Whether elements of this type have a fixed width and can back a constant.
     */
    public boolean hasFixedSize() {
        return byteSize > 0;
    }

    public String typeName() {
        return typeName;
    }

    @Override
    public String toString() {
        return typeName;
    }
}
