package io.surfworks.onnxgrinder.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Tensor shape whose rank and dimensions may be only partially known.
 *
 * <p>An unknown dimension is stored as {@link #DYNAMIC_DIMENSION}. A shape of unknown rank
 * has no dimension list at all.
 */
public final class PartialShape {

    public static final long DYNAMIC_DIMENSION = -1;

    private static final PartialShape DYNAMIC_RANK = new PartialShape(null);
    private static final PartialShape SCALAR = new PartialShape(List.of());

    private final List<Long> dimensions;

    private PartialShape(List<Long> dimensions) {
        this.dimensions = dimensions;
    }

    /**
     * Shape of unknown rank.
     */
    public static PartialShape dynamic() {
        return DYNAMIC_RANK;
    }

    public static PartialShape scalar() {
        return SCALAR;
    }

    /**
     * Shape of known rank. Negative dimensions are treated as unknown.
     */
    public static PartialShape of(long... dimensions) {
        List<Long> dims = new ArrayList<>(dimensions.length);
        for (long d : dimensions) {
            dims.add(d < 0 ? DYNAMIC_DIMENSION : d);
        }
        return new PartialShape(Collections.unmodifiableList(dims));
    }

    public static PartialShape of(List<Long> dimensions) {
        Objects.requireNonNull(dimensions, "dimensions cannot be null");
        long[] dims = new long[dimensions.size()];
        for (int i = 0; i < dims.length; i++) {
            dims[i] = dimensions.get(i);
        }
        return of(dims);
    }

    public boolean isRankStatic() {
        return dimensions != null;
    }

    /**
     * Number of dimensions.
     *
     * @throws IllegalStateException if the rank is unknown
     */
    public int rank() {
        if (dimensions == null) {
            throw new IllegalStateException("Rank of a dynamic shape is unknown");
        }
        return dimensions.size();
    }

    /**
     * Whether every dimension is known.
     */
    public boolean isStatic() {
        return dimensions != null && !dimensions.contains(DYNAMIC_DIMENSION);
    }

    public List<Long> dimensions() {
        if (dimensions == null) {
            throw new IllegalStateException("Dimensions of a dynamic shape are unknown");
        }
        return dimensions;
    }

    public long dimension(int index) {
        return dimensions().get(index);
    }

    /**
     * Total number of elements; only defined for static shapes.
     *
     * @throws ArithmeticException if the count does not fit in a {@code long}
     */
    public long elementCount() {
        if (!isStatic()) {
            throw new IllegalStateException("Element count of " + this + " is unknown");
        }
        long count = 1;
        for (long d : dimensions) {
            count = Math.multiplyExact(count, d);
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartialShape that)) return false;
        return Objects.equals(dimensions, that.dimensions);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(dimensions);
    }

    @Override
    public String toString() {
        if (dimensions == null) {
            return "[...]";
        }
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < dimensions.size(); i++) {
            if (i > 0) sb.append(",");
            long d = dimensions.get(i);
            sb.append(d == DYNAMIC_DIMENSION ? "?" : Long.toString(d));
        }
        return sb.append("]").toString();
    }
}
