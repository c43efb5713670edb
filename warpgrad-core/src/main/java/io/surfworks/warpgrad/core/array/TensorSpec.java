package io.surfworks.warpgrad.core.array;

import java.util.Arrays;

/**
 * Array specification: shape, dtype, and computed strides.
 * Immutable metadata describing array layout.
 */
public record TensorSpec(
    int[] shape,
    ScalarType dtype,
    long[] strides
) {
    /**
     * Create a TensorSpec with row-major (C-contiguous) strides.
     */
    public static TensorSpec of(ScalarType dtype, int... shape) {
        for (int dim : shape) {
            if (dim < 0) {
                throw new IllegalArgumentException("Negative dimension in shape " + Arrays.toString(shape));
            }
        }
        long[] strides = computeRowMajorStrides(shape);
        return new TensorSpec(shape.clone(), dtype, strides);
    }

    /**
     * Same shape, different dtype.
     */
    public TensorSpec withDtype(ScalarType newDtype) {
        return of(newDtype, shape);
    }

    /**
     * Number of dimensions.
     */
    public int rank() {
        return shape.length;
    }

    /**
     * Total number of elements.
     */
    public long elementCount() {
        return elementCount(shape);
    }

    /**
     * Total size in bytes.
     */
    public long byteSize() {
        return elementCount() * dtype.byteSize();
    }

    /**
     * Compute flat index from multi-dimensional indices.
     */
    public long flatIndex(int... indices) {
        if (indices.length != shape.length) {
            throw new IllegalArgumentException(
                "Expected " + shape.length + " indices, got " + indices.length);
        }
        long idx = 0;
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] < 0 || indices[i] >= shape[i]) {
                throw new IndexOutOfBoundsException(
                    "Index " + indices[i] + " out of bounds for dimension " + i + " with size " + shape[i]);
            }
            idx += indices[i] * strides[i];
        }
        return idx;
    }

    /**
     * Check if shapes are equal.
     */
    public boolean shapeEquals(TensorSpec other) {
        return Arrays.equals(this.shape, other.shape);
    }

    /**
     * Check if this shape can be broadcast to {@code target}.
     */
    public boolean isBroadcastableTo(int[] target) {
        if (shape.length > target.length) {
            return false;
        }
        int offset = target.length - shape.length;
        for (int i = 0; i < shape.length; i++) {
            if (shape[i] != 1 && shape[i] != target[offset + i]) {
                return false;
            }
        }
        return true;
    }

    public static long elementCount(int[] shape) {
        long count = 1;
        for (int dim : shape) {
            count *= dim;
        }
        return count;
    }

    /**
     * Compute row-major (C-contiguous) strides for a shape.
     */
    public static long[] computeRowMajorStrides(int[] shape) {
        if (shape.length == 0) {
            return new long[0];
        }
        long[] strides = new long[shape.length];
        long stride = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            strides[i] = stride;
            stride *= shape[i];
        }
        return strides;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TensorSpec that)) return false;
        return Arrays.equals(shape, that.shape) &&
               dtype == that.dtype &&
               Arrays.equals(strides, that.strides);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(shape);
        result = 31 * result + dtype.hashCode();
        result = 31 * result + Arrays.hashCode(strides);
        return result;
    }

    @Override
    public String toString() {
        return "TensorSpec[shape=" + Arrays.toString(shape) + ", dtype=" + dtype + "]";
    }
}
