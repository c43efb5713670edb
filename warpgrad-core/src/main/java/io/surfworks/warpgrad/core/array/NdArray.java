package io.surfworks.warpgrad.core.array;

/**
 * Opaque numeric buffer with a shape, a dtype and the backend that owns it.
 *
 * <p>The autodiff core never looks inside an array. It compares arrays by
 * identity, asks for their {@link TensorSpec}, and reaches kernels through
 * {@link #backend()}. Implementations must not override {@code equals}.
 */
public interface NdArray {

    TensorSpec spec();

    /**
     * The backend this array was created by. Arrays are never implicitly
     * moved between backends.
     */
    ArrayBackend backend();

    /**
     * Element at a flat row-major index, widened to double.
     */
    double getDouble(long flatIndex);

    /**
     * Copies all elements out, widened to double, in row-major order.
     */
    double[] toDoubleArray();

    default int[] shape() {
        return spec().shape().clone();
    }

    default ScalarType dtype() {
        return spec().dtype();
    }

    default int ndim() {
        return spec().rank();
    }

    default long size() {
        return spec().elementCount();
    }
}
