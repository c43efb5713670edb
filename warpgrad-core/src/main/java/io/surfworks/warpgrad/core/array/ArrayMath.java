package io.surfworks.warpgrad.core.array;

import java.util.function.DoubleUnaryOperator;

/**
 * Kernel set of an {@link ArrayBackend}.
 *
 * <p>Binary elementwise kernels require operands of identical shape and dtype;
 * broadcasting is explicit through {@link #broadcastTo}. Every kernel returns a
 * freshly allocated array that shares no storage with its operands.
 */
public interface ArrayMath {

    // ==================== Elementwise ====================

    NdArray add(NdArray a, NdArray b);

    NdArray subtract(NdArray a, NdArray b);

    NdArray multiply(NdArray a, NdArray b);

    NdArray divide(NdArray a, NdArray b);

    NdArray negate(NdArray a);

    NdArray scale(NdArray a, double factor);

    NdArray addScalar(NdArray a, double value);

    NdArray exp(NdArray a);

    NdArray log(NdArray a);

    NdArray tanh(NdArray a);

    NdArray sigmoid(NdArray a);

    /**
     * Generic elementwise kernel for functions without a dedicated primitive.
     */
    NdArray map(NdArray a, DoubleUnaryOperator fn);

    // ==================== Reductions ====================

    /**
     * Sums over {@code axes}. An empty axes array sums over every axis.
     */
    NdArray sum(NdArray a, int[] axes, boolean keepDims);

    // ==================== Shape ====================

    NdArray broadcastTo(NdArray a, int[] shape);

    NdArray reshape(NdArray a, int[] shape);

    /**
     * Transpose of a 2-D array.
     */
    NdArray transpose(NdArray a);

    // ==================== Linear algebra ====================

    /**
     * Matrix product of two 2-D arrays.
     */
    NdArray matmul(NdArray a, NdArray b);
}
