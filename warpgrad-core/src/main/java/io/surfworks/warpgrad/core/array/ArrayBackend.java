package io.surfworks.warpgrad.core.array;

/**
 * Capability interface every array provider implements.
 *
 * <p>An array is bound to its backend when it is created; operators reach
 * kernels with {@code input.backend().math()} instead of inspecting the
 * concrete array type.
 *
 * <pre>{@code
 * ArrayBackend backend = x.backend();
 * NdArray y = backend.math().tanh(x);
 * if (backend.capabilities().supportsAsync()) {
 *     backend.synchronizeIfNeeded();
 * }
 * }</pre>
 */
public interface ArrayBackend {

    /**
     * Backend tag, e.g. "cpu".
     */
    String name();

    BackendCapabilities capabilities();

    /**
     * Elementwise, reduction and shape kernels for arrays of this backend.
     */
    ArrayMath math();

    NdArray zeros(TensorSpec spec);

    NdArray full(TensorSpec spec, double value);

    /**
     * Creates an array from row-major values, rounding to the dtype.
     *
     * @throws IllegalArgumentException if {@code values.length} does not match the shape
     */
    NdArray fromDoubles(TensorSpec spec, double[] values);

    /**
     * Deep copy of {@code source}, which must belong to this backend.
     */
    NdArray copy(NdArray source);

    /**
     * Overwrites the contents of {@code destination} with {@code source}
     * in place. Both arrays must have the same shape.
     */
    void copyTo(NdArray destination, NdArray source);

    /**
     * Blocks until queued work has completed. Only called when
     * {@link BackendCapabilities#supportsAsync()} is set.
     */
    default void synchronizeIfNeeded() {
    }

    default NdArray zerosLike(NdArray like) {
        return zeros(like.spec());
    }

    default NdArray onesLike(NdArray like) {
        return full(like.spec(), 1.0);
    }

    default NdArray scalar(ScalarType dtype, double value) {
        return full(TensorSpec.of(dtype), value);
    }

    /**
     * Verifies that {@code array} was created by this backend.
     *
     * @throws IllegalArgumentException if it was not
     */
    default void requireOwned(NdArray array) {
        if (array.backend() != this) {
            throw new IllegalArgumentException(
                "Array belongs to backend '" + array.backend().name() + "', not '" + name() + "'");
        }
    }
}
