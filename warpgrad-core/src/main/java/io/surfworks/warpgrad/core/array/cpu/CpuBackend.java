package io.surfworks.warpgrad.core.array.cpu;

import io.surfworks.warpgrad.core.array.ArrayBackend;
import io.surfworks.warpgrad.core.array.ArrayMath;
import io.surfworks.warpgrad.core.array.BackendCapabilities;
import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.array.ScalarType;
import io.surfworks.warpgrad.core.array.TensorSpec;

import java.util.Arrays;
import java.util.Objects;

/**
 * Reference CPU backend. Synchronous, heap-backed, single instance.
 */
public final class CpuBackend implements ArrayBackend {

    public static final String NAME = "cpu";

    private static final CpuBackend INSTANCE = new CpuBackend();

    private final BackendCapabilities capabilities = BackendCapabilities.cpu();
    private final CpuMath math = new CpuMath(this);

    private CpuBackend() {
    }

    public static CpuBackend instance() {
        return INSTANCE;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public BackendCapabilities capabilities() {
        return capabilities;
    }

    @Override
    public ArrayMath math() {
        return math;
    }

    @Override
    public CpuArray zeros(TensorSpec spec) {
        checkSupported(spec);
        return new CpuArray(spec, new double[Math.toIntExact(spec.elementCount())]);
    }

    @Override
    public CpuArray full(TensorSpec spec, double value) {
        checkSupported(spec);
        double[] data = new double[Math.toIntExact(spec.elementCount())];
        Arrays.fill(data, spec.dtype().round(value));
        return new CpuArray(spec, data);
    }

    @Override
    public CpuArray fromDoubles(TensorSpec spec, double[] values) {
        checkSupported(spec);
        Objects.requireNonNull(values, "values cannot be null");
        double[] data = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            data[i] = spec.dtype().round(values[i]);
        }
        return new CpuArray(spec, data);
    }

    /**
     * Convenience factory for row-major values.
     */
    public CpuArray array(ScalarType dtype, double[] values, int... shape) {
        return fromDoubles(TensorSpec.of(dtype, shape), values);
    }

    @Override
    public CpuArray copy(NdArray source) {
        CpuArray src = owned(source);
        return new CpuArray(src.spec(), src.data().clone());
    }

    @Override
    public void copyTo(NdArray destination, NdArray source) {
        CpuArray dst = owned(destination);
        CpuArray src = owned(source);
        if (!dst.spec().shapeEquals(src.spec())) {
            throw new IllegalArgumentException("copyTo shape mismatch: destination "
                + Arrays.toString(dst.spec().shape()) + ", source " + Arrays.toString(src.spec().shape()));
        }
        if (dst.dtype() == src.dtype()) {
            System.arraycopy(src.data(), 0, dst.data(), 0, src.data().length);
        } else {
            for (int i = 0; i < src.data().length; i++) {
                dst.setDouble(i, src.data()[i]);
            }
        }
    }

    CpuArray owned(NdArray array) {
        Objects.requireNonNull(array, "array cannot be null");
        requireOwned(array);
        return (CpuArray) array;
    }

    private void checkSupported(TensorSpec spec) {
        Objects.requireNonNull(spec, "spec cannot be null");
        if (!capabilities.supports(spec.dtype())) {
            throw new IllegalArgumentException("Unsupported dtype for cpu backend: " + spec.dtype());
        }
        if (spec.rank() > capabilities.maxTensorRank()) {
            throw new IllegalArgumentException("Rank " + spec.rank() + " exceeds maximum "
                + capabilities.maxTensorRank());
        }
        if (spec.elementCount() > capabilities.maxElementCount()) {
            throw new IllegalArgumentException("Shape " + Arrays.toString(spec.shape()) + " has "
                + spec.elementCount() + " elements, maximum is " + capabilities.maxElementCount());
        }
    }

    @Override
    public String toString() {
        return "CpuBackend";
    }
}
