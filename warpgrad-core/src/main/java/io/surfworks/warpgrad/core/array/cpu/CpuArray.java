package io.surfworks.warpgrad.core.array.cpu;

import io.surfworks.warpgrad.core.array.ArrayBackend;
import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.array.TensorSpec;

import java.util.Arrays;

/**
 * Heap-backed array of the reference CPU backend.
 *
 * <p>Elements are stored as doubles already rounded to the precision of the
 * dtype, so an F32 array holds exactly the values a float buffer would.
 */
public final class CpuArray implements NdArray {

    private final TensorSpec spec;
    private final double[] data;

    CpuArray(TensorSpec spec, double[] data) {
        if (data.length != spec.elementCount()) {
            throw new IllegalArgumentException(
                "Data length " + data.length + " does not match shape " + Arrays.toString(spec.shape()));
        }
        this.spec = spec;
        this.data = data;
    }

    @Override
    public TensorSpec spec() {
        return spec;
    }

    @Override
    public ArrayBackend backend() {
        return CpuBackend.instance();
    }

    @Override
    public double getDouble(long flatIndex) {
        return data[Math.toIntExact(flatIndex)];
    }

    @Override
    public double[] toDoubleArray() {
        return data.clone();
    }

    /**
     * Writes one element, rounding to the dtype.
     */
    public void setDouble(long flatIndex, double value) {
        data[Math.toIntExact(flatIndex)] = spec.dtype().round(value);
    }

    /**
     * Direct access to storage for kernels of this package.
     */
    double[] data() {
        return data;
    }

    @Override
    public String toString() {
        int shown = Math.min(data.length, 8);
        StringBuilder sb = new StringBuilder("CpuArray(shape=")
            .append(Arrays.toString(spec.shape()))
            .append(", dtype=").append(spec.dtype())
            .append(", data=[");
        for (int i = 0; i < shown; i++) {
            if (i > 0) sb.append(", ");
            sb.append(data[i]);
        }
        if (shown < data.length) sb.append(", ...");
        return sb.append("])").toString();
    }
}
