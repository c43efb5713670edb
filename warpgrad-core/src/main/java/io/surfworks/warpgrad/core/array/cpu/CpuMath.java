package io.surfworks.warpgrad.core.array.cpu;

import io.surfworks.warpgrad.core.array.ArrayMath;
import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.array.ScalarType;
import io.surfworks.warpgrad.core.array.TensorSpec;

import java.util.Arrays;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import java.util.stream.IntStream;

/**
 * Scalar kernels of the reference CPU backend.
 */
final class CpuMath implements ArrayMath {

    private final CpuBackend backend;

    CpuMath(CpuBackend backend) {
        this.backend = backend;
    }

    // ==================== Elementwise ====================

    @Override
    public NdArray add(NdArray a, NdArray b) {
        return binary("add", a, b, Double::sum);
    }

    @Override
    public NdArray subtract(NdArray a, NdArray b) {
        return binary("subtract", a, b, (x, y) -> x - y);
    }

    @Override
    public NdArray multiply(NdArray a, NdArray b) {
        return binary("multiply", a, b, (x, y) -> x * y);
    }

    @Override
    public NdArray divide(NdArray a, NdArray b) {
        return binary("divide", a, b, (x, y) -> x / y);
    }

    @Override
    public NdArray negate(NdArray a) {
        return unary(a, x -> -x);
    }

    @Override
    public NdArray scale(NdArray a, double factor) {
        return unary(a, x -> x * factor);
    }

    @Override
    public NdArray addScalar(NdArray a, double value) {
        return unary(a, x -> x + value);
    }

    @Override
    public NdArray exp(NdArray a) {
        return unary(a, Math::exp);
    }

    @Override
    public NdArray log(NdArray a) {
        return unary(a, Math::log);
    }

    @Override
    public NdArray tanh(NdArray a) {
        return unary(a, Math::tanh);
    }

    @Override
    public NdArray sigmoid(NdArray a) {
        return unary(a, x -> 1.0 / (1.0 + Math.exp(-x)));
    }

    @Override
    public NdArray map(NdArray a, DoubleUnaryOperator fn) {
        return unary(a, fn);
    }

    // ==================== Reductions ====================

    @Override
    public NdArray sum(NdArray a, int[] axes, boolean keepDims) {
        CpuArray in = backend.owned(a);
        int[] shape = in.spec().shape();
        boolean[] reduced = reducedAxes(axes, shape.length);

        int[] keptShape = new int[shape.length];
        for (int i = 0; i < shape.length; i++) {
            keptShape[i] = reduced[i] ? 1 : shape[i];
        }
        long[] keptStrides = TensorSpec.computeRowMajorStrides(keptShape);
        long[] inStrides = in.spec().strides();

        double[] src = in.data();
        double[] acc = new double[Math.toIntExact(TensorSpec.elementCount(keptShape))];
        for (int flat = 0; flat < src.length; flat++) {
            long remaining = flat;
            long outIndex = 0;
            for (int d = 0; d < shape.length; d++) {
                long coord = remaining / inStrides[d];
                remaining %= inStrides[d];
                if (!reduced[d]) {
                    outIndex += coord * keptStrides[d];
                }
            }
            acc[(int) outIndex] += src[flat];
        }

        int[] outShape = keepDims ? keptShape : dropReduced(shape, reduced);
        return backend.fromDoubles(TensorSpec.of(in.dtype(), outShape), acc);
    }

    // ==================== Shape ====================

    @Override
    public NdArray broadcastTo(NdArray a, int[] shape) {
        CpuArray in = backend.owned(a);
        if (!in.spec().isBroadcastableTo(shape)) {
            throw new IllegalArgumentException("Cannot broadcast " + Arrays.toString(in.spec().shape())
                + " to " + Arrays.toString(shape));
        }
        int offset = shape.length - in.ndim();
        int[] inShape = in.spec().shape();
        long[] inStrides = in.spec().strides();
        long[] outStrides = TensorSpec.computeRowMajorStrides(shape);

        double[] src = in.data();
        double[] out = new double[Math.toIntExact(TensorSpec.elementCount(shape))];
        for (int flat = 0; flat < out.length; flat++) {
            long remaining = flat;
            long inIndex = 0;
            for (int d = 0; d < shape.length; d++) {
                long coord = remaining / outStrides[d];
                remaining %= outStrides[d];
                int inAxis = d - offset;
                if (inAxis >= 0 && inShape[inAxis] != 1) {
                    inIndex += coord * inStrides[inAxis];
                }
            }
            out[flat] = src[(int) inIndex];
        }
        return new CpuArray(TensorSpec.of(in.dtype(), shape), out);
    }

    @Override
    public NdArray reshape(NdArray a, int[] shape) {
        CpuArray in = backend.owned(a);
        if (TensorSpec.elementCount(shape) != in.size()) {
            throw new IllegalArgumentException("Cannot reshape " + Arrays.toString(in.spec().shape())
                + " to " + Arrays.toString(shape));
        }
        return new CpuArray(TensorSpec.of(in.dtype(), shape), in.data().clone());
    }

    @Override
    public NdArray transpose(NdArray a) {
        CpuArray in = backend.owned(a);
        requireMatrix("transpose", in);
        int rows = in.spec().shape()[0];
        int cols = in.spec().shape()[1];
        double[] src = in.data();
        double[] out = new double[src.length];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                out[j * rows + i] = src[i * cols + j];
            }
        }
        return new CpuArray(TensorSpec.of(in.dtype(), cols, rows), out);
    }

    // ==================== Linear algebra ====================

    @Override
    public NdArray matmul(NdArray a, NdArray b) {
        CpuArray lhs = backend.owned(a);
        CpuArray rhs = backend.owned(b);
        requireMatrix("matmul", lhs);
        requireMatrix("matmul", rhs);
        int m = lhs.spec().shape()[0];
        int k = lhs.spec().shape()[1];
        int n = rhs.spec().shape()[1];
        if (rhs.spec().shape()[0] != k) {
            throw new IllegalArgumentException("matmul inner dimension mismatch: "
                + Arrays.toString(lhs.spec().shape()) + " x " + Arrays.toString(rhs.spec().shape()));
        }
        ScalarType dtype = lhs.dtype();
        double[] x = lhs.data();
        double[] y = rhs.data();
        double[] out = new double[m * n];
        for (int i = 0; i < m; i++) {
            for (int p = 0; p < k; p++) {
                double xv = x[i * k + p];
                for (int j = 0; j < n; j++) {
                    out[i * n + j] += xv * y[p * n + j];
                }
            }
        }
        for (int i = 0; i < out.length; i++) {
            out[i] = dtype.round(out[i]);
        }
        return new CpuArray(TensorSpec.of(dtype, m, n), out);
    }

    // ==================== Internal Helpers ====================

    private CpuArray unary(NdArray a, DoubleUnaryOperator fn) {
        CpuArray in = backend.owned(a);
        ScalarType dtype = in.dtype();
        double[] src = in.data();
        double[] out = new double[src.length];
        for (int i = 0; i < src.length; i++) {
            out[i] = dtype.round(fn.applyAsDouble(src[i]));
        }
        return new CpuArray(in.spec(), out);
    }

    private CpuArray binary(String name, NdArray a, NdArray b, DoubleBinaryOperator fn) {
        CpuArray lhs = backend.owned(a);
        CpuArray rhs = backend.owned(b);
        if (!lhs.spec().shapeEquals(rhs.spec())) {
            throw new IllegalArgumentException(name + " shape mismatch: "
                + Arrays.toString(lhs.spec().shape()) + " vs " + Arrays.toString(rhs.spec().shape()));
        }
        ScalarType dtype = lhs.dtype();
        double[] x = lhs.data();
        double[] y = rhs.data();
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            out[i] = dtype.round(fn.applyAsDouble(x[i], y[i]));
        }
        return new CpuArray(lhs.spec(), out);
    }

    private static boolean[] reducedAxes(int[] axes, int rank) {
        boolean[] reduced = new boolean[rank];
        if (axes == null || axes.length == 0) {
            Arrays.fill(reduced, true);
            return reduced;
        }
        for (int axis : axes) {
            int normalized = axis < 0 ? axis + rank : axis;
            if (normalized < 0 || normalized >= rank) {
                throw new IllegalArgumentException("Axis " + axis + " out of range for rank " + rank);
            }
            reduced[normalized] = true;
        }
        return reduced;
    }

    private static int[] dropReduced(int[] shape, boolean[] reduced) {
        return IntStream.range(0, shape.length)
            .filter(i -> !reduced[i])
            .map(i -> shape[i])
            .toArray();
    }

    private static void requireMatrix(String op, CpuArray array) {
        if (array.ndim() != 2) {
            throw new IllegalArgumentException(op + " requires a 2-D array, got shape "
                + Arrays.toString(array.spec().shape()));
        }
    }
}
