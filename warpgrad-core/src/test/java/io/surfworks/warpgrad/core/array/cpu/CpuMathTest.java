package io.surfworks.warpgrad.core.array.cpu;

import io.surfworks.warpgrad.core.array.ArrayMath;
import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.array.ScalarType;
import io.surfworks.warpgrad.core.array.TensorSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CpuMathTest {

    private final CpuBackend backend = CpuBackend.instance();
    private final ArrayMath math = backend.math();

    private CpuArray f64(double[] values, int... shape) {
        return backend.array(ScalarType.F64, values, shape);
    }

    @Nested
    @DisplayName("Elementwise")
    class ElementwiseTests {

        @Test
        void addAndSubtract() {
            NdArray a = f64(new double[]{1, 2, 3}, 3);
            NdArray b = f64(new double[]{10, 20, 30}, 3);

            assertArrayEquals(new double[]{11, 22, 33}, math.add(a, b).toDoubleArray());
            assertArrayEquals(new double[]{-9, -18, -27}, math.subtract(a, b).toDoubleArray());
        }

        @Test
        void resultsDoNotShareStorage() {
            NdArray a = f64(new double[]{1, 2}, 2);
            NdArray scaled = math.scale(a, 1.0);

            assertNotSame(a, scaled);
            ((CpuArray) scaled).setDouble(0, 42);
            assertEquals(1.0, a.getDouble(0));
        }

        @Test
        void shapeMismatchIsRejected() {
            NdArray a = f64(new double[]{1, 2, 3}, 3);
            NdArray b = f64(new double[]{1, 2}, 2);

            assertThrows(IllegalArgumentException.class, () -> math.multiply(a, b));
        }

        @Test
        void f32ResultsAreRoundedToFloat() {
            NdArray a = backend.array(ScalarType.F32, new double[]{0.1}, 1);
            NdArray r = math.scale(a, 3.0);

            assertEquals((double) (float) (((double) 0.1f) * 3.0), r.getDouble(0));
            assertEquals(ScalarType.F32, r.dtype());
        }

        @Test
        void transcendental() {
            NdArray x = f64(new double[]{0.0, 1.0}, 2);

            assertArrayEquals(new double[]{1.0, Math.E}, math.exp(x).toDoubleArray(), 1e-12);
            assertArrayEquals(new double[]{0.0, Math.tanh(1.0)}, math.tanh(x).toDoubleArray(), 1e-12);
            assertArrayEquals(new double[]{0.5, 1.0 / (1.0 + Math.exp(-1.0))},
                math.sigmoid(x).toDoubleArray(), 1e-12);
            assertTrue(Double.isInfinite(math.log(x).getDouble(0)));
        }
    }

    @Nested
    @DisplayName("Reductions")
    class ReductionTests {

        private final NdArray m = f64(new double[]{1, 2, 3, 4, 5, 6}, 2, 3);

        @Test
        void sumAllAxes() {
            NdArray s = math.sum(m, new int[0], false);

            assertArrayEquals(new int[0], s.shape());
            assertEquals(21.0, s.getDouble(0));
        }

        @Test
        void sumOverRows() {
            NdArray s = math.sum(m, new int[]{0}, false);

            assertArrayEquals(new int[]{3}, s.shape());
            assertArrayEquals(new double[]{5, 7, 9}, s.toDoubleArray());
        }

        @Test
        void sumKeepDims() {
            NdArray s = math.sum(m, new int[]{1}, true);

            assertArrayEquals(new int[]{2, 1}, s.shape());
            assertArrayEquals(new double[]{6, 15}, s.toDoubleArray());
        }

        @Test
        void negativeAxisCountsFromTheEnd() {
            NdArray s = math.sum(m, new int[]{-1}, false);

            assertArrayEquals(new double[]{6, 15}, s.toDoubleArray());
        }

        @Test
        void axisOutOfRange() {
            assertThrows(IllegalArgumentException.class, () -> math.sum(m, new int[]{2}, false));
        }
    }

    @Nested
    @DisplayName("Shape")
    class ShapeTests {

        @Test
        void broadcastRowVector() {
            NdArray row = f64(new double[]{1, 2, 3}, 3);
            NdArray b = math.broadcastTo(row, new int[]{2, 3});

            assertArrayEquals(new int[]{2, 3}, b.shape());
            assertArrayEquals(new double[]{1, 2, 3, 1, 2, 3}, b.toDoubleArray());
        }

        @Test
        void broadcastScalar() {
            NdArray s = backend.scalar(ScalarType.F64, 7);
            NdArray b = math.broadcastTo(s, new int[]{2, 2});

            assertArrayEquals(new double[]{7, 7, 7, 7}, b.toDoubleArray());
        }

        @Test
        void broadcastIncompatible() {
            NdArray v = f64(new double[]{1, 2}, 2);

            assertThrows(IllegalArgumentException.class, () -> math.broadcastTo(v, new int[]{3}));
        }

        @Test
        void reshapeKeepsOrder() {
            NdArray v = f64(new double[]{1, 2, 3, 4, 5, 6}, 6);
            NdArray r = math.reshape(v, new int[]{3, 2});

            assertArrayEquals(new int[]{3, 2}, r.shape());
            assertArrayEquals(v.toDoubleArray(), r.toDoubleArray());
            assertThrows(IllegalArgumentException.class, () -> math.reshape(v, new int[]{4}));
        }

        @Test
        void transpose() {
            NdArray m = f64(new double[]{1, 2, 3, 4, 5, 6}, 2, 3);
            NdArray t = math.transpose(m);

            assertArrayEquals(new int[]{3, 2}, t.shape());
            assertArrayEquals(new double[]{1, 4, 2, 5, 3, 6}, t.toDoubleArray());
        }
    }

    @Nested
    @DisplayName("Linear algebra")
    class LinearAlgebraTests {

        @Test
        void matmul() {
            NdArray a = f64(new double[]{1, 2, 3, 4}, 2, 2);
            NdArray b = f64(new double[]{5, 6, 7, 8}, 2, 2);

            assertArrayEquals(new double[]{19, 22, 43, 50}, math.matmul(a, b).toDoubleArray());
        }

        @Test
        void matmulInnerDimensionMismatch() {
            NdArray a = f64(new double[]{1, 2, 3, 4, 5, 6}, 2, 3);
            NdArray b = f64(new double[]{1, 2, 3, 4}, 2, 2);

            assertThrows(IllegalArgumentException.class, () -> math.matmul(a, b));
        }
    }

    @Nested
    @DisplayName("Backend")
    class BackendTests {

        @Test
        void copyToOverwritesInPlace() {
            CpuArray dst = f64(new double[]{0, 0}, 2);
            NdArray src = f64(new double[]{3, 4}, 2);

            backend.copyTo(dst, src);

            assertArrayEquals(new double[]{3, 4}, dst.toDoubleArray());
        }

        @Test
        void copyToShapeMismatch() {
            CpuArray dst = f64(new double[]{0, 0}, 2);
            NdArray src = f64(new double[]{1, 2, 3}, 3);

            assertThrows(IllegalArgumentException.class, () -> backend.copyTo(dst, src));
        }

        @Test
        void onesLike() {
            NdArray like = backend.zeros(TensorSpec.of(ScalarType.F32, 2, 2));
            NdArray ones = backend.onesLike(like);

            assertEquals(like.spec(), ones.spec());
            assertArrayEquals(new double[]{1, 1, 1, 1}, ones.toDoubleArray());
        }
    }
}
