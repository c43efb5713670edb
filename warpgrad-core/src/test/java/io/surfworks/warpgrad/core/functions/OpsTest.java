package io.surfworks.warpgrad.core.functions;

import io.surfworks.warpgrad.core.array.ScalarType;
import io.surfworks.warpgrad.core.error.TypeCheckException;
import io.surfworks.warpgrad.core.graph.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OpsTest {

    private static Variable matrix(double[] values, int rows, int cols) {
        return Variable.of(ScalarType.F64, values, rows, cols);
    }

    private static Variable vec(double... values) {
        return Variable.of(ScalarType.F64, values, values.length);
    }

    @Nested
    @DisplayName("Forward values")
    class ForwardTests {

        @Test
        void elementwiseArithmetic() {
            Variable a = vec(1, 2, 3);
            Variable b = vec(4, 5, 6);

            assertArrayEquals(new double[]{5, 7, 9}, Ops.add(a, b).array().toDoubleArray());
            assertArrayEquals(new double[]{-3, -3, -3}, Ops.subtract(a, b).array().toDoubleArray());
            assertArrayEquals(new double[]{4, 10, 18}, Ops.multiply(a, b).array().toDoubleArray());
            assertArrayEquals(new double[]{0.25, 0.4, 0.5}, Ops.divide(a, b).array().toDoubleArray(), 1e-15);
            assertArrayEquals(new double[]{-1, -2, -3}, Ops.negate(a).array().toDoubleArray());
            assertArrayEquals(new double[]{1, 4, 9}, Ops.square(a).array().toDoubleArray());
        }

        @Test
        void constants() {
            Variable x = vec(1, -1);

            assertArrayEquals(new double[]{3.5, 1.5}, Ops.addConstant(x, 2.5).array().toDoubleArray());
            assertArrayEquals(new double[]{-3, 3}, Ops.mulConstant(x, -3).array().toDoubleArray());
        }

        @Test
        void sigmoidIsStableForLargeInputs() {
            Variable x = vec(-800, 0, 800);

            assertArrayEquals(new double[]{0, 0.5, 1}, Ops.sigmoid(x).array().toDoubleArray(), 1e-12);
        }

        @Test
        void xlogxIsZeroAtZero() {
            Variable x = vec(0, 1, Math.E);

            assertArrayEquals(new double[]{0, 0, Math.E}, Ops.xlogx(x).array().toDoubleArray(), 1e-12);
        }

        @Test
        void linearMatchesManualComputation() {
            Variable x = matrix(new double[]{1, 2, 3, 4}, 2, 2);
            Variable w = matrix(new double[]{1, 0, 0, 1, 1, 1}, 3, 2);
            Variable b = vec(10, 20, 30);

            Variable y = Ops.linear(x, w, b);

            assertArrayEquals(new int[]{2, 3}, y.shape());
            assertArrayEquals(new double[]{11, 22, 33, 13, 24, 37}, y.array().toDoubleArray());
        }

        @Test
        void sumToCollapsesLeadingAndUnitAxes() {
            Variable x = matrix(new double[]{1, 2, 3, 4, 5, 6}, 2, 3);

            assertArrayEquals(new double[]{5, 7, 9}, Ops.sumTo(x, 3).array().toDoubleArray());
            Variable column = Ops.sumTo(x, 2, 1);
            assertArrayEquals(new int[]{2, 1}, column.shape());
            assertArrayEquals(new double[]{6, 15}, column.array().toDoubleArray());
        }

        @Test
        void sumOverAxes() {
            Variable x = matrix(new double[]{1, 2, 3, 4, 5, 6}, 2, 3);

            assertEquals(21.0, Ops.sum(x).array().getDouble(0));
            assertEquals(0, Ops.sum(x).ndim());
            assertArrayEquals(new double[]{6, 15}, Ops.sum(x, new int[]{-1}, false).array().toDoubleArray());
            assertArrayEquals(new int[]{1, 3}, Ops.sum(x, new int[]{0}, true).shape());
        }

        @Test
        void shapeOperatorsSkipNoOps() {
            Variable x = vec(1, 2);

            assertSame(x, Ops.reshape(x, 2));
            assertSame(x, Ops.broadcastTo(x, 2));
            assertSame(x, Ops.sumTo(x, 2));
        }

        @Test
        void identityAliasesItsInputs() {
            Variable a = vec(1, 2);
            Variable b = vec(3);

            List<Variable> out = Ops.identity(a, b);

            assertEquals(2, out.size());
            assertNotSame(a, out.get(0));
            assertSame(a.array(), out.get(0).array());
            assertSame(b.array(), out.get(1).array());
        }

        @Test
        void identityPassesGradientsThrough() {
            Variable a = vec(1, 2);
            List<Variable> out = Ops.identity(a);

            Ops.sum(Ops.mulConstant(out.get(0), 3)).backward();

            assertArrayEquals(new double[]{3, 3}, a.gradArray().toDoubleArray());
        }
    }

    @Nested
    @DisplayName("Labels")
    class LabelTests {

        @Test
        void parameterizedLabels() {
            Variable x = matrix(new double[]{1, 2, 3, 4, 5, 6}, 2, 3);

            assertEquals("AddConstant(1.5)", Ops.addConstant(x, 1.5).creator().label());
            assertEquals("MulConstant(2.0)", Ops.mulConstant(x, 2).creator().label());
            assertEquals("Sum", Ops.sum(x).creator().label());
            assertEquals("Sum(axes=[0])", Ops.sum(x, new int[]{0}, false).creator().label());
            assertEquals("Reshape([3, 2])", Ops.reshape(x, 3, 2).creator().label());
            assertEquals("BroadcastTo([4, 2, 3])", Ops.broadcastTo(x, 4, 2, 3).creator().label());
            assertEquals("SumTo([3])", Ops.sumTo(x, 3).creator().label());
        }

        @Test
        void plainLabelsAreClassNames() {
            Variable x = vec(1, 2);

            assertEquals("Exp", Ops.exp(x).creator().label());
            assertEquals("Tanh", Ops.tanh(x).creator().label());
            assertEquals("XLogX", Ops.xlogx(x).creator().label());
        }
    }

    @Nested
    @DisplayName("Type checks")
    class TypeCheckTests {

        @Test
        void matmulRequiresMatchingInnerDimension() {
            Variable a = matrix(new double[]{1, 2, 3, 4, 5, 6}, 2, 3);
            Variable b = matrix(new double[]{1, 2, 3, 4}, 2, 2);

            TypeCheckException e = assertThrows(TypeCheckException.class, () -> Ops.matmul(a, b));
            assertEquals("MatMul", e.operation());
        }

        @Test
        void logRequiresFloatingInput() {
            Variable ints = Variable.of(ScalarType.I32, new double[]{1, 2}, 2);

            assertThrows(TypeCheckException.class, () -> Ops.log(ints));
        }

        @Test
        void broadcastRejectsIncompatibleShape() {
            Variable x = vec(1, 2, 3);

            assertThrows(TypeCheckException.class, () -> Ops.broadcastTo(x, 2, 2));
        }

        @Test
        void reshapeRejectsSizeChange() {
            Variable x = vec(1, 2, 3);

            assertThrows(TypeCheckException.class, () -> Ops.reshape(x, 2, 2));
        }

        @Test
        void mixedDtypesAreRejected() {
            Variable a = Variable.of(ScalarType.F32, new double[]{1, 2}, 2);
            Variable b = vec(1, 2);

            assertThrows(TypeCheckException.class, () -> Ops.add(a, b));
        }
    }
}
