package io.surfworks.warpgrad.core.graph;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.array.ScalarType;
import io.surfworks.warpgrad.core.config.ConfigContext;
import io.surfworks.warpgrad.core.error.GradientContractException;
import io.surfworks.warpgrad.core.error.GraphStateException;
import io.surfworks.warpgrad.core.error.NaNPolicy;
import io.surfworks.warpgrad.core.error.NumericalException;
import io.surfworks.warpgrad.core.functions.Ops;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BackwardPropagatorTest {

    /**
     * Identity whose backward counts its calls and returns whatever it is told to.
     */
    static final class CountingCopy extends OperationNode {
        final List<String> log;
        final String name;
        int backwardCalls;
        BackwardMode mode = BackwardMode.PASS;

        enum BackwardMode { PASS, TOO_MANY, WRONG_SHAPE, WRONG_DTYPE, NAN }

        CountingCopy(String name, List<String> log) {
            this.name = name;
            this.log = log;
        }

        @Override
        public String label() {
            return "CountingCopy[" + name + "]";
        }

        @Override
        public List<NdArray> forward(List<NdArray> in) {
            return List.of(in.get(0).backend().copy(in.get(0)));
        }

        @Override
        public List<Variable> backward(int[] targets, List<Variable> gy) {
            backwardCalls++;
            log.add(name);
            Variable g = gy.get(0);
            NdArray a = g.array();
            switch (mode) {
                case TOO_MANY:
                    return List.of(g, g);
                case WRONG_SHAPE:
                    return List.of(Variable.of(a.dtype(), new double[]{1, 2, 3}, 3));
                case WRONG_DTYPE:
                    return List.of(new Variable(a.backend().fromDoubles(a.spec().withDtype(ScalarType.F32),
                        a.toDoubleArray())));
                case NAN:
                    return List.of(new Variable(a.backend().full(a.spec(), Double.NaN)));
                default:
                    return List.of(g);
            }
        }
    }

    private static Variable counting(String name, List<String> log, Variable x) {
        return new CountingCopy(name, log).applySingle(x);
    }

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        @Test
        void diamondVisitsEachNodeOnce() {
            List<String> log = new ArrayList<>();
            Variable x = Variable.of(1.0);
            CountingCopy root = new CountingCopy("a", log);
            Variable a = root.applySingle(x);
            Variable b = counting("b", log, a);
            Variable c = counting("c", log, a);
            Variable y = Ops.add(b, c);

            y.backward();

            assertEquals(1, root.backwardCalls);
            assertEquals("a", log.get(log.size() - 1));
            assertEquals(2.0, x.gradArray().getDouble(0));
        }

        @Test
        void higherRankRunsFirst() {
            List<String> log = new ArrayList<>();
            Variable x = Variable.of(1.0);
            Variable shallow = counting("shallow", log, x);
            Variable deep = counting("deep2", log, counting("deep1", log, x));
            Variable y = Ops.add(shallow, deep);

            y.backward();

            assertEquals(List.of("deep2", "shallow", "deep1"), log);
        }

        @Test
        void equalRanksRunInInsertionOrder() {
            List<String> log = new ArrayList<>();
            Variable x = Variable.of(1.0);
            Variable p = counting("p", log, x);
            Variable q = counting("q", log, x);
            Variable y = Ops.add(p, q);

            y.backward();

            assertEquals(List.of("p", "q"), log);
        }

        @Test
        void unchainedNodeStopsPropagation() {
            Variable x = Variable.of(1.0);
            Variable h = Ops.exp(x);
            OperationNode expNode = h.creator();
            Variable y = Ops.tanh(h);
            expNode.unchain();

            assertNull(h.creator());
            y.backward();
            assertNull(x.grad());
            assertNotNull(h.grad());
        }
    }

    @Nested
    @DisplayName("grad()")
    class GradTests {

        @Test
        void leavesAreUntouched() {
            Variable x = Variable.of(3.0);
            Variable y = Ops.square(x);

            List<Variable> g = BackwardPropagator.grad(List.of(y), List.of(x));

            assertEquals(6.0, g.get(0).array().getDouble(0));
            assertNull(x.grad());
        }

        @Test
        void intermediateInputsAndPassThrough() {
            Variable x = Variable.of(2.0);
            Variable h = Ops.square(x);
            Variable y = Ops.mulConstant(h, 3.0);

            List<Variable> g = BackwardPropagator.grad(List.of(y), List.of(h, x));

            assertEquals(3.0, g.get(0).array().getDouble(0));
            assertEquals(12.0, g.get(1).array().getDouble(0));
        }

        @Test
        void unreachedInputIsNull() {
            Variable x = Variable.of(2.0);
            Variable other = Variable.of(5.0);
            Variable y = Ops.square(x);

            List<Variable> g = BackwardPropagator.grad(List.of(y), List.of(x, other));

            assertNotNull(g.get(0));
            assertNull(g.get(1));
        }

        @Test
        void gradInputsAreAdded() {
            Variable x = Variable.of(2.0);
            Variable y = Ops.square(x);

            List<Variable> g = BackwardPropagator.grad(List.of(y), List.of(x), null,
                List.of(Variable.of(10.0)), false);

            assertEquals(14.0, g.get(0).array().getDouble(0));
        }

        @Test
        void explicitSeed() {
            Variable x = Variable.of(ScalarType.F64, new double[]{1, 2}, 2);
            Variable y = Ops.mulConstant(x, 2.0);

            List<Variable> g = BackwardPropagator.grad(List.of(y), List.of(x),
                List.of(Variable.of(ScalarType.F64, new double[]{1, -1}, 2)), null, false);

            assertArrayEquals(new double[]{2, -2}, g.get(0).array().toDoubleArray());
        }

        @Test
        void mismatchedSeedCount() {
            Variable x = Variable.of(2.0);
            Variable y = Ops.square(x);

            assertThrows(IllegalArgumentException.class, () -> BackwardPropagator.grad(
                List.of(y), List.of(x), List.of(Variable.of(1.0), Variable.of(1.0)), null, false));
        }
    }

    @Nested
    @DisplayName("Intermediate gradients")
    class RetainGradTests {

        @Test
        void intermediatesAreDroppedByDefault() {
            Variable x = Variable.of(2.0);
            Variable h = Ops.square(x);
            Variable y = Ops.exp(h);

            y.backward();

            assertNull(h.grad());
            assertNotNull(x.grad());
        }

        @Test
        void retainGradKeepsIntermediates() {
            Variable x = Variable.of(2.0);
            Variable h = Ops.mulConstant(x, 3.0);
            Variable y = Ops.square(h);

            y.backward(true);

            assertEquals(12.0, h.gradArray().getDouble(0));
            assertEquals(36.0, x.gradArray().getDouble(0));
            assertEquals(1.0, y.gradArray().getDouble(0));
        }

        @Test
        void multipleOutputsBackwardTogether() {
            Variable x = Variable.of(2.0);
            Variable a = Ops.square(x);
            Variable b = Ops.mulConstant(x, 5.0);

            BackwardPropagator.backward(List.of(a, b), null, false, false);

            assertEquals(9.0, x.gradArray().getDouble(0));
        }

        @Test
        void siblingOutputsOfOneNodeRunItOnce() {
            Variable a = Variable.of(ScalarType.F64, new double[]{1, 2}, 2);
            Variable b = Variable.of(ScalarType.F64, new double[]{3, 4}, 2);
            List<Variable> ys = Ops.identity(a, b);
            Variable ones = Variable.of(ScalarType.F64, new double[]{1, 1}, 2);

            BackwardPropagator.backward(ys, List.of(ones, ones), false, false);

            assertArrayEquals(new double[]{1, 1}, a.gradArray().toDoubleArray());
            assertArrayEquals(new double[]{1, 1}, b.gradArray().toDoubleArray());
        }

        @Test
        void gradOfSiblingOutputsCountsEachOnce() {
            Variable a = Variable.of(2.0);
            Variable b = Variable.of(3.0);
            List<Variable> ys = Ops.identity(a, b);

            List<Variable> gs = BackwardPropagator.grad(ys, List.of(a, b));

            assertEquals(1.0, gs.get(0).array().getDouble(0));
            assertEquals(1.0, gs.get(1).array().getDouble(0));
        }

        @Test
        void sharedNodeReachedFromBothSeedsRunsOnce() {
            List<String> log = new ArrayList<>();
            Variable x = Variable.of(1.0);
            CountingCopy shared = new CountingCopy("shared", log);
            Variable h = shared.applySingle(x);
            List<Variable> ys = Ops.identity(Ops.exp(h), Ops.tanh(h));

            BackwardPropagator.backward(ys, null, false, false);

            assertEquals(1, shared.backwardCalls);
            double expected = Math.exp(1.0) + (1 - Math.pow(Math.tanh(1.0), 2));
            assertEquals(expected, x.gradArray().getDouble(0), 1e-12);
        }
    }

    @Nested
    @DisplayName("Double backprop")
    class DoubleBackpropTests {

        @Test
        void gradientOfGradient() {
            Variable x = Variable.of(3.0);
            Variable y = Ops.multiply(Ops.square(x), x);

            y.backward(false, true);
            Variable gx = x.grad();
            assertEquals(27.0, gx.array().getDouble(0));
            assertNotNull(gx.creator());

            x.clearGrad();
            gx.backward();
            assertEquals(18.0, x.gradArray().getDouble(0));
        }

        @Test
        void gradientsAreConstantsWithoutDoubleBackprop() {
            Variable x = Variable.of(3.0);
            Variable y = Ops.square(x);

            y.backward();

            assertNull(x.grad().creator());
        }

        @Test
        void gradWithDoubleBackprop() {
            Variable x = Variable.of(0.5);
            Variable y = Ops.tanh(x);

            Variable g1 = BackwardPropagator.grad(List.of(y), List.of(x), null, null, true).get(0);
            Variable g2 = BackwardPropagator.grad(List.of(g1), List.of(x), null, null, true).get(0);

            double t = Math.tanh(0.5);
            assertEquals(1 - t * t, g1.array().getDouble(0), 1e-12);
            assertEquals(-2 * t * (1 - t * t), g2.array().getDouble(0), 1e-12);
        }
    }

    @Nested
    @DisplayName("Gradient contract")
    class ContractTests {

        @Test
        void wrongGradientCountAlwaysFails() {
            Variable x = Variable.of(1.0);
            CountingCopy p = new CountingCopy("bad", new ArrayList<>());
            p.mode = CountingCopy.BackwardMode.TOO_MANY;
            Variable y = p.applySingle(x);

            GradientContractException e = assertThrows(GradientContractException.class, y::backward);
            assertEquals("CountingCopy[bad]", e.operation());
            assertEquals(-1, e.inputIndex());
        }

        @Test
        void wrongShapeFailsInDebugMode() {
            Variable x = Variable.of(ScalarType.F64, new double[]{1, 2}, 2);
            CountingCopy p = new CountingCopy("shape", new ArrayList<>());
            p.mode = CountingCopy.BackwardMode.WRONG_SHAPE;
            Variable y = Ops.sum(p.applySingle(x));

            try (ConfigContext ctx = ConfigContext.debug()) {
                GradientContractException e = assertThrows(GradientContractException.class, y::backward);
                assertEquals(0, e.inputIndex());
                assertTrue(e.getMessage().contains("shape"));
            }
        }

        @Test
        void wrongDtypeFailsInDebugMode() {
            Variable x = Variable.of(ScalarType.F64, new double[]{1, 2}, 2);
            CountingCopy p = new CountingCopy("dtype", new ArrayList<>());
            p.mode = CountingCopy.BackwardMode.WRONG_DTYPE;
            Variable y = Ops.sum(p.applySingle(x));

            try (ConfigContext ctx = ConfigContext.debug()) {
                assertThrows(GradientContractException.class, y::backward);
            }
        }

        @Test
        void nanGradientFailsInDebugMode() {
            Variable x = Variable.of(1.0);
            CountingCopy p = new CountingCopy("nan", new ArrayList<>());
            p.mode = CountingCopy.BackwardMode.NAN;
            Variable y = p.applySingle(x);

            try (ConfigContext ctx = ConfigContext.debug()) {
                NumericalException e = assertThrows(NumericalException.class, y::backward);
                assertEquals("CountingCopy[nan] (backward)", e.operation());
            }
        }

        @Test
        void nanGradientWarnsUnderWarnPolicy() {
            Variable x = Variable.of(1.0);
            CountingCopy p = new CountingCopy("nan", new ArrayList<>());
            p.mode = CountingCopy.BackwardMode.NAN;
            Variable y = p.applySingle(x);

            try (ConfigContext ctx = ConfigContext.using(c -> c.withNanPolicy(NaNPolicy.WARN))) {
                y.backward();
            }
            assertTrue(Double.isNaN(x.gradArray().getDouble(0)));
        }

        @Test
        void variableWithoutArrayCannotSeed() {
            Variable v = new Variable(null);

            assertThrows(GraphStateException.class, v::backward);
        }

        @Test
        void missingOutputGradientsBecomeZeros() {
            Variable x = Variable.of(ScalarType.F64, new double[]{1, 2}, 2);
            List<Variable> parts = new GraphBuilderTest.Fork().apply(x);
            Variable y = Ops.sum(parts.get(0));

            y.backward();

            assertArrayEquals(new double[]{1, 1}, x.gradArray().toDoubleArray());
        }
    }
}
