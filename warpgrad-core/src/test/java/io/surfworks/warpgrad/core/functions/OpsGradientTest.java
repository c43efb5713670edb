package io.surfworks.warpgrad.core.functions;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.array.ScalarType;
import io.surfworks.warpgrad.core.array.TensorSpec;
import io.surfworks.warpgrad.core.array.cpu.CpuBackend;
import io.surfworks.warpgrad.core.config.ConfigContext;
import io.surfworks.warpgrad.core.graph.Variable;
import io.surfworks.warpgrad.core.testing.GradientCheck;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Numerical gradient checks of every reference operator.
 */
class OpsGradientTest {

    private static final CpuBackend CPU = CpuBackend.instance();

    /**
     * Deterministic values in [0.5, 1.5).
     */
    static NdArray positive(int seed, int... shape) {
        TensorSpec spec = TensorSpec.of(ScalarType.F64, shape);
        double[] values = new double[Math.toIntExact(spec.elementCount())];
        for (int i = 0; i < values.length; i++) {
            values[i] = 0.5 + ((i * 37 + seed * 11) % 100) / 100.0;
        }
        return CPU.fromDoubles(spec, values);
    }

    /**
     * Deterministic values in [-1, 1).
     */
    static NdArray signed(int seed, int... shape) {
        TensorSpec spec = TensorSpec.of(ScalarType.F64, shape);
        double[] values = new double[Math.toIntExact(spec.elementCount())];
        for (int i = 0; i < values.length; i++) {
            values[i] = ((i * 53 + seed * 29) % 200) / 100.0 - 1.0;
        }
        return CPU.fromDoubles(spec, values);
    }

    /**
     * Output seeds shaped like the outputs of {@code fn} at {@code inputs}.
     */
    static List<NdArray> seedsFor(Function<List<Variable>, List<Variable>> fn, List<NdArray> inputs, int seed) {
        List<Variable> xs = new ArrayList<>();
        for (NdArray a : inputs) {
            xs.add(new Variable(a));
        }
        List<NdArray> seeds = new ArrayList<>();
        try (ConfigContext ctx = ConfigContext.noBackprop()) {
            for (Variable y : fn.apply(xs)) {
                seeds.add(signed(seed + seeds.size(), y.shape()));
            }
        }
        return seeds;
    }

    private static Function<List<Variable>, List<Variable>> unary(Function<Variable, Variable> op) {
        return xs -> List.of(op.apply(xs.get(0)));
    }

    private static Function<List<Variable>, List<Variable>> binary(
            java.util.function.BiFunction<Variable, Variable, Variable> op) {
        return xs -> List.of(op.apply(xs.get(0), xs.get(1)));
    }

    static Stream<Arguments> firstOrderCases() {
        return Stream.of(
            Arguments.of("add", binary(Ops::add), List.of(signed(1, 2, 3), signed(2, 2, 3))),
            Arguments.of("subtract", binary(Ops::subtract), List.of(signed(3, 2, 3), signed(4, 2, 3))),
            Arguments.of("multiply", binary(Ops::multiply), List.of(signed(5, 2, 3), signed(6, 2, 3))),
            Arguments.of("divide", binary(Ops::divide), List.of(signed(7, 2, 3), positive(8, 2, 3))),
            Arguments.of("negate", unary(Ops::negate), List.of(signed(9, 4))),
            Arguments.of("addConstant", unary(x -> Ops.addConstant(x, 1.5)), List.of(signed(10, 4))),
            Arguments.of("mulConstant", unary(x -> Ops.mulConstant(x, -2.0)), List.of(signed(11, 4))),
            Arguments.of("square", unary(Ops::square), List.of(signed(12, 2, 2))),
            Arguments.of("exp", unary(Ops::exp), List.of(signed(13, 2, 2))),
            Arguments.of("log", unary(Ops::log), List.of(positive(14, 2, 2))),
            Arguments.of("tanh", unary(Ops::tanh), List.of(signed(15, 3))),
            Arguments.of("sigmoid", unary(Ops::sigmoid), List.of(signed(16, 3))),
            Arguments.of("xlogx", unary(Ops::xlogx), List.of(positive(17, 3))),
            Arguments.of("sum", unary(Ops::sum), List.of(signed(18, 2, 3))),
            Arguments.of("sumAxis0", unary(x -> Ops.sum(x, new int[]{0}, false)), List.of(signed(19, 2, 3))),
            Arguments.of("sumAxis1KeepDims", unary(x -> Ops.sum(x, new int[]{1}, true)), List.of(signed(20, 2, 3))),
            Arguments.of("broadcastTo", unary(x -> Ops.broadcastTo(x, 2, 3)), List.of(signed(21, 3))),
            Arguments.of("sumTo", unary(x -> Ops.sumTo(x, 3)), List.of(signed(22, 2, 3))),
            Arguments.of("sumToKeptAxis", unary(x -> Ops.sumTo(x, 2, 1)), List.of(signed(23, 2, 3))),
            Arguments.of("reshape", unary(x -> Ops.reshape(x, 3, 2)), List.of(signed(24, 2, 3))),
            Arguments.of("transpose", unary(Ops::transpose), List.of(signed(25, 2, 3))),
            Arguments.of("matmul", binary(Ops::matmul), List.of(signed(26, 2, 3), signed(27, 3, 4))),
            Arguments.of("identity", (Function<List<Variable>, List<Variable>>) xs -> Ops.identity(xs.get(0), xs.get(1)),
                List.of(signed(28, 2), signed(29, 3))),
            Arguments.of("linear", (Function<List<Variable>, List<Variable>>) xs ->
                    List.of(Ops.linear(xs.get(0), xs.get(1), xs.get(2))),
                List.of(signed(30, 2, 3), signed(31, 4, 3), signed(32, 4))),
            Arguments.of("linearNoBias", binary((x, w) -> Ops.linear(x, w, null)),
                List.of(signed(33, 2, 3), signed(34, 4, 3)))
        );
    }

    static Stream<Arguments> secondOrderCases() {
        return Stream.of(
            Arguments.of("multiply", binary(Ops::multiply), List.of(signed(40, 2, 2), signed(41, 2, 2))),
            Arguments.of("divide", binary(Ops::divide), List.of(signed(42, 2, 2), positive(43, 2, 2))),
            Arguments.of("square", unary(Ops::square), List.of(signed(44, 3))),
            Arguments.of("exp", unary(Ops::exp), List.of(signed(45, 3))),
            Arguments.of("log", unary(Ops::log), List.of(positive(46, 3))),
            Arguments.of("tanh", unary(Ops::tanh), List.of(signed(47, 3))),
            Arguments.of("sigmoid", unary(Ops::sigmoid), List.of(signed(48, 3))),
            Arguments.of("xlogx", unary(Ops::xlogx), List.of(positive(49, 3))),
            Arguments.of("matmul", binary(Ops::matmul), List.of(signed(50, 2, 3), signed(51, 3, 2))),
            Arguments.of("sumOfSquares", unary(x -> Ops.sum(Ops.square(x), new int[]{1}, false)),
                List.of(signed(52, 2, 3))),
            Arguments.of("tanhLinear", (Function<List<Variable>, List<Variable>>) xs ->
                    List.of(Ops.tanh(Ops.linear(xs.get(0), xs.get(1), xs.get(2)))),
                List.of(signed(53, 2, 3), signed(54, 2, 3), signed(55, 2)))
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("firstOrderCases")
    void backwardMatchesNumericalGradient(String name, Function<List<Variable>, List<Variable>> fn,
                                          List<NdArray> inputs) {
        GradientCheck.checkBackward(fn, inputs, seedsFor(fn, inputs, 100));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("secondOrderCases")
    void doubleBackwardMatchesNumericalGradient(String name, Function<List<Variable>, List<Variable>> fn,
                                                List<NdArray> inputs) {
        List<NdArray> gys = seedsFor(fn, inputs, 200);
        List<NdArray> ggxs = new ArrayList<>();
        for (int i = 0; i < inputs.size(); i++) {
            ggxs.add(signed(300 + i, inputs.get(i).shape()));
        }
        GradientCheck.checkDoubleBackward(fn, inputs, gys, ggxs);
    }
}
