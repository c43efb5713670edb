package io.surfworks.warpgrad.core.functions;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.error.NumericalWarning;
import io.surfworks.warpgrad.core.error.NumericalWarnings;
import io.surfworks.warpgrad.core.graph.OperationNode;
import io.surfworks.warpgrad.core.graph.Variable;
import io.surfworks.warpgrad.core.typecheck.InputTypes;

import java.util.List;

/**
 * {@code x * log(x)}, continuously extended with {@code 0} at {@code x = 0}.
 *
 * <p>The derivative {@code log(x) + 1} is undefined at zero. There the
 * gradient is taken as {@code 0} and a {@link NumericalWarning} is raised.
 */
public final class XLogX extends OperationNode {

    @Override
    protected void checkTypeForward(InputTypes in) {
        in.expectSize(1);
        in.get(0).expectFloating();
    }

    @Override
    public List<NdArray> forward(List<NdArray> inputs) {
        retainInputs(0);
        NdArray x = inputs.get(0);
        return List.of(x.backend().math().map(x, v -> v == 0.0 ? 0.0 : v * Math.log(v)));
    }

    @Override
    public List<Variable> backward(int[] targetInputIndexes, List<Variable> gradOutputs) {
        Variable x = retainedInputs().get(0);
        long zeroAt = firstZero(x.array());
        if (zeroAt >= 0) {
            NumericalWarnings.raise(new NumericalWarning(label(),
                    "cannot calculate gradient for zero input", zeroAt));
        }
        Variable slope = new Derivative().applySingle(x);
        return List.of(Ops.multiply(gradOutputs.get(0), slope));
    }

    private static long firstZero(NdArray array) {
        for (long i = 0; i < array.size(); i++) {
            if (array.getDouble(i) == 0.0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * {@code log(x) + 1}, and {@code 0} at {@code x = 0}.
     */
    static final class Derivative extends OperationNode {

        @Override
        public String label() {
            return "XLogXGrad";
        }

        @Override
        public List<NdArray> forward(List<NdArray> inputs) {
            retainInputs(0);
            NdArray x = inputs.get(0);
            return List.of(x.backend().math().map(x, v -> v == 0.0 ? 0.0 : Math.log(v) + 1.0));
        }

        @Override
        public List<Variable> backward(int[] targetInputIndexes, List<Variable> gradOutputs) {
            Variable x = retainedInputs().get(0);
            Variable reciprocal = new Reciprocal().applySingle(x);
            return List.of(Ops.multiply(gradOutputs.get(0), reciprocal));
        }
    }

    /**
     * {@code 1 / x}, and {@code 0} at {@code x = 0}.
     */
    static final class Reciprocal extends OperationNode {

        @Override
        public List<NdArray> forward(List<NdArray> inputs) {
            retainInputs(0);
            NdArray x = inputs.get(0);
            return List.of(x.backend().math().map(x, v -> v == 0.0 ? 0.0 : 1.0 / v));
        }

        @Override
        public List<Variable> backward(int[] targetInputIndexes, List<Variable> gradOutputs) {
            Variable x = retainedInputs().get(0);
            Variable r = new Reciprocal().applySingle(x);
            return List.of(Ops.negate(Ops.multiply(gradOutputs.get(0), Ops.square(r))));
        }
    }
}
