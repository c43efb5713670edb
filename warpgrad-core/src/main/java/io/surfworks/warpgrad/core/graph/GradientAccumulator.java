package io.surfworks.warpgrad.core.graph;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.typecheck.InputTypes;

import java.util.Arrays;
import java.util.List;

/**
 * Sums partial gradients. The sum is itself a graph operation, so it is
 * differentiable when double backprop is enabled and recorded when a static
 * region is traced.
 */
public final class GradientAccumulator {

    private GradientAccumulator() {
    }

    /**
     * Returns {@code a + b}; a null operand yields the other one unchanged.
     */
    public static Variable add(Variable a, Variable b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return new AccumulateGrad().applySingle(a, b);
    }

    private static final class AccumulateGrad extends OperationNode {

        @Override
        public String label() {
            return "_AccumulateGrad";
        }

        @Override
        protected void checkTypeForward(InputTypes in) {
            in.expectSize(2);
            in.get(1).expectSameDtype(in.get(0)).expectShapeEquals(in.get(0));
        }

        @Override
        public List<NdArray> forward(List<NdArray> inputs) {
            NdArray a = inputs.get(0);
            return List.of(a.backend().math().add(a, inputs.get(1)));
        }

        @Override
        public List<Variable> backward(int[] targetInputIndexes, List<Variable> gradOutputs) {
            Variable gy = gradOutputs.get(0);
            return Arrays.asList(gy, gy);
        }
    }
}
