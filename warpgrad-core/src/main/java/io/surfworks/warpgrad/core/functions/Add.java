package io.surfworks.warpgrad.core.functions;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.graph.OperationNode;
import io.surfworks.warpgrad.core.graph.Variable;
import io.surfworks.warpgrad.core.typecheck.InputTypes;

import java.util.Arrays;
import java.util.List;

/**
 * Elementwise {@code a + b} of same-shaped operands.
 */
public final class Add extends OperationNode {

    @Override
    protected void checkTypeForward(InputTypes in) {
        in.expectSize(2).expectAllSameDtype().expectAllSameShape();
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
