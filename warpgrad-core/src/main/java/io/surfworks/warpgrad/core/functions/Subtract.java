package io.surfworks.warpgrad.core.functions;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.graph.OperationNode;
import io.surfworks.warpgrad.core.graph.Variable;
import io.surfworks.warpgrad.core.typecheck.InputTypes;

import java.util.Arrays;
import java.util.List;

public final class Subtract extends OperationNode {

    @Override
    protected void checkTypeForward(InputTypes in) {
        in.expectSize(2).expectAllSameDtype().expectAllSameShape();
    }

    @Override
    public List<NdArray> forward(List<NdArray> inputs) {
        NdArray a = inputs.get(0);
        return List.of(a.backend().math().subtract(a, inputs.get(1)));
    }

    @Override
    public List<Variable> backward(int[] targetInputIndexes, List<Variable> gradOutputs) {
        Variable gy = gradOutputs.get(0);
        Variable gb = Indexes.contains(targetInputIndexes, 1) ? Ops.negate(gy) : null;
        return Arrays.asList(gy, gb);
    }
}
