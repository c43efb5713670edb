package io.surfworks.warpgrad.core.functions;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.graph.OperationNode;
import io.surfworks.warpgrad.core.graph.Variable;
import io.surfworks.warpgrad.core.typecheck.InputTypes;

import java.util.Arrays;
import java.util.List;

/**
 * Matrix product of two 2-D operands.
 */
public final class MatMul extends OperationNode {

    @Override
    protected void checkTypeForward(InputTypes in) {
        in.expectSize(2).expectAllSameDtype();
        in.get(0).expectFloating().expectNdim(2);
        in.get(1).expectNdim(2);
        in.get(0).expectDimEquals(1, in.get(1), 0);
    }

    @Override
    public List<NdArray> forward(List<NdArray> inputs) {
        retainInputs(0, 1);
        NdArray a = inputs.get(0);
        return List.of(a.backend().math().matmul(a, inputs.get(1)));
    }

    @Override
    public List<Variable> backward(int[] targetInputIndexes, List<Variable> gradOutputs) {
        List<Variable> xs = retainedInputs();
        Variable gy = gradOutputs.get(0);
        Variable ga = Indexes.contains(targetInputIndexes, 0)
                ? Ops.matmul(gy, Ops.transpose(xs.get(1))) : null;
        Variable gb = Indexes.contains(targetInputIndexes, 1)
                ? Ops.matmul(Ops.transpose(xs.get(0)), gy) : null;
        return Arrays.asList(ga, gb);
    }
}
