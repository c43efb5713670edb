package io.surfworks.warpgrad.core.functions;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.graph.OperationNode;
import io.surfworks.warpgrad.core.graph.Variable;
import io.surfworks.warpgrad.core.typecheck.InputTypes;

import java.util.Arrays;
import java.util.List;

public final class Divide extends OperationNode {

    @Override
    protected void checkTypeForward(InputTypes in) {
        in.expectSize(2).expectAllSameDtype().expectAllSameShape();
        in.get(0).expectFloating();
    }

    @Override
    public List<NdArray> forward(List<NdArray> inputs) {
        retainInputs(0, 1);
        NdArray a = inputs.get(0);
        return List.of(a.backend().math().divide(a, inputs.get(1)));
    }

    @Override
    public List<Variable> backward(int[] targetInputIndexes, List<Variable> gradOutputs) {
        List<Variable> xs = retainedInputs();
        Variable x0 = xs.get(0);
        Variable x1 = xs.get(1);
        Variable ga = Ops.divide(gradOutputs.get(0), x1);
        Variable gb = null;
        if (Indexes.contains(targetInputIndexes, 1)) {
            gb = Ops.negate(Ops.divide(Ops.multiply(ga, x0), x1));
        }
        return Arrays.asList(ga, gb);
    }
}
