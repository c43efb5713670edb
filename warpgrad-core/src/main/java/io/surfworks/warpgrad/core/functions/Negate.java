package io.surfworks.warpgrad.core.functions;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.graph.OperationNode;
import io.surfworks.warpgrad.core.graph.Variable;
import io.surfworks.warpgrad.core.typecheck.InputTypes;

import java.util.List;

public final class Negate extends OperationNode {

    @Override
    protected void checkTypeForward(InputTypes in) {
        in.expectSize(1);
    }

    @Override
    public List<NdArray> forward(List<NdArray> inputs) {
        NdArray x = inputs.get(0);
        return List.of(x.backend().math().negate(x));
    }

    @Override
    public List<Variable> backward(int[] targetInputIndexes, List<Variable> gradOutputs) {
        return List.of(Ops.negate(gradOutputs.get(0)));
    }
}
