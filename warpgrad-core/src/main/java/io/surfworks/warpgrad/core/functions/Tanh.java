package io.surfworks.warpgrad.core.functions;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.graph.OperationNode;
import io.surfworks.warpgrad.core.graph.Variable;
import io.surfworks.warpgrad.core.typecheck.InputTypes;

import java.util.List;

public final class Tanh extends OperationNode {

    @Override
    protected void checkTypeForward(InputTypes in) {
        in.expectSize(1);
        in.get(0).expectFloating();
    }

    @Override
    public List<NdArray> forward(List<NdArray> inputs) {
        retainOutputs(0);
        NdArray x = inputs.get(0);
        return List.of(x.backend().math().tanh(x));
    }

    @Override
    public List<Variable> backward(int[] targetInputIndexes, List<Variable> gradOutputs) {
        Variable y = retainedOutputs().get(0);
        // 1 - y^2
        Variable slope = Ops.addConstant(Ops.mulConstant(Ops.square(y), -1.0), 1.0);
        return List.of(Ops.multiply(gradOutputs.get(0), slope));
    }
}
