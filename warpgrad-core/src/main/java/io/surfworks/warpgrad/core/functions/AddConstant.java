package io.surfworks.warpgrad.core.functions;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.graph.OperationNode;
import io.surfworks.warpgrad.core.graph.Variable;
import io.surfworks.warpgrad.core.typecheck.InputTypes;

import java.util.List;

/**
 * {@code x + c} for a scalar constant.
 */
public final class AddConstant extends OperationNode {

    private final double value;

    public AddConstant(double value) {
        this.value = value;
    }

    @Override
    public String label() {
        return "AddConstant(" + value + ")";
    }

    @Override
    protected void checkTypeForward(InputTypes in) {
        in.expectSize(1);
    }

    @Override
    public List<NdArray> forward(List<NdArray> inputs) {
        NdArray x = inputs.get(0);
        return List.of(x.backend().math().addScalar(x, value));
    }

    @Override
    public List<Variable> backward(int[] targetInputIndexes, List<Variable> gradOutputs) {
        return List.of(gradOutputs.get(0));
    }
}
