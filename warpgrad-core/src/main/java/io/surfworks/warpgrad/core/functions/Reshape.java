package io.surfworks.warpgrad.core.functions;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.array.TensorSpec;
import io.surfworks.warpgrad.core.graph.OperationNode;
import io.surfworks.warpgrad.core.graph.Variable;
import io.surfworks.warpgrad.core.typecheck.InputTypes;

import java.util.Arrays;
import java.util.List;

public final class Reshape extends OperationNode {

    private final int[] shape;
    private int[] inputShape;

    public Reshape(int... shape) {
        this.shape = shape.clone();
    }

    @Override
    public String label() {
        return "Reshape(" + Arrays.toString(shape) + ")";
    }

    @Override
    protected void checkTypeForward(InputTypes in) {
        in.expectSize(1);
        in.get(0).expectSize(TensorSpec.elementCount(shape));
    }

    @Override
    public List<NdArray> forward(List<NdArray> inputs) {
        NdArray x = inputs.get(0);
        inputShape = x.shape();
        return List.of(x.backend().math().reshape(x, shape));
    }

    @Override
    public List<Variable> backward(int[] targetInputIndexes, List<Variable> gradOutputs) {
        return List.of(Ops.reshape(gradOutputs.get(0), inputShape));
    }
}
