package io.surfworks.warpgrad.core.functions;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.graph.OperationNode;
import io.surfworks.warpgrad.core.graph.Variable;
import io.surfworks.warpgrad.core.typecheck.InputTypes;

import java.util.Arrays;
import java.util.List;

public final class BroadcastTo extends OperationNode {

    private final int[] shape;
    private int[] inputShape;

    public BroadcastTo(int... shape) {
        this.shape = shape.clone();
    }

    @Override
    public String label() {
        return "BroadcastTo(" + Arrays.toString(shape) + ")";
    }

    @Override
    protected void checkTypeForward(InputTypes in) {
        in.expectSize(1);
        in.get(0).expectBroadcastableTo(shape);
    }

    @Override
    public List<NdArray> forward(List<NdArray> inputs) {
        NdArray x = inputs.get(0);
        inputShape = x.shape();
        return List.of(x.backend().math().broadcastTo(x, shape));
    }

    @Override
    public List<Variable> backward(int[] targetInputIndexes, List<Variable> gradOutputs) {
        return List.of(Ops.sumTo(gradOutputs.get(0), inputShape));
    }
}
