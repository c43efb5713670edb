package io.surfworks.warpgrad.core.functions;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.graph.OperationNode;
import io.surfworks.warpgrad.core.graph.Variable;
import io.surfworks.warpgrad.core.typecheck.InputTypes;

import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Sums an array down to a shape that broadcasts back to it. Inverse of
 * {@link BroadcastTo} for gradients.
 */
public final class SumTo extends OperationNode {

    private final int[] shape;
    private int[] inputShape;

    public SumTo(int... shape) {
        this.shape = shape.clone();
    }

    @Override
    public String label() {
        return "SumTo(" + Arrays.toString(shape) + ")";
    }

    @Override
    protected void checkTypeForward(InputTypes in) {
        in.expectSize(1);
        in.get(0).expectReducibleTo(shape);
    }

    @Override
    public List<NdArray> forward(List<NdArray> inputs) {
        NdArray x = inputs.get(0);
        inputShape = x.shape();
        if (Arrays.equals(inputShape, shape)) {
            return List.of(x.backend().copy(x));
        }
        int lead = inputShape.length - shape.length;
        int[] axes = IntStream.range(0, inputShape.length)
                .filter(d -> d < lead || (shape[d - lead] == 1 && inputShape[d] != 1))
                .toArray();
        NdArray summed = x.backend().math().sum(x, axes, true);
        return List.of(x.backend().math().reshape(summed, shape));
    }

    @Override
    public List<Variable> backward(int[] targetInputIndexes, List<Variable> gradOutputs) {
        return List.of(Ops.broadcastTo(gradOutputs.get(0), inputShape));
    }
}
