package io.surfworks.warpgrad.core.functions;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.graph.OperationNode;
import io.surfworks.warpgrad.core.graph.Variable;
import io.surfworks.warpgrad.core.typecheck.InputType;
import io.surfworks.warpgrad.core.typecheck.InputTypes;

import java.util.Arrays;
import java.util.List;

/**
 * Sum over a set of axes, or over every axis when none is given.
 */
public final class Sum extends OperationNode {

    private final int[] axes;
    private final boolean keepDims;
    private int[] inputShape;

    public Sum() {
        this(new int[0], false);
    }

    public Sum(int[] axes, boolean keepDims) {
        this.axes = axes.clone();
        this.keepDims = keepDims;
    }

    @Override
    public String label() {
        return axes.length == 0 ? "Sum" : "Sum(axes=" + Arrays.toString(axes) + ")";
    }

    @Override
    protected void checkTypeForward(InputTypes in) {
        in.expectSize(1);
        InputType x = in.get(0);
        for (int axis : axes) {
            x.expectNdimAtLeast(axis < 0 ? -axis : axis + 1);
        }
    }

    @Override
    public List<NdArray> forward(List<NdArray> inputs) {
        NdArray x = inputs.get(0);
        inputShape = x.shape();
        return List.of(x.backend().math().sum(x, axes, keepDims));
    }

    @Override
    public List<Variable> backward(int[] targetInputIndexes, List<Variable> gradOutputs) {
        Variable gy = gradOutputs.get(0);
        int[] kept = keptShape();
        if (!Arrays.equals(gy.shape(), kept)) {
            gy = Ops.reshape(gy, kept);
        }
        return List.of(Ops.broadcastTo(gy, inputShape));
    }

    private int[] keptShape() {
        int[] kept = inputShape.clone();
        if (axes.length == 0) {
            Arrays.fill(kept, 1);
            return kept;
        }
        for (int axis : axes) {
            kept[axis < 0 ? axis + kept.length : axis] = 1;
        }
        return kept;
    }
}
