package io.surfworks.warpgrad.core.functions;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.graph.OperationNode;
import io.surfworks.warpgrad.core.graph.Variable;

import java.util.List;

/**
 * Passes its inputs through. The outputs are the very same arrays as the
 * inputs, which makes this the canonical aliasing operation.
 */
public final class Identity extends OperationNode {

    @Override
    public List<NdArray> forward(List<NdArray> inputs) {
        return List.copyOf(inputs);
    }

    @Override
    public List<Variable> backward(int[] targetInputIndexes, List<Variable> gradOutputs) {
        return gradOutputs;
    }
}
