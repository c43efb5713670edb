package io.surfworks.warpgrad.core.graph;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.array.TensorSpec;
import io.surfworks.warpgrad.core.config.AutogradConfig;
import io.surfworks.warpgrad.core.config.ConfigContext;
import io.surfworks.warpgrad.core.error.GraphStateException;
import io.surfworks.warpgrad.core.error.NaNPolicy;
import io.surfworks.warpgrad.core.error.NumericalGuard;
import io.surfworks.warpgrad.core.typecheck.InputTypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Applies an {@link OperationNode} to input variables, wiring the result into
 * the graph according to the active {@link AutogradConfig}.
 */
public final class GraphBuilder {

    private GraphBuilder() {
    }

    /**
     * Runs type checking, the forward computation and graph construction.
     *
     * <p>With backprop disabled the outputs are plain leaves and the node is
     * discarded. Otherwise each output becomes a variable created by
     * {@code node}, which keeps only weak references to them.
     *
     * @throws io.surfworks.warpgrad.core.error.TypeCheckException if the input contract is violated
     * @throws GraphStateException if the node was already applied or an input has no array
     */
    public static List<Variable> apply(OperationNode node, List<Variable> inputs) {
        Objects.requireNonNull(node, "node cannot be null");
        Objects.requireNonNull(inputs, "inputs cannot be null");
        node.markApplied();

        List<NdArray> inArrays = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            Variable input = inputs.get(i);
            Objects.requireNonNull(input, "input cannot be null");
            if (input.array() == null) {
                throw new GraphStateException(node.label() + ": input[" + i + "] has no array");
            }
            inArrays.add(input.array());
        }

        AutogradConfig config = ConfigContext.current();
        if (config.typeCheck()) {
            List<TensorSpec> specs = new ArrayList<>(inArrays.size());
            for (NdArray a : inArrays) {
                specs.add(a.spec());
            }
            node.checkTypeForward(new InputTypes(node.label(), specs));
        }

        node.retention().begin(inputs.size());
        List<NdArray> outArrays = node.forward(Collections.unmodifiableList(inArrays));
        if (outArrays == null || outArrays.isEmpty()) {
            throw new GraphStateException(node.label() + ".forward returned no outputs");
        }
        for (int i = 0; i < outArrays.size(); i++) {
            if (outArrays.get(i) == null) {
                throw new GraphStateException(node.label() + ".forward returned null for output " + i);
            }
        }
        node.retention().bind(inArrays, outArrays);
        node.recordOutputSpecs(outArrays);

        NaNPolicy policy = config.effectiveNanPolicy();
        if (policy != NaNPolicy.IGNORE) {
            for (NdArray out : outArrays) {
                NumericalGuard.check(out, node.label() + " (forward)", policy);
            }
        }

        CallRecorder recorder = CallRecorder.current();
        if (recorder != null) {
            recorder.record(node, List.copyOf(inArrays), List.copyOf(outArrays));
        }

        List<Variable> outputs = new ArrayList<>(outArrays.size());
        if (!config.enableBackprop()) {
            node.retention().release();
            for (NdArray out : outArrays) {
                outputs.add(new Variable(out));
            }
            return outputs;
        }

        boolean requiresGrad = false;
        for (Variable input : inputs) {
            requiresGrad |= input.requiresGrad();
        }
        for (NdArray out : outArrays) {
            outputs.add(new Variable(out, requiresGrad));
        }
        node.attach(inputs, outputs);
        return outputs;
    }
}
