package io.surfworks.warpgrad.core.graph;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.array.TensorSpec;
import io.surfworks.warpgrad.core.error.GraphStateException;
import io.surfworks.warpgrad.core.typecheck.InputTypes;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Operation node of the computational graph, and the contract every operator
 * implements.
 *
 * <p>An instance records exactly one application: it holds its input
 * variables strongly, its outputs weakly, and the rank {@code 1 + max(input
 * ranks)}. Subclasses implement:
 * <ul>
 *   <li>{@link #checkTypeForward(InputTypes)}: input contract, optional</li>
 *   <li>{@link #forward(List)}: arrays in, arrays out, through the inputs' backend</li>
 *   <li>{@link #backward(int[], List)}: one gradient per input, null where not needed</li>
 * </ul>
 * and call {@link #retainInputs(int...)} / {@link #retainOutputs(int...)} from
 * {@code forward} for every value the backward formula reads.
 *
 * <pre>{@code
 * final class Exp extends OperationNode {
 *     public List<NdArray> forward(List<NdArray> in) {
 *         retainOutputs(0);
 *         return List.of(in.get(0).backend().math().exp(in.get(0)));
 *     }
 *     public List<Variable> backward(int[] targets, List<Variable> gy) {
 *         return List.of(Ops.multiply(gy.get(0), retainedOutputs().get(0)));
 *     }
 * }
 * }</pre>
 */
public abstract class OperationNode {

    private final RetentionManager retention = new RetentionManager();
    private List<Variable> inputs = List.of();
    private List<WeakReference<Variable>> outputs = List.of();
    private List<TensorSpec> outputSpecs = List.of();
    private int rank;
    private boolean applied;
    private boolean unchained;

    // ==================== Operator contract ====================

    /**
     * Name used in error messages and graph exports.
     */
    public String label() {
        return getClass().getSimpleName();
    }

    /**
     * Validates input shapes and dtypes before any computation runs.
     *
     * @throws io.surfworks.warpgrad.core.error.TypeCheckException on a violated expectation
     */
    protected void checkTypeForward(InputTypes in) {
    }

    /**
     * Computes output arrays from input arrays. Must not modify its inputs.
     */
    public abstract List<NdArray> forward(List<NdArray> inputs);

    /**
     * Computes input gradients from output gradients.
     *
     * @param targetInputIndexes inputs whose gradients are needed, ascending
     * @param gradOutputs        one gradient per output, never null
     * @return a list with one entry per input; entries outside the targets may be null
     */
    public abstract List<Variable> backward(int[] targetInputIndexes, List<Variable> gradOutputs);

    // ==================== Application ====================

    public final List<Variable> apply(Variable... inputs) {
        return GraphBuilder.apply(this, Arrays.asList(inputs));
    }

    /**
     * Applies an operation with exactly one output.
     */
    public final Variable applySingle(Variable... inputs) {
        List<Variable> outs = apply(inputs);
        if (outs.size() != 1) {
            throw new IllegalStateException(label() + " produced " + outs.size() + " outputs, expected 1");
        }
        return outs.get(0);
    }

    // ==================== Retention ====================

    protected final void retainInputs(int... indexes) {
        retention.requestInputs(indexes);
    }

    protected final void retainOutputs(int... indexes) {
        retention.requestOutputs(indexes);
    }

    /**
     * Input variables by retained index, in the order requested.
     *
     * <p>If an input's array was replaced after forward, a detached variable
     * holding the forward-time array is returned instead.
     */
    protected final List<Variable> retainedInputs() {
        int[] indexes = retention.retainedInputIndexes();
        List<Variable> result = new ArrayList<>(indexes.length);
        for (int index : indexes) {
            Variable input = inputs.get(index);
            NdArray kept = retention.inputArray(index);
            if (kept == null || input.array() == kept) {
                result.add(input);
            } else {
                result.add(new Variable(kept, input.requiresGrad()));
            }
        }
        return result;
    }

    /**
     * Output variables by retained index, in the order requested.
     *
     * <p>An output whose variable has been collected is recreated around the
     * retained array, with this node as its creator, so gradients still flow
     * through it.
     */
    protected final List<Variable> retainedOutputs() {
        int[] indexes = retention.retainedOutputIndexes();
        List<Variable> result = new ArrayList<>(indexes.length);
        for (int index : indexes) {
            NdArray kept = retention.outputArray(index);
            if (kept == null) {
                throw new GraphStateException(label() + ": retained output " + index + " has been released");
            }
            Variable live = index < outputs.size() ? outputs.get(index).get() : null;
            if (live != null && live.array() == kept) {
                result.add(live);
                continue;
            }
            Variable recreated = new Variable(kept);
            if (!unchained && index < outputs.size()) {
                recreated.setCreator(this);
                if (live == null) {
                    List<WeakReference<Variable>> refs = new ArrayList<>(outputs);
                    refs.set(index, new WeakReference<>(recreated));
                    outputs = Collections.unmodifiableList(refs);
                }
            }
            result.add(recreated);
        }
        return result;
    }

    public final RetentionManager retention() {
        return retention;
    }

    // ==================== Graph ====================

    /**
     * Input variables; empty once unchained.
     */
    public final List<Variable> inputs() {
        return inputs;
    }

    /**
     * Output variables that are still alive; collected outputs are null.
     */
    public final List<Variable> outputs() {
        List<Variable> live = new ArrayList<>(outputs.size());
        for (WeakReference<Variable> ref : outputs) {
            live.add(ref.get());
        }
        return live;
    }

    public final List<TensorSpec> outputSpecs() {
        return outputSpecs;
    }

    public final int outputCount() {
        return outputSpecs.size();
    }

    public final int rank() {
        return rank;
    }

    /**
     * Unchains live outputs and drops inputs and retained arrays. The node
     * can no longer be back-propagated. Idempotent.
     */
    public final void unchain() {
        for (WeakReference<Variable> ref : outputs) {
            Variable out = ref.get();
            if (out != null && out.creator() == this) {
                out.unchain();
            }
        }
        inputs = List.of();
        retention.release();
        unchained = true;
    }

    public final boolean isUnchained() {
        return unchained;
    }

    // ==================== Builder hooks ====================

    final void markApplied() {
        if (applied) {
            throw new GraphStateException(label() + " has already been applied; create a new node per call");
        }
        applied = true;
    }

    final void attach(List<Variable> inputVars, List<Variable> outputVars) {
        int maxRank = -1;
        for (Variable input : inputVars) {
            maxRank = Math.max(maxRank, input.rank());
        }
        this.rank = maxRank + 1;
        this.inputs = List.copyOf(inputVars);
        List<WeakReference<Variable>> refs = new ArrayList<>(outputVars.size());
        for (Variable out : outputVars) {
            out.setCreator(this);
            refs.add(new WeakReference<>(out));
        }
        this.outputs = Collections.unmodifiableList(refs);
    }

    final void recordOutputSpecs(List<NdArray> outputArrays) {
        List<TensorSpec> specs = new ArrayList<>(outputArrays.size());
        for (NdArray a : outputArrays) {
            specs.add(a.spec());
        }
        this.outputSpecs = List.copyOf(specs);
    }

    @Override
    public String toString() {
        return label() + "(rank=" + rank + ", inputs=" + inputs.size() + ", outputs=" + outputSpecs.size() + ")";
    }
}
