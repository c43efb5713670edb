package io.surfworks.warpgrad.core.graph;

import io.surfworks.warpgrad.core.array.BackendRegistry;
import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.array.ScalarType;
import io.surfworks.warpgrad.core.array.TensorSpec;
import io.surfworks.warpgrad.core.error.GraphStateException;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Value node of the computational graph.
 *
 * <p>A variable wraps one array, its accumulated gradient and a strong
 * reference to the {@link OperationNode} that produced it. Leaves have no
 * creator and rank 0; an output of a node shares the node's rank.
 *
 * <p>Only variables of a floating dtype ever receive gradients.
 */
public final class Variable {

    private static final AtomicLong NEXT_ID = new AtomicLong();

    private final long id = NEXT_ID.incrementAndGet();
    private final boolean requiresGrad;
    private NdArray array;
    private Variable grad;
    private OperationNode creator;
    private int rank;
    private String name;

    public Variable(NdArray array) {
        this(array, true);
    }

    public Variable(NdArray array, boolean requiresGrad) {
        this.array = array;
        this.requiresGrad = requiresGrad;
    }

    public Variable(NdArray array, String name) {
        this(array, true);
        this.name = name;
    }

    /**
     * F64 scalar leaf on the default backend.
     */
    public static Variable of(double value) {
        return new Variable(BackendRegistry.getDefault().scalar(ScalarType.F64, value));
    }

    /**
     * Leaf holding row-major {@code values} on the default backend.
     */
    public static Variable of(ScalarType dtype, double[] values, int... shape) {
        return new Variable(BackendRegistry.getDefault().fromDoubles(TensorSpec.of(dtype, shape), values));
    }

    // ==================== Data ====================

    /**
     * The wrapped array, or null while pending.
     */
    public NdArray array() {
        return array;
    }

    public void setArray(NdArray array) {
        this.array = array;
    }

    public Variable grad() {
        return grad;
    }

    public NdArray gradArray() {
        return grad == null ? null : grad.array();
    }

    /**
     * Replaces the gradient.
     *
     * @throws IllegalArgumentException if the gradient shape differs from the data shape
     */
    public void setGrad(Variable grad) {
        if (grad != null && grad.array() != null && array != null
                && !Arrays.equals(grad.array().spec().shape(), array.spec().shape())) {
            throw new IllegalArgumentException("Gradient shape " + Arrays.toString(grad.array().spec().shape())
                    + " does not match data shape " + Arrays.toString(array.spec().shape()));
        }
        this.grad = grad;
    }

    public void setGradArray(NdArray gradArray) {
        setGrad(gradArray == null ? null : new Variable(gradArray));
    }

    /**
     * Drops the gradient.
     */
    public void clearGrad() {
        this.grad = null;
    }

    /**
     * Fills the gradient with zeros.
     */
    public void zeroGrad() {
        requireArray("zeroGrad");
        setGradArray(array.backend().zerosLike(array));
    }

    // ==================== Graph ====================

    public OperationNode creator() {
        return creator;
    }

    void setCreator(OperationNode node) {
        this.creator = node;
        this.rank = node.rank();
    }

    public int rank() {
        return rank;
    }

    /**
     * True when the variable may receive a gradient: requested at creation
     * and of a floating dtype.
     */
    public boolean requiresGrad() {
        return requiresGrad && (array == null || array.dtype().isFloating());
    }

    /**
     * Severs the link to the creator. Idempotent.
     */
    public void unchain() {
        this.creator = null;
    }

    /**
     * Unchains every variable reachable upstream of this one, releasing the
     * whole backward graph.
     */
    public void unchainBackward() {
        if (creator == null) {
            return;
        }
        Set<OperationNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<OperationNode> pending = new ArrayDeque<>();
        pending.push(creator);
        seen.add(creator);
        while (!pending.isEmpty()) {
            OperationNode node = pending.pop();
            for (Variable input : node.inputs()) {
                OperationNode upstream = input.creator();
                if (upstream != null && seen.add(upstream)) {
                    pending.push(upstream);
                }
            }
            node.unchain();
        }
        unchain();
    }

    // ==================== Backward ====================

    public void backward() {
        backward(false, false);
    }

    public void backward(boolean retainGrad) {
        backward(retainGrad, false);
    }

    /**
     * Accumulates gradients of this variable into every leaf upstream.
     *
     * @param retainGrad           keep gradients of intermediate variables
     * @param enableDoubleBackprop build a differentiable graph of the gradients
     */
    public void backward(boolean retainGrad, boolean enableDoubleBackprop) {
        BackwardPropagator.backward(this, retainGrad, enableDoubleBackprop);
    }

    // ==================== Metadata ====================

    public long id() {
        return id;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * Short description used in graph exports: shape and dtype, or
     * "pending" when no array is attached.
     */
    public String label() {
        if (array == null) {
            return "pending";
        }
        return Arrays.toString(array.spec().shape()) + ", " + array.dtype().name().toLowerCase();
    }

    public int[] shape() {
        requireArray("shape");
        return array.shape();
    }

    public ScalarType dtype() {
        requireArray("dtype");
        return array.dtype();
    }

    public int ndim() {
        requireArray("ndim");
        return array.ndim();
    }

    public long size() {
        requireArray("size");
        return array.size();
    }

    private void requireArray(String what) {
        if (array == null) {
            throw new GraphStateException("Variable has no array (" + what + ")");
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Variable(");
        if (name != null) {
            sb.append(name).append(", ");
        }
        sb.append(array == null ? "pending" : array.toString());
        if (creator != null) {
            sb.append(", creator=").append(creator.label());
        }
        return sb.append(')').toString();
    }
}
