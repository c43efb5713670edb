package io.surfworks.warpgrad.core.typecheck;

import io.surfworks.warpgrad.core.array.ScalarType;
import io.surfworks.warpgrad.core.array.TensorSpec;

import java.util.Arrays;

/**
 * Descriptor of one operation input. Expectations return {@code this} so they
 * can be chained.
 */
public final class InputType {

    private final InputTypes owner;
    private final int index;
    private final TensorSpec spec;

    InputType(InputTypes owner, int index, TensorSpec spec) {
        this.owner = owner;
        this.index = index;
        this.spec = spec;
    }

    public int index() {
        return index;
    }

    public int ndim() {
        return spec.rank();
    }

    public int[] shape() {
        return spec.shape().clone();
    }

    public ScalarType dtype() {
        return spec.dtype();
    }

    public InputType expectDtype(ScalarType expected) {
        if (spec.dtype() != expected) {
            owner.fail(name() + ".dtype == " + expected, spec.dtype() + " != " + expected);
        }
        return this;
    }

    public InputType expectFloating() {
        if (!spec.dtype().isFloating()) {
            owner.fail(name() + ".dtype is floating", spec.dtype() + " is not floating");
        }
        return this;
    }

    public InputType expectNdim(int expected) {
        if (spec.rank() != expected) {
            owner.fail(name() + ".ndim == " + expected, spec.rank() + " != " + expected);
        }
        return this;
    }

    public InputType expectNdimAtLeast(int minimum) {
        if (spec.rank() < minimum) {
            owner.fail(name() + ".ndim >= " + minimum, spec.rank() + " < " + minimum);
        }
        return this;
    }

    public InputType expectSameDtype(InputType other) {
        if (spec.dtype() != other.spec.dtype()) {
            owner.fail(name() + ".dtype == " + other.name() + ".dtype",
                    spec.dtype() + " != " + other.spec.dtype());
        }
        return this;
    }

    public InputType expectShapeEquals(InputType other) {
        if (!spec.shapeEquals(other.spec)) {
            owner.fail(name() + ".shape == " + other.name() + ".shape",
                    Arrays.toString(spec.shape()) + " != " + Arrays.toString(other.spec.shape()));
        }
        return this;
    }

    public InputType expectShape(int... expected) {
        if (!Arrays.equals(spec.shape(), expected)) {
            owner.fail(name() + ".shape == " + Arrays.toString(expected),
                    Arrays.toString(spec.shape()) + " != " + Arrays.toString(expected));
        }
        return this;
    }

    /**
     * {@code this.shape[axis] == other.shape[otherAxis]}.
     */
    public InputType expectDimEquals(int axis, InputType other, int otherAxis) {
        int mine = dim(axis);
        int theirs = other.dim(otherAxis);
        if (mine != theirs) {
            owner.fail(name() + ".shape[" + axis + "] == " + other.name() + ".shape[" + otherAxis + "]",
                    mine + " != " + theirs);
        }
        return this;
    }

    public InputType expectBroadcastableTo(int[] target) {
        if (!spec.isBroadcastableTo(target)) {
            owner.fail(name() + ".shape is broadcastable to " + Arrays.toString(target),
                    Arrays.toString(spec.shape()));
        }
        return this;
    }

    /**
     * {@code target} broadcasts to this input's shape, so this input can be
     * summed down to it.
     */
    public InputType expectReducibleTo(int[] target) {
        if (!TensorSpec.of(spec.dtype(), target).isBroadcastableTo(spec.shape())) {
            owner.fail(name() + ".shape is reducible to " + Arrays.toString(target),
                    Arrays.toString(spec.shape()));
        }
        return this;
    }

    public InputType expectSize(long expected) {
        if (spec.elementCount() != expected) {
            owner.fail(name() + ".size == " + expected, spec.elementCount() + " != " + expected);
        }
        return this;
    }

    private int dim(int axis) {
        if (axis < 0 || axis >= spec.rank()) {
            owner.fail(name() + ".ndim > " + axis, spec.rank() + " <= " + axis);
        }
        return spec.shape()[axis];
    }

    private String name() {
        return "input[" + index + "]";
    }

    @Override
    public String toString() {
        return name() + "(shape=" + Arrays.toString(spec.shape()) + ", dtype=" + spec.dtype() + ")";
    }
}
