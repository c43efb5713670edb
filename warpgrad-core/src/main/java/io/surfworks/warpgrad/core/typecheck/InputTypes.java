package io.surfworks.warpgrad.core.typecheck;

import io.surfworks.warpgrad.core.array.TensorSpec;
import io.surfworks.warpgrad.core.error.TypeCheckException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Shape and dtype descriptors of the inputs of one operation call, with
 * expectation helpers that fail with a {@link TypeCheckException}.
 *
 * <pre>{@code
 * @Override
 * protected void checkTypeForward(InputTypes in) {
 *     in.expectSize(2);
 *     in.get(0).expectFloating().expectNdim(2);
 *     in.get(1).expectSameDtype(in.get(0)).expectNdim(2);
 *     in.get(0).expectDimEquals(1, in.get(1), 0);
 * }
 * }</pre>
 */
public final class InputTypes {

    private final String operation;
    private final List<InputType> types;

    public InputTypes(String operation, List<TensorSpec> specs) {
        this.operation = Objects.requireNonNull(operation, "operation cannot be null");
        Objects.requireNonNull(specs, "specs cannot be null");
        List<InputType> list = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            list.add(new InputType(this, i, specs.get(i)));
        }
        this.types = List.copyOf(list);
    }

    public String operation() {
        return operation;
    }

    public int size() {
        return types.size();
    }

    public InputType get(int index) {
        if (index < 0 || index >= types.size()) {
            fail("inputs.size() > " + index, types.size() + " <= " + index);
        }
        return types.get(index);
    }

    public List<InputType> all() {
        return types;
    }

    public InputTypes expectSize(int expected) {
        if (types.size() != expected) {
            fail("inputs.size() == " + expected, types.size() + " != " + expected);
        }
        return this;
    }

    /**
     * Every input shares the dtype of input[0].
     */
    public InputTypes expectAllSameDtype() {
        for (int i = 1; i < types.size(); i++) {
            types.get(i).expectSameDtype(types.get(0));
        }
        return this;
    }

    /**
     * Every input shares the shape of input[0].
     */
    public InputTypes expectAllSameShape() {
        for (int i = 1; i < types.size(); i++) {
            types.get(i).expectShapeEquals(types.get(0));
        }
        return this;
    }

    void fail(String expectation, String actual) {
        throw new TypeCheckException(operation, expectation, actual);
    }
}
