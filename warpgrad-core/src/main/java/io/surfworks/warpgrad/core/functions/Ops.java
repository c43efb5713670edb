package io.surfworks.warpgrad.core.functions;

import io.surfworks.warpgrad.core.graph.Variable;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Static entry points of the reference operator catalog.
 *
 * <p>Every call creates a fresh {@link io.surfworks.warpgrad.core.graph.OperationNode}
 * and applies it. Every backward formula is itself built from these calls, so
 * all operators support double backprop.
 *
 * <pre>{@code
 * Variable h = Ops.tanh(Ops.linear(x, w1, b1));
 * Variable loss = Ops.sum(Ops.square(Ops.linear(h, w2, b2)));
 * loss.backward();
 * }</pre>
 */
public final class Ops {

    private Ops() {
    }

    // ==================== Arithmetic ====================

    public static Variable add(Variable a, Variable b) {
        return new Add().applySingle(a, b);
    }

    public static Variable subtract(Variable a, Variable b) {
        return new Subtract().applySingle(a, b);
    }

    public static Variable multiply(Variable a, Variable b) {
        return new Multiply().applySingle(a, b);
    }

    public static Variable divide(Variable a, Variable b) {
        return new Divide().applySingle(a, b);
    }

    public static Variable negate(Variable x) {
        return new Negate().applySingle(x);
    }

    public static Variable addConstant(Variable x, double value) {
        return new AddConstant(value).applySingle(x);
    }

    public static Variable mulConstant(Variable x, double value) {
        return new MulConstant(value).applySingle(x);
    }

    // ==================== Elementwise math ====================

    public static Variable square(Variable x) {
        return new Square().applySingle(x);
    }

    public static Variable exp(Variable x) {
        return new Exp().applySingle(x);
    }

    public static Variable log(Variable x) {
        return new Log().applySingle(x);
    }

    public static Variable tanh(Variable x) {
        return new Tanh().applySingle(x);
    }

    public static Variable sigmoid(Variable x) {
        return new Sigmoid().applySingle(x);
    }

    /**
     * {@code x * log(x)} with {@code 0 * log(0) = 0}.
     */
    public static Variable xlogx(Variable x) {
        return new XLogX().applySingle(x);
    }

    // ==================== Reductions and shape ====================

    /**
     * Sum of every element, as a 0-d array.
     */
    public static Variable sum(Variable x) {
        return new Sum().applySingle(x);
    }

    public static Variable sum(Variable x, int[] axes, boolean keepDims) {
        return new Sum(axes, keepDims).applySingle(x);
    }

    public static Variable broadcastTo(Variable x, int... shape) {
        if (Arrays.equals(x.shape(), shape)) {
            return x;
        }
        return new BroadcastTo(shape).applySingle(x);
    }

    public static Variable sumTo(Variable x, int... shape) {
        if (Arrays.equals(x.shape(), shape)) {
            return x;
        }
        return new SumTo(shape).applySingle(x);
    }

    public static Variable reshape(Variable x, int... shape) {
        if (Arrays.equals(x.shape(), shape)) {
            return x;
        }
        return new Reshape(shape).applySingle(x);
    }

    public static Variable transpose(Variable x) {
        return new Transpose().applySingle(x);
    }

    public static List<Variable> identity(Variable... xs) {
        return new Identity().apply(xs);
    }

    // ==================== Linear algebra ====================

    public static Variable matmul(Variable a, Variable b) {
        return new MatMul().applySingle(a, b);
    }

    /**
     * Fully connected layer {@code x W^T + b} with {@code W} of shape
     * {@code (out, in)}. The bias may be null.
     */
    public static Variable linear(Variable x, Variable w, Variable b) {
        Objects.requireNonNull(x, "x cannot be null");
        Objects.requireNonNull(w, "w cannot be null");
        Variable y = matmul(x, transpose(w));
        if (b == null) {
            return y;
        }
        return add(y, broadcastTo(b, y.shape()));
    }
}
