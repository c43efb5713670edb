package io.surfworks.warpgrad.benchmark;

import io.surfworks.warpgrad.core.array.ScalarType;
import io.surfworks.warpgrad.core.functions.Ops;
import io.surfworks.warpgrad.core.graph.Variable;

import java.util.List;
import java.util.Random;

/**
 * Two-layer perceptron {@code linear(tanh(linear(x)))} with deterministic
 * weights, used as the benchmark workload.
 */
public final class MlpModel {

    private final int inputSize;
    private final Variable w1;
    private final Variable b1;
    private final Variable w2;
    private final Variable b2;

    public MlpModel(int inputSize, int hiddenSize, int outputSize, long seed) {
        if (inputSize <= 0 || hiddenSize <= 0 || outputSize <= 0) {
            throw new IllegalArgumentException("Layer sizes must be positive");
        }
        Random random = new Random(seed);
        this.inputSize = inputSize;
        this.w1 = new Variable(Variable.of(ScalarType.F32,
            gaussian(random, hiddenSize * inputSize, 1.0 / Math.sqrt(inputSize)), hiddenSize, inputSize).array(), "w1");
        this.b1 = new Variable(Variable.of(ScalarType.F32, new double[hiddenSize], hiddenSize).array(), "b1");
        this.w2 = new Variable(Variable.of(ScalarType.F32,
            gaussian(random, outputSize * hiddenSize, 1.0 / Math.sqrt(hiddenSize)), outputSize, hiddenSize).array(), "w2");
        this.b2 = new Variable(Variable.of(ScalarType.F32, new double[outputSize], outputSize).array(), "b2");
    }

    public Variable forward(Variable x) {
        return Ops.linear(Ops.tanh(Ops.linear(x, w1, b1)), w2, b2);
    }

    /**
     * Mean over the batch of the squared output norm.
     */
    public static Variable loss(Variable y) {
        return Ops.mulConstant(Ops.sum(Ops.square(y)), 1.0 / y.shape()[0]);
    }

    public List<Variable> parameters() {
        return List.of(w1, b1, w2, b2);
    }

    public void clearGrads() {
        for (Variable p : parameters()) {
            p.clearGrad();
        }
    }

    /**
     * A batch of standard normal inputs.
     */
    public Variable input(int batch, long seed) {
        Random random = new Random(seed);
        return new Variable(Variable.of(ScalarType.F32, gaussian(random, batch * inputSize, 1.0),
            batch, inputSize).array(), false);
    }

    private static double[] gaussian(Random random, int count, double scale) {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = random.nextGaussian() * scale;
        }
        return values;
    }
}
