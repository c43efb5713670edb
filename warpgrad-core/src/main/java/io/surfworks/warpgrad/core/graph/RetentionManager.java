package io.surfworks.warpgrad.core.graph;

import io.surfworks.warpgrad.core.array.NdArray;

import java.util.Arrays;
import java.util.List;

/**
 * Bookkeeping of the inputs and outputs an {@link OperationNode} keeps
 * strongly for its backward computation.
 *
 * <p>Operators request retention from inside {@code forward}. Input indexes
 * are validated as soon as they are requested, output indexes once the
 * forward computation has reported how many outputs it produced. The arrays
 * held here are the exact objects seen at forward time.
 */
public final class RetentionManager {

    private static final int[] NONE = new int[0];

    private int inputCount = -1;
    private int[] inputIndexes = NONE;
    private int[] outputIndexes = NONE;
    private NdArray[] inputArrays;
    private NdArray[] outputArrays;

    RetentionManager() {
    }

    void begin(int inputCount) {
        this.inputCount = inputCount;
        for (int index : inputIndexes) {
            checkIndex("input", index, inputCount);
        }
    }

    void requestInputs(int... indexes) {
        int[] copy = indexes.clone();
        if (inputCount >= 0) {
            for (int index : copy) {
                checkIndex("input", index, inputCount);
            }
        }
        this.inputIndexes = copy;
    }

    void requestOutputs(int... indexes) {
        this.outputIndexes = indexes.clone();
    }

    /**
     * Captures the requested arrays after a successful forward computation.
     *
     * @throws IndexOutOfBoundsException if an output index is out of range
     */
    void bind(List<NdArray> inputs, List<NdArray> outputs) {
        for (int index : inputIndexes) {
            checkIndex("input", index, inputs.size());
        }
        for (int index : outputIndexes) {
            checkIndex("output", index, outputs.size());
        }
        inputArrays = new NdArray[inputs.size()];
        for (int index : inputIndexes) {
            inputArrays[index] = inputs.get(index);
        }
        outputArrays = new NdArray[outputs.size()];
        for (int index : outputIndexes) {
            outputArrays[index] = outputs.get(index);
        }
    }

    void release() {
        inputArrays = null;
        outputArrays = null;
    }

    public boolean isInputRetained(int index) {
        return contains(inputIndexes, index);
    }

    public boolean isOutputRetained(int index) {
        return contains(outputIndexes, index);
    }

    public int[] retainedInputIndexes() {
        return inputIndexes.clone();
    }

    public int[] retainedOutputIndexes() {
        return outputIndexes.clone();
    }

    public boolean isReleased() {
        return inputArrays == null && outputArrays == null;
    }

    NdArray inputArray(int index) {
        return inputArrays == null ? null : inputArrays[index];
    }

    NdArray outputArray(int index) {
        return outputArrays == null ? null : outputArrays[index];
    }

    private static boolean contains(int[] indexes, int index) {
        for (int i : indexes) {
            if (i == index) {
                return true;
            }
        }
        return false;
    }

    private static void checkIndex(String kind, int index, int count) {
        if (index < 0 || index >= count) {
            throw new IndexOutOfBoundsException(
                    "Cannot retain " + kind + " " + index + ": operation has " + count + " " + kind + "s");
        }
    }

    @Override
    public String toString() {
        return "RetentionManager[inputs=" + Arrays.toString(inputIndexes)
                + ", outputs=" + Arrays.toString(outputIndexes) + "]";
    }
}
