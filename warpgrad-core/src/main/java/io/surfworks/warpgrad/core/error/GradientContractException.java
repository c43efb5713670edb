package io.surfworks.warpgrad.core.error;

/**
 * A backward-gradient function returned the wrong number of gradients, or a
 * gradient whose shape or dtype does not match its input.
 */
public class GradientContractException extends RuntimeException {

    private final String operation;
    private final int inputIndex;

    public GradientContractException(String operation, int inputIndex, String message) {
        super(message + " (operation: " + operation
                + (inputIndex >= 0 ? ", input index: " + inputIndex : "") + ")");
        this.operation = operation;
        this.inputIndex = inputIndex;
    }

    public String operation() {
        return operation;
    }

    /**
     * Index of the offending input, or -1 when the whole gradient list is wrong.
     */
    public int inputIndex() {
        return inputIndex;
    }
}
