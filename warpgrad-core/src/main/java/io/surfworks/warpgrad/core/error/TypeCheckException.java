package io.surfworks.warpgrad.core.error;

/**
 * An operation's declared input contract was violated at apply time, before
 * any computation ran.
 *
 * <p>The message names the operation and the exact failed expectation:
 * <pre>
 * Invalid operation is performed in: MatMul (Forward)
 *
 * Expect: input[0].ndim == 2
 * Actual: 1 != 2
 * </pre>
 */
public class TypeCheckException extends RuntimeException {

    private final String operation;
    private final String expectation;
    private final String actual;

    public TypeCheckException(String operation, String expectation, String actual) {
        super("Invalid operation is performed in: " + operation + " (Forward)\n\n"
                + "Expect: " + expectation + "\n"
                + "Actual: " + actual);
        this.operation = operation;
        this.expectation = expectation;
        this.actual = actual;
    }

    public String operation() {
        return operation;
    }

    /**
     * The violated constraint, e.g. {@code "input[0].ndim >= 2"}.
     */
    public String expectation() {
        return expectation;
    }

    public String actual() {
        return actual;
    }
}
