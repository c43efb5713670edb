package io.surfworks.warpgrad.core.error;

/**
 * Non-fatal notice that a gradient is mathematically undefined at some input.
 * Computation continues with the operation's documented convention.
 *
 * @param operation  label of the operation that raised it
 * @param message    what was undefined and which convention was applied
 * @param position   flat index of the first affected element, or -1
 */
public record NumericalWarning(String operation, String message, long position) {

    @Override
    public String toString() {
        return operation + ": " + message + (position >= 0 ? " (first at position " + position + ")" : "");
    }
}
