package io.surfworks.warpgrad.core.error;

/**
 * Thrown when NaN or Inf values are detected while the active policy is
 * {@link NaNPolicy#ERROR}, or while debug mode is on.
 *
 * <p>The message names the operation and the pass that produced the invalid
 * value, e.g. {@code "NaN detected in Log (backward) at position 3"}.
 */
public class NumericalException extends RuntimeException {

    private final String operation;
    private final InvalidValueType valueType;
    private final long position;

    /**
     * Type of invalid numerical value detected.
     */
    public enum InvalidValueType {
        /** Not a Number */
        NAN,
        /** Positive infinity */
        POSITIVE_INF,
        /** Negative infinity */
        NEGATIVE_INF;

        String describe() {
            return switch (this) {
                case NAN -> "NaN";
                case POSITIVE_INF -> "+Inf";
                case NEGATIVE_INF -> "-Inf";
            };
        }
    }

    public NumericalException(String operation, InvalidValueType valueType, long position) {
        super(formatMessage(operation, valueType, position));
        this.operation = operation;
        this.valueType = valueType;
        this.position = position;
    }

    static String formatMessage(String operation, InvalidValueType valueType, long position) {
        if (position >= 0) {
            return String.format("%s detected in %s at position %d", valueType.describe(), operation, position);
        }
        return String.format("%s detected in %s", valueType.describe(), operation);
    }

    public String operation() {
        return operation;
    }

    public InvalidValueType valueType() {
        return valueType;
    }

    /**
     * Flat index of the first invalid element, or -1 if unknown.
     */
    public long position() {
        return position;
    }
}
