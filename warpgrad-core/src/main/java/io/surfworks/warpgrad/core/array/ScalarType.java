package io.surfworks.warpgrad.core.array;

/**
 * Scalar element types for arrays.
 *
 * <p>Only floating types take part in differentiation. Integer and boolean
 * arrays may flow through a graph but never receive gradients.
 */
public enum ScalarType {
    F32(4, false, true),
    F64(8, false, true),
    I32(4, true, false),
    I64(8, true, false),
    BOOL(1, false, false);

    private final int byteSize;
    private final boolean isInteger;
    private final boolean isFloating;

    ScalarType(int byteSize, boolean isInteger, boolean isFloating) {
        this.byteSize = byteSize;
        this.isInteger = isInteger;
        this.isFloating = isFloating;
    }

    public int byteSize() {
        return byteSize;
    }

    public boolean isInteger() {
        return isInteger;
    }

    public boolean isFloating() {
        return isFloating;
    }

    /**
     * Rounds a double to the precision representable by this type.
     */
    public double round(double value) {
        return switch (this) {
            case F32 -> (double) (float) value;
            case F64 -> value;
            case I32 -> (double) (int) value;
            case I64 -> (double) (long) value;
            case BOOL -> value != 0.0 ? 1.0 : 0.0;
        };
    }
}
