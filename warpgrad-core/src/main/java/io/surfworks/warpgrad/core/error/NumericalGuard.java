package io.surfworks.warpgrad.core.error;

import io.surfworks.warpgrad.core.array.NdArray;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * NaN/Inf scanning of arrays under a {@link NaNPolicy}.
 *
 * <p>The graph builder calls this on forward outputs and the backward
 * propagator on every returned gradient, but only when the active
 * configuration asks for it, so the default hot path performs no scan.
 */
public final class NumericalGuard {

    private static final Logger LOGGER = Logger.getLogger(NumericalGuard.class.getName());

    private NumericalGuard() {
    }

    /**
     * Checks an array according to {@code policy}.
     *
     * @throws NumericalException if an invalid value is found and the policy is ERROR
     */
    public static void check(NdArray array, String operation, NaNPolicy policy) {
        Objects.requireNonNull(policy, "policy cannot be null");
        if (policy == NaNPolicy.IGNORE || array == null) {
            return;
        }
        Objects.requireNonNull(operation, "operation cannot be null");

        CheckResult result = scan(array);
        if (result == null) {
            return;
        }
        if (policy == NaNPolicy.ERROR) {
            throw new NumericalException(operation, result.valueType, result.position);
        }
        LOGGER.log(Level.WARNING, "{0} detected in {1} at position {2}",
                new Object[]{result.valueType.describe(), operation, result.position});
    }

    /**
     * Returns true if the array holds any NaN or Inf value, regardless of policy.
     */
    public static boolean containsNaNOrInf(NdArray array) {
        Objects.requireNonNull(array, "array cannot be null");
        return scan(array) != null;
    }

    private record CheckResult(NumericalException.InvalidValueType valueType, long position) {}

    private static CheckResult scan(NdArray array) {
        if (!array.dtype().isFloating() || array.size() == 0) {
            return null;
        }
        double[] data = array.toDoubleArray();
        for (int i = 0; i < data.length; i++) {
            double v = data[i];
            if (Double.isNaN(v)) {
                return new CheckResult(NumericalException.InvalidValueType.NAN, i);
            }
            if (v == Double.POSITIVE_INFINITY) {
                return new CheckResult(NumericalException.InvalidValueType.POSITIVE_INF, i);
            }
            if (v == Double.NEGATIVE_INFINITY) {
                return new CheckResult(NumericalException.InvalidValueType.NEGATIVE_INF, i);
            }
        }
        return null;
    }
}
