package io.surfworks.warpgrad.core.error;

/**
 * Policy for handling NaN and Inf values found in forward outputs or gradients.
 *
 * <ul>
 *   <li>{@link #ERROR} - Throw a {@link NumericalException} immediately</li>
 *   <li>{@link #WARN} - Log a warning and continue execution</li>
 *   <li>{@link #IGNORE} - No checking (best performance)</li>
 * </ul>
 *
 * <p>The policy is part of the immutable autograd configuration:
 * <pre>{@code
 * try (var ctx = ConfigContext.using(c -> c.withNanPolicy(NaNPolicy.ERROR))) {
 *     loss.backward();   // throws if any gradient contains NaN/Inf
 * }
 * }</pre>
 */
public enum NaNPolicy {

    /**
     * Throw a {@link NumericalException} when NaN or Inf is detected.
     */
    ERROR,

    /**
     * Log a warning when NaN or Inf is detected, but continue execution.
     */
    WARN,

    /**
     * Perform no NaN/Inf checking (default).
     */
    IGNORE
}
