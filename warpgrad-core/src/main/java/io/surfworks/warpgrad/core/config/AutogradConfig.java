package io.surfworks.warpgrad.core.config;

import io.surfworks.warpgrad.core.error.NaNPolicy;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable mode flags consulted by the graph builder, the backward
 * propagator and the schedule manager.
 *
 * <p>A configuration is never mutated in place. Install a modified copy for a
 * scope with {@link ConfigContext}:
 * <pre>{@code
 * try (var ctx = ConfigContext.using(AutogradConfig.defaults().withTrain(false))) {
 *     Variable y = model.forward(x);
 * }
 * }</pre>
 *
 * @param enableBackprop whether applied operations record graph nodes
 * @param train          training (true) or evaluation (false) mode
 * @param typeCheck      whether operations validate their input contract
 * @param debug          validation mode: gradient shape/dtype checks and NaN detection
 * @param nanPolicy      NaN/Inf handling outside debug mode
 */
public record AutogradConfig(
        boolean enableBackprop,
        boolean train,
        boolean typeCheck,
        boolean debug,
        NaNPolicy nanPolicy
) {

    public AutogradConfig {
        Objects.requireNonNull(nanPolicy, "nanPolicy cannot be null");
    }

    /**
     * Backprop on, training mode, type checks on, debug off, no NaN checks.
     */
    public static AutogradConfig defaults() {
        return new AutogradConfig(true, true, true, false, NaNPolicy.IGNORE);
    }

    /**
     * Default location: {@code ~/.config/warpgrad/autograd.json}.
     */
    public static Path configFile() {
        return Path.of(System.getProperty("user.home"), ".config", "warpgrad", "autograd.json");
    }

    public AutogradConfig withEnableBackprop(boolean value) {
        return new AutogradConfig(value, train, typeCheck, debug, nanPolicy);
    }

    public AutogradConfig withTrain(boolean value) {
        return new AutogradConfig(enableBackprop, value, typeCheck, debug, nanPolicy);
    }

    public AutogradConfig withTypeCheck(boolean value) {
        return new AutogradConfig(enableBackprop, train, value, debug, nanPolicy);
    }

    public AutogradConfig withDebug(boolean value) {
        return new AutogradConfig(enableBackprop, train, typeCheck, value, nanPolicy);
    }

    public AutogradConfig withNanPolicy(NaNPolicy value) {
        return new AutogradConfig(enableBackprop, train, typeCheck, debug, value);
    }

    /**
     * Debug mode always fails on NaN unless a policy other than IGNORE was chosen.
     */
    public NaNPolicy effectiveNanPolicy() {
        if (debug && nanPolicy == NaNPolicy.IGNORE) {
            return NaNPolicy.ERROR;
        }
        return nanPolicy;
    }
}
