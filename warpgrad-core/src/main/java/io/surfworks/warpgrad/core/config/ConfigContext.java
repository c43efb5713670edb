package io.surfworks.warpgrad.core.config;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Thread-local scope installing an {@link AutogradConfig}.
 *
 * <p>Different threads see independent configurations, so separate model
 * instances can run concurrently without sharing mode flags.
 *
 * <pre>{@code
 * try (var ctx = ConfigContext.noBackprop()) {
 *     Variable y = Ops.tanh(x);       // no graph is recorded
 * }
 * // previous configuration restored
 * }</pre>
 *
 * <p>Nesting is supported; each context restores the configuration that was
 * active when it was opened. Always use try-with-resources.
 */
public final class ConfigContext implements AutoCloseable {

    private static final ThreadLocal<AutogradConfig> CURRENT =
            ThreadLocal.withInitial(AutogradConfig::defaults);

    private final AutogradConfig previous;
    private boolean closed;

    /**
     * Installs {@code config} for the current thread.
     *
     * @throws NullPointerException if config is null
     */
    public ConfigContext(AutogradConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.previous = CURRENT.get();
        this.closed = false;
        CURRENT.set(config);
    }

    /**
     * Returns the configuration active on this thread.
     */
    public static AutogradConfig current() {
        return CURRENT.get();
    }

    public static ConfigContext using(AutogradConfig config) {
        return new ConfigContext(config);
    }

    /**
     * Installs a modified copy of the current configuration.
     */
    public static ConfigContext using(UnaryOperator<AutogradConfig> change) {
        Objects.requireNonNull(change, "change cannot be null");
        return new ConfigContext(change.apply(CURRENT.get()));
    }

    public static ConfigContext noBackprop() {
        return using(c -> c.withEnableBackprop(false));
    }

    public static ConfigContext forceBackprop() {
        return using(c -> c.withEnableBackprop(true));
    }

    public static ConfigContext evaluation() {
        return using(c -> c.withTrain(false));
    }

    public static ConfigContext training() {
        return using(c -> c.withTrain(true));
    }

    public static ConfigContext debug() {
        return using(c -> c.withDebug(true));
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Restores the previous configuration. Idempotent.
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            CURRENT.set(previous);
        }
    }

    @Override
    public String toString() {
        if (closed) {
            return "ConfigContext[CLOSED, previous=" + previous + "]";
        }
        return String.format("ConfigContext[current=%s, previous=%s]", CURRENT.get(), previous);
    }
}
