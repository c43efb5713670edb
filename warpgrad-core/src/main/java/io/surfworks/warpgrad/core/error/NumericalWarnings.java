package io.surfworks.warpgrad.core.error;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivery point for {@link NumericalWarning}s.
 *
 * <p>Every warning is logged at {@code WARNING} and handed to registered
 * listeners. Warnings are raised, never thrown.
 *
 * <pre>{@code
 * List<NumericalWarning> seen = new ArrayList<>();
 * try (var registration = NumericalWarnings.addListener(seen::add)) {
 *     y.backward();
 * }
 * }</pre>
 */
public final class NumericalWarnings {

    private static final Logger LOGGER = Logger.getLogger(NumericalWarnings.class.getName());

    private static final List<Consumer<NumericalWarning>> LISTENERS = new CopyOnWriteArrayList<>();

    private NumericalWarnings() {
    }

    public static void raise(NumericalWarning warning) {
        Objects.requireNonNull(warning, "warning cannot be null");
        LOGGER.log(Level.WARNING, "Numerical warning: {0}", warning);
        for (Consumer<NumericalWarning> listener : LISTENERS) {
            listener.accept(warning);
        }
    }

    /**
     * Registers a listener until the returned registration is closed.
     */
    public static Registration addListener(Consumer<NumericalWarning> listener) {
        Objects.requireNonNull(listener, "listener cannot be null");
        LISTENERS.add(listener);
        return new Registration(listener);
    }

    /**
     * Handle removing a listener on close. Closing twice is a no-op.
     */
    public static final class Registration implements AutoCloseable {
        private final Consumer<NumericalWarning> listener;
        private boolean closed;

        private Registration(Consumer<NumericalWarning> listener) {
            this.listener = listener;
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                LISTENERS.remove(listener);
            }
        }
    }
}
