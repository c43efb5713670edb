package io.surfworks.warpgrad.core.array;

import io.surfworks.warpgrad.core.array.cpu.CpuBackend;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registry for array backends.
 * The reference CPU backend is always registered under "cpu".
 */
public final class BackendRegistry {

    private static final Map<String, Supplier<ArrayBackend>> FACTORIES = new ConcurrentHashMap<>();
    private static volatile String defaultBackendName = CpuBackend.NAME;

    static {
        registerBuiltins();
    }

    private BackendRegistry() {} // Utility class

    /**
     * Register a backend factory.
     *
     * @param name    Backend name (e.g., "cpu")
     * @param factory Factory returning the backend instance
     */
    public static void register(String name, Supplier<ArrayBackend> factory) {
        FACTORIES.put(name.toLowerCase(), factory);
    }

    public static void unregister(String name) {
        FACTORIES.remove(name.toLowerCase());
    }

    public static boolean isRegistered(String name) {
        return FACTORIES.containsKey(name.toLowerCase());
    }

    /**
     * Get a registered backend.
     *
     * @throws IllegalArgumentException if the backend is not registered
     */
    public static ArrayBackend get(String name) {
        Supplier<ArrayBackend> factory = FACTORIES.get(name.toLowerCase());
        if (factory == null) {
            throw new IllegalArgumentException(
                "Backend '" + name + "' not registered. Available: " + available());
        }
        return factory.get();
    }

    /**
     * Get the default backend, used by the convenience factories on
     * {@code Variable}.
     */
    public static ArrayBackend getDefault() {
        if (FACTORIES.isEmpty()) {
            throw new IllegalStateException("No backends registered");
        }
        if (FACTORIES.containsKey(defaultBackendName)) {
            return get(defaultBackendName);
        }
        return FACTORIES.values().iterator().next().get();
    }

    public static void setDefault(String name) {
        if (!isRegistered(name)) {
            throw new IllegalArgumentException("Backend '" + name + "' not registered");
        }
        defaultBackendName = name.toLowerCase();
    }

    public static String getDefaultName() {
        return defaultBackendName;
    }

    public static List<String> available() {
        return List.copyOf(FACTORIES.keySet());
    }

    /**
     * Drops every registration except the built-in ones (mainly for testing).
     */
    public static void reset() {
        FACTORIES.clear();
        defaultBackendName = CpuBackend.NAME;
        registerBuiltins();
    }

    private static void registerBuiltins() {
        register(CpuBackend.NAME, CpuBackend::instance);
    }
}
