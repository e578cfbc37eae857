package io.surfworks.quantaforge.core.backend;

import io.surfworks.quantaforge.core.error.UnknownBackendException;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registry of backend implementations by name.
 * Names are case-insensitive; each lookup creates a new backend instance.
 */
public final class BackendRegistry {

    private final Map<String, Registration> factories = new ConcurrentHashMap<>();

    private record Registration(Supplier<Backend> factory, BackendInfo info) {
    }

    /**
     * Register a backend factory.
     *
     * @param info    Backend name and description
     * @param factory Factory function that creates backend instances
     * @return this registry
     */
    public BackendRegistry register(BackendInfo info, Supplier<Backend> factory) {
        factories.put(key(info.name()), new Registration(factory, info));
        return this;
    }

    /**
     * Unregister a backend.
     *
     * @param name Backend name to remove
     */
    public void unregister(String name) {
        factories.remove(key(name));
    }

    /**
     * Check if a backend is registered.
     */
    public boolean isRegistered(String name) {
        return factories.containsKey(key(name));
    }

    /**
     * Get a new instance of a registered backend.
     *
     * @param name Backend name
     * @return A new backend instance
     * @throws UnknownBackendException if the backend is not registered
     */
    public Backend get(String name) {
        return registration(name).factory().get();
    }

    /**
     * Static description of a registered backend.
     *
     * @throws UnknownBackendException if the backend is not registered
     */
    public BackendInfo info(String name) {
        return registration(name).info();
    }

    /**
     * Registered backend names, sorted.
     */
    public List<String> available() {
        return List.copyOf(new TreeMap<>(factories).keySet());
    }

    private Registration registration(String name) {
        Registration registration = name == null ? null : factories.get(key(name));
        if (registration == null) {
            throw new UnknownBackendException(name, available());
        }
        return registration;
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
