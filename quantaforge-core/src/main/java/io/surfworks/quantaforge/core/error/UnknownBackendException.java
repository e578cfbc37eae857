package io.surfworks.quantaforge.core.error;

import java.util.List;

/**
 * Thrown when a backend is requested by a name that is not registered.
 */
public class UnknownBackendException extends SimulationException {

    private final String name;
    private final List<String> available;

    public UnknownBackendException(String name, List<String> available) {
        super("Unknown backend: " + name + ". Available: " + available);
        this.name = name;
        this.available = List.copyOf(available);
    }

    public String name() {
        return name;
    }

    public List<String> available() {
        return available;
    }
}
