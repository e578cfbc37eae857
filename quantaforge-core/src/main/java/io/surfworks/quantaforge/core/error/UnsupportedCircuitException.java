package io.surfworks.quantaforge.core.error;

/**
 * Thrown when a backend is asked to execute a circuit its capability check
 * refuses, such as one with more qubits than it can allocate.
 */
public class UnsupportedCircuitException extends SimulationException {

    private final String backend;
    private final String reason;

    public UnsupportedCircuitException(String backend, String reason) {
        super(backend + " cannot execute circuit: " + reason);
        this.backend = backend;
        this.reason = reason;
    }

    public String backend() {
        return backend;
    }

    public String reason() {
        return reason;
    }
}
