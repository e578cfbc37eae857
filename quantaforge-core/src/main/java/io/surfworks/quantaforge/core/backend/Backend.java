package io.surfworks.quantaforge.core.backend;

import io.surfworks.quantaforge.core.circuit.Circuit;

/**
 * Backend interface for executing quantum circuits.
 * Implementations differ in how they represent the state (pure or mixed) and
 * which circuits they accept.
 */
public interface Backend {

    /**
     * Returns the name of this backend (e.g., "statevector", "density_matrix").
     */
    String name();

    /**
     * Returns the capabilities of this backend.
     */
    BackendCapabilities capabilities();

    /**
     * Pre-flight a circuit. Never throws.
     *
     * @param circuit The circuit to check
     * @return whether the circuit is executable, with an optional warning or reason
     */
    CapabilityCheck canExecute(Circuit circuit);

    /**
     * Execute a circuit.
     *
     * @param circuit The circuit to execute
     * @param options Initial state, shots, history recording and randomness
     * @return The final state, measurement outcomes and metadata
     */
    ExecutionResult execute(Circuit circuit, ExecutionOptions options);

    /**
     * Execute a circuit from |0…0⟩ with one shot and no history.
     */
    default ExecutionResult execute(Circuit circuit) {
        return execute(circuit, ExecutionOptions.defaults());
    }
}
