package io.surfworks.quantaforge.core.backend;

/**
 * How a backend holds the quantum state.
 */
public enum StateRepresentation {
    /** Complex amplitude vector of length {@code 2^n}. */
    STATEVECTOR,
    /** Complex {@code 2^n x 2^n} density matrix. */
    DENSITY_MATRIX;

    /**
     * Number of tensor axes needed for {@code numQubits} qubits.
     */
    public int rankFor(int numQubits) {
        return this == STATEVECTOR ? numQubits : 2 * numQubits;
    }
}
