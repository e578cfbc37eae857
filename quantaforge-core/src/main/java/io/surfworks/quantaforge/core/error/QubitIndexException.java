package io.surfworks.quantaforge.core.error;

/**
 * Thrown when a gate, measurement or channel references a qubit outside
 * {@code [0, numQubits)}.
 */
public class QubitIndexException extends SimulationException {

    private final int qubit;
    private final int numQubits;

    public QubitIndexException(int qubit, int numQubits) {
        super(String.format("Qubit index %d out of range [0, %d)", qubit, numQubits));
        this.qubit = qubit;
        this.numQubits = numQubits;
    }

    /**
     * Returns the offending qubit index.
     */
    public int qubit() {
        return qubit;
    }

    /**
     * Returns the number of qubits of the register the index was checked against.
     */
    public int numQubits() {
        return numQubits;
    }

    /**
     * Checks that {@code qubit} addresses a register of {@code numQubits} qubits.
     *
     * @throws QubitIndexException if the index is out of range
     */
    public static void check(int qubit, int numQubits) {
        if (qubit < 0 || qubit >= numQubits) {
            throw new QubitIndexException(qubit, numQubits);
        }
    }
}
