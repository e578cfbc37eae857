package io.surfworks.quantaforge.core.gate;

import io.surfworks.quantaforge.core.error.GateArityException;
import io.surfworks.quantaforge.core.error.QubitIndexException;
import io.surfworks.quantaforge.core.state.QuantumState;
import io.surfworks.quantaforge.core.tensor.ComplexMatrix;
import io.surfworks.quantaforge.core.tensor.ComplexTensor;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies gate unitaries to quantum states.
 *
 * <p>There is one contraction routine for every arity. A statevector is
 * contracted on the target axes. A density matrix gets {@code U} on the row
 * axes {@code targets} and then {@code conj(U)} on the column axes
 * {@code targets + n}, which together evaluate {@code U ρ U†}.
 */
public final class GateKernel {

    private static final Logger LOGGER = Logger.getLogger(GateKernel.class.getName());

    private GateKernel() {}

    /**
     * Contract {@code matrix} against {@code axes} of {@code tensor}, in place.
     */
    public static void apply(ComplexTensor tensor, ComplexMatrix matrix, int[] axes) {
        tensor.applyOnAxes(matrix, axes, false);
    }

    /**
     * Apply a gate to the given qubits of a state, in place.
     *
     * @throws GateArityException  if the qubit count differs from the gate's arity
     * @throws QubitIndexException if a qubit is out of range
     */
    public static void apply(QuantumState state, Gate gate, int... qubits) {
        if (qubits.length != gate.arity()) {
            throw new GateArityException(gate.name(), gate.arity(), qubits.length);
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Applying " + gate + " to qubits " + Arrays.toString(qubits));
        }
        applyUnitary(state, gate.matrix(), qubits);
    }

    /**
     * Apply a {@code 2^k x 2^k} unitary to {@code k} qubits of a state, in place.
     */
    public static void applyUnitary(QuantumState state, ComplexMatrix unitary, int... qubits) {
        int n = state.numQubits();
        for (int q : qubits) {
            QubitIndexException.check(q, n);
        }
        ComplexTensor tensor = state.tensor();
        tensor.applyOnAxes(unitary, qubits, false);
        if (state.isDensityMatrix()) {
            tensor.applyOnAxes(unitary, columnAxes(qubits, n), true);
        }
    }

    /**
     * Column axes of a density-matrix tensor matching the given qubits.
     */
    public static int[] columnAxes(int[] qubits, int numQubits) {
        int[] axes = new int[qubits.length];
        for (int i = 0; i < qubits.length; i++) {
            axes[i] = qubits[i] + numQubits;
        }
        return axes;
    }
}
