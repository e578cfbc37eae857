package io.surfworks.quantaforge.core.noise;

import io.surfworks.quantaforge.core.error.DimensionMismatchException;
import io.surfworks.quantaforge.core.error.QubitIndexException;
import io.surfworks.quantaforge.core.gate.GateKernel;
import io.surfworks.quantaforge.core.state.QuantumState;
import io.surfworks.quantaforge.core.tensor.ComplexMatrix;
import io.surfworks.quantaforge.core.tensor.ComplexTensor;

import java.util.List;

/**
 * Kraus-operator arithmetic: channel application, embedding and completeness.
 *
 * <p>{@link #apply(ComplexMatrix, List)} works on full-space operators and costs
 * {@code O(8^n)} per term. {@link #applyLocal} evaluates the same sum by
 * contracting each local operator against the target axes of the state tensor.
 */
public final class KrausOperators {

    /** Tolerance on {@code Σ K_i† K_i = I}. */
    public static final double COMPLETENESS_TOLERANCE = 1e-8;

    private KrausOperators() {}

    /**
     * {@code ε(ρ) = Σ K_i ρ K_i†} with full-space operators.
     */
    public static ComplexMatrix apply(ComplexMatrix rho, List<ComplexMatrix> kraus) {
        ComplexMatrix result = ComplexMatrix.zeros(rho.dimension());
        for (ComplexMatrix k : kraus) {
            if (k.dimension() != rho.dimension()) {
                throw new DimensionMismatchException("Kraus operator dimension", rho.dimension(), k.dimension());
            }
            result = result.add(k.multiply(rho).multiply(k.dagger()));
        }
        return result;
    }

    /**
     * Embed a local operator acting on {@code qubit} (and the following qubits,
     * for operators wider than 2x2) into an n-qubit space:
     * {@code I ⊗ … ⊗ K ⊗ … ⊗ I}.
     */
    public static ComplexMatrix embed(ComplexMatrix operator, int qubit, int numQubits) {
        int width = Integer.numberOfTrailingZeros(operator.dimension());
        if (Integer.bitCount(operator.dimension()) != 1 || width == 0) {
            throw new IllegalArgumentException(
                "Operator dimension " + operator.dimension() + " is not a power of two >= 2");
        }
        QubitIndexException.check(qubit, numQubits);
        QubitIndexException.check(qubit + width - 1, numQubits);
        ComplexMatrix before = ComplexMatrix.identity(1 << qubit);
        ComplexMatrix after = ComplexMatrix.identity(1 << (numQubits - qubit - width));
        return before.kron(operator).kron(after);
    }

    /**
     * Largest absolute entry of {@code Σ K_i† K_i - I}.
     */
    public static double completenessDeviation(List<ComplexMatrix> kraus) {
        if (kraus.isEmpty()) {
            throw new IllegalArgumentException("Kraus set is empty");
        }
        int dim = kraus.get(0).dimension();
        ComplexMatrix sum = ComplexMatrix.zeros(dim);
        for (ComplexMatrix k : kraus) {
            if (k.dimension() != dim) {
                throw new DimensionMismatchException("Kraus operator dimension", dim, k.dimension());
            }
            sum = sum.add(k.dagger().multiply(k));
        }
        return sum.maxAbsDifference(ComplexMatrix.identity(dim));
    }

    public static boolean verifyCompleteness(List<ComplexMatrix> kraus, double tolerance) {
        return completenessDeviation(kraus) <= tolerance;
    }

    public static boolean verifyCompleteness(List<ComplexMatrix> kraus) {
        return verifyCompleteness(kraus, COMPLETENESS_TOLERANCE);
    }

    /**
     * Replace the density matrix of {@code state} with {@code Σ K_i ρ K_i†}, where
     * each local {@code K_i} acts on {@code qubits}.
     *
     * @throws IllegalStateException if {@code state} is a statevector
     */
    public static void applyLocal(QuantumState state, List<ComplexMatrix> kraus, int... qubits) {
        if (!state.isDensityMatrix()) {
            throw new IllegalStateException("Noise channels require a density matrix state");
        }
        int n = state.numQubits();
        for (int q : qubits) {
            QubitIndexException.check(q, n);
        }
        int[] columns = GateKernel.columnAxes(qubits, n);
        ComplexTensor rho = state.tensor();
        ComplexTensor result = ComplexTensor.zeros(rho.rank());
        for (ComplexMatrix k : kraus) {
            ComplexTensor term = rho.copy();
            term.applyOnAxes(k, qubits, false);
            term.applyOnAxes(k, columns, true);
            result.addInPlace(term);
        }
        state.replaceTensor(result);
    }
}
