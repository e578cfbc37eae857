package io.surfworks.quantaforge.core.metrics;

import io.surfworks.quantaforge.core.error.DimensionMismatchException;
import io.surfworks.quantaforge.core.error.MixedStateExtractionException;
import io.surfworks.quantaforge.core.error.QubitIndexException;
import io.surfworks.quantaforge.core.gate.Gates;
import io.surfworks.quantaforge.core.state.QuantumState;
import io.surfworks.quantaforge.core.tensor.ComplexMatrix;
import io.surfworks.quantaforge.core.tensor.ComplexTensor;
import io.surfworks.quantaforge.core.tensor.HermitianDecomposition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fidelity, purity, entropy and entanglement measures of quantum states.
 *
 * <p>Entropies are in bits. Eigenvalues at or below {@link #EIGENVALUE_CUTOFF}
 * are treated as zero.
 */
public final class StateMetrics {

    public static final double EIGENVALUE_CUTOFF = 1e-10;

    private static final double LOG2 = Math.log(2.0);

    private StateMetrics() {}

    // ==================== Fidelity ====================

    /**
     * Fidelity between two states of the same size.
     *
     * <p>{@code |⟨ψ|φ⟩|²} for two pure states, {@code ⟨ψ|ρ|ψ⟩} when one is pure,
     * and Uhlmann's {@code (Tr √(√ρ σ √ρ))²} otherwise, clamped to [0, 1].
     */
    public static double fidelity(QuantumState a, QuantumState b) {
        if (a.numQubits() != b.numQubits()) {
            throw new DimensionMismatchException("Qubit count", a.numQubits(), b.numQubits());
        }
        if (!a.isDensityMatrix() && !b.isDensityMatrix()) {
            ComplexTensor x = a.tensor();
            ComplexTensor y = b.tensor();
            double re = 0;
            double im = 0;
            for (int i = 0; i < x.size(); i++) {
                // conj(x_i) * y_i
                re += x.real(i) * y.real(i) + x.imag(i) * y.imag(i);
                im += x.real(i) * y.imag(i) - x.imag(i) * y.real(i);
            }
            return clamp(re * re + im * im);
        }
        if (!a.isDensityMatrix()) {
            return clamp(sandwich(a, b.densityMatrix()));
        }
        if (!b.isDensityMatrix()) {
            return clamp(sandwich(b, a.densityMatrix()));
        }
        return densityMatrixFidelity(a.densityMatrix(), b.densityMatrix());
    }

    /**
     * Uhlmann fidelity of two density matrices.
     */
    public static double densityMatrixFidelity(ComplexMatrix rho, ComplexMatrix sigma) {
        ComplexMatrix sqrtRho = HermitianDecomposition.of(rho).sqrt();
        ComplexMatrix inner = sqrtRho.multiply(sigma).multiply(sqrtRho);
        double trace = 0;
        for (double lambda : HermitianDecomposition.of(inner).eigenvalues()) {
            trace += Math.sqrt(Math.max(lambda, 0.0));
        }
        return clamp(trace * trace);
    }

    // ⟨ψ|ρ|ψ⟩
    private static double sandwich(QuantumState pure, ComplexMatrix rho) {
        return pure.expectationValue(rho);
    }

    // ==================== Purity & entropy ====================

    /**
     * {@code Tr(ρ²)}.
     */
    public static double purity(QuantumState state) {
        return state.purity();
    }

    /**
     * Purity of the reduced state of {@code qubits}.
     */
    public static double purity(QuantumState state, int... qubits) {
        ComplexMatrix rho = reducedDensityMatrix(state, qubits);
        return rho.multiply(rho).trace().getReal();
    }

    /**
     * {@code -Tr(ρ log₂ ρ)} of the whole state.
     */
    public static double vonNeumannEntropy(QuantumState state) {
        if (!state.isDensityMatrix()) {
            return 0.0;
        }
        return vonNeumannEntropy(state.densityMatrix());
    }

    /**
     * Entropy of the reduced state of {@code qubits}.
     */
    public static double vonNeumannEntropy(QuantumState state, int... qubits) {
        return vonNeumannEntropy(reducedDensityMatrix(state, qubits));
    }

    public static double vonNeumannEntropy(ComplexMatrix rho) {
        double entropy = 0;
        for (double lambda : HermitianDecomposition.of(rho).eigenvalues()) {
            if (lambda > EIGENVALUE_CUTOFF) {
                entropy -= lambda * Math.log(lambda) / LOG2;
            }
        }
        return Math.max(entropy, 0.0);
    }

    /**
     * Entropy of {@code qubits} at each step of a state history.
     */
    public static List<Double> entropyEvolution(List<QuantumState> history, int... qubits) {
        List<Double> entropies = new ArrayList<>(history.size());
        for (QuantumState state : history) {
            entropies.add(vonNeumannEntropy(state, qubits));
        }
        return entropies;
    }

    // ==================== Reduced states ====================

    /**
     * Trace out every qubit not in {@code keep}. The first kept qubit is the most
     * significant bit of the reduced basis index.
     */
    public static ComplexMatrix reducedDensityMatrix(QuantumState state, int... keep) {
        int n = state.numQubits();
        int k = keep.length;
        if (k == 0) {
            throw new IllegalArgumentException("At least one qubit must be kept");
        }
        boolean[] kept = new boolean[n];
        for (int q : keep) {
            QubitIndexException.check(q, n);
            if (kept[q]) {
                throw new IllegalArgumentException("Qubit " + q + " listed twice in " + Arrays.toString(keep));
            }
            kept[q] = true;
        }
        int[] env = new int[n - k];
        for (int q = 0, e = 0; q < n; q++) {
            if (!kept[q]) {
                env[e++] = q;
            }
        }
        int keptDim = 1 << k;
        int envDim = 1 << (n - k);
        int[] keptOffset = offsets(keep, n);
        int[] envOffset = offsets(env, n);

        ComplexTensor t = state.tensor();
        int dim = state.dimension();
        double[] out = new double[2 * keptDim * keptDim];
        for (int a = 0; a < keptDim; a++) {
            for (int b = 0; b < keptDim; b++) {
                double re = 0;
                double im = 0;
                for (int e = 0; e < envDim; e++) {
                    int row = keptOffset[a] | envOffset[e];
                    int col = keptOffset[b] | envOffset[e];
                    if (state.isDensityMatrix()) {
                        int idx = row * dim + col;
                        re += t.real(idx);
                        im += t.imag(idx);
                    } else {
                        // ψ_row * conj(ψ_col)
                        re += t.real(row) * t.real(col) + t.imag(row) * t.imag(col);
                        im += t.imag(row) * t.real(col) - t.real(row) * t.imag(col);
                    }
                }
                out[2 * (a * keptDim + b)] = re;
                out[2 * (a * keptDim + b) + 1] = im;
            }
        }
        return ComplexMatrix.fromInterleaved(keptDim, out);
    }

    // Full basis index contributed by each assignment of the listed qubits.
    private static int[] offsets(int[] qubits, int numQubits) {
        int m = qubits.length;
        int[] out = new int[1 << m];
        for (int g = 0; g < out.length; g++) {
            int idx = 0;
            for (int j = 0; j < m; j++) {
                if (((g >> (m - 1 - j)) & 1) != 0) {
                    idx |= 1 << (numQubits - 1 - qubits[j]);
                }
            }
            out[g] = idx;
        }
        return out;
    }

    // ==================== Entanglement ====================

    /**
     * {@code I(A:B) = S(A) + S(B) - S(AB)} for disjoint qubit sets.
     */
    public static double mutualInformation(QuantumState state, int[] qubitsA, int[] qubitsB) {
        int[] ab = new int[qubitsA.length + qubitsB.length];
        System.arraycopy(qubitsA, 0, ab, 0, qubitsA.length);
        System.arraycopy(qubitsB, 0, ab, qubitsA.length, qubitsB.length);
        for (int a : qubitsA) {
            for (int b : qubitsB) {
                if (a == b) {
                    throw new IllegalArgumentException("Subsystems A and B must be disjoint, both contain " + a);
                }
            }
        }
        Arrays.sort(ab);
        return vonNeumannEntropy(state, qubitsA) + vonNeumannEntropy(state, qubitsB)
            - vonNeumannEntropy(state, ab);
    }

    /**
     * Mutual information of every qubit pair; symmetric with a zero diagonal.
     */
    public static double[][] pairwiseMutualInformation(QuantumState state) {
        int n = state.numQubits();
        double[][] out = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double mi = mutualInformation(state, new int[] {i}, new int[] {j});
                out[i][j] = mi;
                out[j][i] = mi;
            }
        }
        return out;
    }

    /**
     * Schmidt coefficients of a pure state across the cut {@code qubitsA | rest},
     * in descending order.
     *
     * @throws MixedStateExtractionException if the state is not pure
     */
    public static double[] schmidtCoefficients(QuantumState state, int... qubitsA) {
        double purity = state.purity();
        if (Math.abs(purity - 1.0) > QuantumState.PURITY_TOLERANCE) {
            throw new MixedStateExtractionException(purity);
        }
        double[] eigen = HermitianDecomposition.of(reducedDensityMatrix(state, qubitsA)).eigenvalues();
        double[] out = new double[eigen.length];
        for (int i = 0; i < eigen.length; i++) {
            out[i] = Math.sqrt(Math.max(eigen[eigen.length - 1 - i], 0.0));
        }
        return out;
    }

    /**
     * Number of Schmidt coefficients above {@link #EIGENVALUE_CUTOFF}.
     */
    public static int schmidtNumber(QuantumState state, int... qubitsA) {
        int count = 0;
        for (double c : schmidtCoefficients(state, qubitsA)) {
            if (c > EIGENVALUE_CUTOFF) {
                count++;
            }
        }
        return count;
    }

    /**
     * Wootters concurrence of the reduced state of two qubits.
     */
    public static double concurrence(QuantumState state, int qubit1, int qubit2) {
        ComplexMatrix rho = reducedDensityMatrix(state, qubit1, qubit2);
        ComplexMatrix yy = Gates.y().matrix().kron(Gates.y().matrix());
        ComplexMatrix rhoTilde = yy.multiply(rho.conjugate()).multiply(yy);
        ComplexMatrix sqrtRho = HermitianDecomposition.of(rho).sqrt();
        double[] eigen = HermitianDecomposition.of(sqrtRho.multiply(rhoTilde).multiply(sqrtRho)).eigenvalues();
        double[] lambda = new double[eigen.length];
        for (int i = 0; i < eigen.length; i++) {
            lambda[i] = Math.sqrt(Math.max(eigen[eigen.length - 1 - i], 0.0));
        }
        return Math.max(0.0, lambda[0] - lambda[1] - lambda[2] - lambda[3]);
    }

    // ==================== Single-qubit views ====================

    /**
     * Bloch vector {@code (⟨X⟩, ⟨Y⟩, ⟨Z⟩)} of one qubit.
     */
    public static double[] blochVector(QuantumState state, int qubit) {
        ComplexMatrix rho = reducedDensityMatrix(state, qubit);
        return new double[] {
            2 * rho.real(0, 1),
            -2 * rho.imag(0, 1),
            rho.real(0, 0) - rho.real(1, 1)
        };
    }

    /**
     * Expectation value of a Pauli string, e.g. {@code pauliExpectation(state, "XZ", 0, 2)}
     * for {@code ⟨X₀ Z₂⟩}. Characters are I, X, Y or Z, one per qubit.
     */
    public static double pauliExpectation(QuantumState state, String paulis, int... qubits) {
        if (paulis.length() != qubits.length) {
            throw new IllegalArgumentException(
                "Pauli string '" + paulis + "' has " + paulis.length() + " factors for " + qubits.length + " qubits");
        }
        int n = state.numQubits();
        ComplexTensor applied = state.tensor().copy();
        for (int i = 0; i < qubits.length; i++) {
            QubitIndexException.check(qubits[i], n);
            ComplexMatrix p = pauli(paulis.charAt(i));
            if (p != null) {
                applied.applyOnAxes(p, new int[] {qubits[i]}, false);
            }
        }
        if (state.isDensityMatrix()) {
            // Tr(P ρ)
            int dim = state.dimension();
            double sum = 0;
            for (int r = 0; r < dim; r++) {
                sum += applied.real(r * dim + r);
            }
            return sum;
        }
        // Re ⟨ψ|P|ψ⟩
        ComplexTensor psi = state.tensor();
        double sum = 0;
        for (int i = 0; i < psi.size(); i++) {
            sum += psi.real(i) * applied.real(i) + psi.imag(i) * applied.imag(i);
        }
        return sum;
    }

    private static ComplexMatrix pauli(char c) {
        return switch (Character.toUpperCase(c)) {
            case 'I' -> null;
            case 'X' -> Gates.x().matrix();
            case 'Y' -> Gates.y().matrix();
            case 'Z' -> Gates.z().matrix();
            default -> throw new IllegalArgumentException("Not a Pauli operator: " + c);
        };
    }

    private static double clamp(double f) {
        return Math.min(1.0, Math.max(0.0, f));
    }
}
