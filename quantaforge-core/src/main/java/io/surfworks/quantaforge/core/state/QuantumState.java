package io.surfworks.quantaforge.core.state;

import io.surfworks.quantaforge.core.error.DimensionMismatchException;
import io.surfworks.quantaforge.core.error.MixedStateExtractionException;
import io.surfworks.quantaforge.core.error.QubitIndexException;
import io.surfworks.quantaforge.core.tensor.ComplexMatrix;
import io.surfworks.quantaforge.core.tensor.ComplexTensor;
import io.surfworks.quantaforge.core.tensor.HermitianDecomposition;
import org.apache.commons.math3.complex.Complex;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.TreeMap;

/**
 * An n-qubit quantum state, held either as a statevector or as a density matrix.
 *
 * <p>The statevector is a rank-{@code n} {@link ComplexTensor}; the density matrix
 * is a rank-{@code 2n} tensor whose first {@code n} axes index rows and last
 * {@code n} axes index columns. Qubit 0 is the most significant bit of the basis
 * index, so basis index {@code i} reads as the n-bit binary string of {@code i},
 * left to right, as qubits {@code 0..n-1}.
 *
 * <p>Instances are mutable and owned by a single execution at a time. Gate and
 * channel application mutate or replace the tensor; {@link #measure} collapses it.
 */
public final class QuantumState {

    /** Tolerance on the purity test used by {@link #toStatevector()}. */
    public static final double PURITY_TOLERANCE = 1e-6;

    /** Eigenvalues above {@code -NEGATIVITY_TOLERANCE} count as non-negative. */
    public static final double NEGATIVITY_TOLERANCE = 1e-10;

    private final int numQubits;
    private final boolean densityMatrix;
    private final Map<Integer, Integer> classicalBits;
    private ComplexTensor tensor;

    private QuantumState(ComplexTensor tensor, int numQubits, boolean densityMatrix,
                         Map<Integer, Integer> classicalBits) {
        this.tensor = tensor;
        this.numQubits = numQubits;
        this.densityMatrix = densityMatrix;
        this.classicalBits = classicalBits;
    }

    // ==================== Factory Methods ====================

    /**
     * The pure state |0…0⟩.
     */
    public static QuantumState zero(int numQubits) {
        requirePositive(numQubits);
        return new QuantumState(ComplexTensor.basis(numQubits, 0), numQubits, false, new TreeMap<>());
    }

    /**
     * The density matrix |0…0⟩⟨0…0|.
     */
    public static QuantumState zeroDensity(int numQubits) {
        requirePositive(numQubits);
        return new QuantumState(ComplexTensor.basis(2 * numQubits, 0), numQubits, true, new TreeMap<>());
    }

    /**
     * A pure state from its {@code 2^n} amplitudes.
     *
     * @throws DimensionMismatchException if the amplitude count is not {@code 2^numQubits}
     */
    public static QuantumState fromAmplitudes(int numQubits, Complex... amplitudes) {
        requirePositive(numQubits);
        long expected = 1L << numQubits;
        if (amplitudes.length != expected) {
            throw new DimensionMismatchException("Statevector length", expected, amplitudes.length);
        }
        return new QuantumState(ComplexTensor.of(numQubits, amplitudes), numQubits, false, new TreeMap<>());
    }

    /**
     * A pure state from real amplitudes.
     */
    public static QuantumState fromRealAmplitudes(int numQubits, double... amplitudes) {
        Complex[] c = new Complex[amplitudes.length];
        for (int i = 0; i < amplitudes.length; i++) {
            c[i] = new Complex(amplitudes[i], 0.0);
        }
        return fromAmplitudes(numQubits, c);
    }

    /**
     * A mixed state from its {@code 2^n x 2^n} density matrix.
     *
     * @throws DimensionMismatchException if the matrix dimension is not {@code 2^numQubits}
     */
    public static QuantumState fromDensityMatrix(int numQubits, ComplexMatrix rho) {
        requirePositive(numQubits);
        long expected = 1L << numQubits;
        if (rho.dimension() != expected) {
            throw new DimensionMismatchException("Density matrix dimension", expected, rho.dimension());
        }
        return new QuantumState(ComplexTensor.fromMatrix(rho), numQubits, true, new TreeMap<>());
    }

    private static void requirePositive(int numQubits) {
        if (numQubits <= 0) {
            throw new IllegalArgumentException("Number of qubits must be positive, got " + numQubits);
        }
    }

    // ==================== Accessors ====================

    public int numQubits() {
        return numQubits;
    }

    public boolean isDensityMatrix() {
        return densityMatrix;
    }

    /**
     * Hilbert-space dimension {@code 2^n}.
     */
    public int dimension() {
        return 1 << numQubits;
    }

    /**
     * The underlying tensor. Engine code mutates it in place.
     */
    public ComplexTensor tensor() {
        return tensor;
    }

    /**
     * Swap in a new tensor of the same rank, as produced by a channel application.
     */
    public void replaceTensor(ComplexTensor replacement) {
        Objects.requireNonNull(replacement, "replacement cannot be null");
        if (replacement.rank() != tensor.rank()) {
            throw new DimensionMismatchException("Tensor rank", tensor.rank(), replacement.rank());
        }
        this.tensor = replacement;
    }

    /**
     * Classical register values written by measurements, keyed by classical bit.
     */
    public Map<Integer, Integer> classicalBits() {
        return Collections.unmodifiableMap(classicalBits);
    }

    public void writeClassicalBit(int bit, int value) {
        classicalBits.put(bit, value);
    }

    /**
     * Amplitude of basis state {@code index}. Only defined for pure states.
     */
    public Complex amplitude(int index) {
        requirePure("amplitude");
        return tensor.get(index);
    }

    /**
     * All amplitudes. Only defined for pure states.
     */
    public Complex[] amplitudes() {
        requirePure("amplitudes");
        return tensor.toArray();
    }

    /**
     * The density matrix of this state (computed as |ψ⟩⟨ψ| for pure states).
     */
    public ComplexMatrix densityMatrix() {
        if (densityMatrix) {
            return tensor.toMatrix();
        }
        double[] psi = tensor.toInterleaved();
        return ComplexMatrix.outer(psi, psi);
    }

    // ==================== Conversion ====================

    /**
     * Convert to a density matrix {@code ρ = |ψ⟩⟨ψ|}. Returns {@code this} if already mixed.
     */
    public QuantumState toDensityMatrix() {
        if (densityMatrix) {
            return this;
        }
        return new QuantumState(ComplexTensor.fromMatrix(densityMatrix()), numQubits, true,
            new TreeMap<>(classicalBits));
    }

    /**
     * Extract the statevector of a pure density matrix. Returns {@code this} if already pure.
     *
     * @throws MixedStateExtractionException if {@code Tr(ρ²)} differs from 1 by more than 1e-6
     */
    public QuantumState toStatevector() {
        if (!densityMatrix) {
            return this;
        }
        double purity = purity();
        if (Math.abs(purity - 1.0) > PURITY_TOLERANCE) {
            throw new MixedStateExtractionException(purity);
        }
        double[] psi = HermitianDecomposition.of(tensor.toMatrix()).leadingEigenvector();
        ComplexTensor vector = ComplexTensor.zeros(numQubits);
        for (int i = 0; i < vector.size(); i++) {
            vector.set(i, psi[2 * i], psi[2 * i + 1]);
        }
        return new QuantumState(vector, numQubits, false, new TreeMap<>(classicalBits));
    }

    public QuantumState copy() {
        return new QuantumState(tensor.copy(), numQubits, densityMatrix, new TreeMap<>(classicalBits));
    }

    // ==================== Observables ====================

    /**
     * Probability of each computational basis state: the diagonal of ρ, or |amplitude|².
     */
    public double[] probabilities() {
        int dim = dimension();
        double[] probs = new double[dim];
        for (int i = 0; i < dim; i++) {
            probs[i] = densityMatrix ? tensor.real(i * dim + i) : tensor.absSquared(i);
        }
        return probs;
    }

    /**
     * {@code Tr(ρ²)}; exactly the squared norm for a pure state.
     */
    public double purity() {
        if (!densityMatrix) {
            double n = tensor.normSquared();
            return n * n;
        }
        // For Hermitian ρ, Tr(ρ²) = Σ |ρ_ij|².
        return tensor.normSquared();
    }

    /**
     * Squared L2 norm (pure) or real trace (mixed).
     */
    public double trace() {
        if (!densityMatrix) {
            return tensor.normSquared();
        }
        int dim = dimension();
        double sum = 0;
        for (int i = 0; i < dim; i++) {
            sum += tensor.real(i * dim + i);
        }
        return sum;
    }

    /**
     * Expectation value {@code Tr(ρ O)} or {@code ⟨ψ|O|ψ⟩} of a full-space observable.
     */
    public double expectationValue(ComplexMatrix observable) {
        if (observable.dimension() != dimension()) {
            throw new DimensionMismatchException("Observable dimension", dimension(), observable.dimension());
        }
        return densityMatrix().multiply(observable).trace().getReal();
    }

    /**
     * Check the state invariants: unit norm for a statevector; Hermitian, unit
     * trace and non-negative spectrum for a density matrix.
     */
    public boolean validate(double tolerance) {
        if (!densityMatrix) {
            return Math.abs(Math.sqrt(tensor.normSquared()) - 1.0) <= tolerance;
        }
        ComplexMatrix rho = tensor.toMatrix();
        if (!rho.isHermitian(tolerance) || Math.abs(trace() - 1.0) > tolerance) {
            return false;
        }
        for (double lambda : HermitianDecomposition.of(rho).eigenvalues()) {
            if (lambda < -NEGATIVITY_TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    // ==================== Measurement ====================

    /**
     * Probability of reading 0 on {@code qubit}.
     */
    public double probabilityOfZero(int qubit) {
        QubitIndexException.check(qubit, numQubits);
        int bit = 1 << (numQubits - 1 - qubit);
        int dim = dimension();
        double p0 = 0;
        for (int i = 0; i < dim; i++) {
            if ((i & bit) == 0) {
                p0 += densityMatrix ? tensor.real(i * dim + i) : tensor.absSquared(i);
            }
        }
        return p0;
    }

    /**
     * Measure one qubit in the computational basis and collapse the state in place.
     *
     * <p>The outcome is 0 when {@code rng.nextDouble() < P(0)}. Entries inconsistent
     * with the outcome are zeroed and the rest renormalised by the remaining norm
     * (pure) or trace (mixed); a non-positive remainder leaves the state
     * unnormalised.
     *
     * @return 0 or 1
     */
    public int measure(int qubit, Random rng) {
        Objects.requireNonNull(rng, "rng cannot be null");
        double p0 = probabilityOfZero(qubit);
        int outcome = rng.nextDouble() < p0 ? 0 : 1;
        collapse(qubit, outcome);
        return outcome;
    }

    /**
     * Project {@code qubit} onto {@code outcome} and renormalise.
     */
    public void collapse(int qubit, int outcome) {
        QubitIndexException.check(qubit, numQubits);
        if (outcome != 0 && outcome != 1) {
            throw new IllegalArgumentException("Outcome must be 0 or 1, got " + outcome);
        }
        int bit = 1 << (numQubits - 1 - qubit);
        int want = outcome == 0 ? 0 : bit;
        int dim = dimension();
        if (!densityMatrix) {
            for (int i = 0; i < dim; i++) {
                if ((i & bit) != want) {
                    tensor.set(i, 0.0, 0.0);
                }
            }
            double norm = Math.sqrt(tensor.normSquared());
            if (norm > 0) {
                tensor.scaleInPlace(1.0 / norm);
            }
            return;
        }
        for (int r = 0; r < dim; r++) {
            boolean rowKept = (r & bit) == want;
            for (int c = 0; c < dim; c++) {
                if (!rowKept || (c & bit) != want) {
                    tensor.set(r * dim + c, 0.0, 0.0);
                }
            }
        }
        double tr = trace();
        if (tr > 0) {
            tensor.scaleInPlace(1.0 / tr);
        }
    }

    private void requirePure(String what) {
        if (densityMatrix) {
            throw new IllegalStateException(what + " is only defined for a statevector");
        }
    }

    @Override
    public String toString() {
        return "QuantumState[" + numQubits + " qubits, " + (densityMatrix ? "density matrix" : "statevector") + "]";
    }
}
