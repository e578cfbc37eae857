package io.surfworks.quantaforge.backend.cpu;

import io.surfworks.quantaforge.core.backend.BackendCapabilities;
import io.surfworks.quantaforge.core.backend.ExecutionResult;
import io.surfworks.quantaforge.core.metrics.StateMetrics;
import io.surfworks.quantaforge.core.tensor.ComplexMatrix;

/**
 * Mixed-state simulation of the full {@code 2^n x 2^n} density matrix.
 */
public class DensityMatrixBackend extends AbstractCpuBackend {

    public static final String NAME = "density_matrix";

    public DensityMatrixBackend() {
        this(BackendCapabilities.densityMatrix());
    }

    public DensityMatrixBackend(BackendCapabilities capabilities) {
        super(capabilities);
    }

    @Override
    public String name() {
        return NAME;
    }

    /**
     * The final density matrix of a result.
     */
    public ComplexMatrix densityMatrix(ExecutionResult result) {
        return result.state().densityMatrix();
    }

    /**
     * Reduced density matrix of the final state over {@code keepQubits}.
     */
    public ComplexMatrix partialTrace(ExecutionResult result, int... keepQubits) {
        return StateMetrics.reducedDensityMatrix(result.state(), keepQubits);
    }

    /**
     * Purity of the final state, or of the reduced state of {@code qubits} when given.
     */
    public double purity(ExecutionResult result, int... qubits) {
        if (qubits.length == 0) {
            return StateMetrics.purity(result.state());
        }
        return StateMetrics.purity(result.state(), qubits);
    }

    /**
     * Entropy in bits of the final state, or of the reduced state of {@code qubits} when given.
     */
    public double vonNeumannEntropy(ExecutionResult result, int... qubits) {
        if (qubits.length == 0) {
            return StateMetrics.vonNeumannEntropy(result.state());
        }
        return StateMetrics.vonNeumannEntropy(result.state(), qubits);
    }
}
