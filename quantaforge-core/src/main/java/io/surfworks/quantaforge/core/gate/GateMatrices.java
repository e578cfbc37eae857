package io.surfworks.quantaforge.core.gate;

import io.surfworks.quantaforge.core.tensor.ComplexMatrix;

/**
 * Unitaries of the named gates.
 */
final class GateMatrices {

    private static final double INV_SQRT2 = 1.0 / Math.sqrt(2.0);

    static final ComplexMatrix PAULI_X = ComplexMatrix.ofReal(new double[][] {
        {0, 1},
        {1, 0}
    });

    static final ComplexMatrix PAULI_Y = ComplexMatrix.of(
        new double[][] {{0, 0}, {0, 0}},
        new double[][] {{0, -1}, {1, 0}});

    static final ComplexMatrix PAULI_Z = ComplexMatrix.ofReal(new double[][] {
        {1, 0},
        {0, -1}
    });

    static final ComplexMatrix HADAMARD = ComplexMatrix.ofReal(new double[][] {
        {INV_SQRT2, INV_SQRT2},
        {INV_SQRT2, -INV_SQRT2}
    });

    static final ComplexMatrix PHASE_S = ComplexMatrix.of(
        new double[][] {{1, 0}, {0, 0}},
        new double[][] {{0, 0}, {0, 1}});

    static final ComplexMatrix PHASE_T = ComplexMatrix.of(
        new double[][] {{1, 0}, {0, INV_SQRT2}},
        new double[][] {{0, 0}, {0, INV_SQRT2}});

    // Control is the first operand, i.e. the high bit of the 2-qubit index.
    static final ComplexMatrix CNOT = ComplexMatrix.ofReal(new double[][] {
        {1, 0, 0, 0},
        {0, 1, 0, 0},
        {0, 0, 0, 1},
        {0, 0, 1, 0}
    });

    static final ComplexMatrix CZ = ComplexMatrix.ofReal(new double[][] {
        {1, 0, 0, 0},
        {0, 1, 0, 0},
        {0, 0, 1, 0},
        {0, 0, 0, -1}
    });

    static final ComplexMatrix SWAP = ComplexMatrix.ofReal(new double[][] {
        {1, 0, 0, 0},
        {0, 0, 1, 0},
        {0, 1, 0, 0},
        {0, 0, 0, 1}
    });

    static final ComplexMatrix TOFFOLI = toffoli();

    private GateMatrices() {}

    static ComplexMatrix rx(double theta) {
        double c = Math.cos(theta / 2);
        double s = Math.sin(theta / 2);
        return ComplexMatrix.of(
            new double[][] {{c, 0}, {0, c}},
            new double[][] {{0, -s}, {-s, 0}});
    }

    static ComplexMatrix ry(double theta) {
        double c = Math.cos(theta / 2);
        double s = Math.sin(theta / 2);
        return ComplexMatrix.ofReal(new double[][] {
            {c, -s},
            {s, c}
        });
    }

    static ComplexMatrix rz(double theta) {
        double c = Math.cos(theta / 2);
        double s = Math.sin(theta / 2);
        return ComplexMatrix.of(
            new double[][] {{c, 0}, {0, c}},
            new double[][] {{-s, 0}, {0, s}});
    }

    private static ComplexMatrix toffoli() {
        double[][] m = new double[8][8];
        for (int i = 0; i < 6; i++) {
            m[i][i] = 1;
        }
        m[6][7] = 1;
        m[7][6] = 1;
        return ComplexMatrix.ofReal(m);
    }
}
