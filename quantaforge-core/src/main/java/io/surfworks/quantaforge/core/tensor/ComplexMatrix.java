package io.surfworks.quantaforge.core.tensor;

import org.apache.commons.math3.complex.Complex;

import java.util.Arrays;

/**
 * Immutable dense square complex matrix.
 *
 * <p>Entries are stored row-major with interleaved real and imaginary parts:
 * entry {@code (r, c)} lives at {@code 2 * (r * dim + c)} (real) and the next slot
 * (imaginary). All arithmetic returns new matrices.
 */
public final class ComplexMatrix {

    final int dim;
    final double[] data;

    ComplexMatrix(int dim, double[] data) {
        this.dim = dim;
        this.data = data;
    }

    // ==================== Factory Methods ====================

    /**
     * Create a zero matrix of the given dimension.
     */
    public static ComplexMatrix zeros(int dim) {
        if (dim <= 0) {
            throw new IllegalArgumentException("Matrix dimension must be positive, got " + dim);
        }
        return new ComplexMatrix(dim, new double[2 * dim * dim]);
    }

    /**
     * Create the identity matrix of the given dimension.
     */
    public static ComplexMatrix identity(int dim) {
        ComplexMatrix m = zeros(dim);
        for (int i = 0; i < dim; i++) {
            m.data[2 * (i * dim + i)] = 1.0;
        }
        return m;
    }

    /**
     * Create a matrix from complex entries. The array must be square.
     */
    public static ComplexMatrix of(Complex[][] entries) {
        int dim = entries.length;
        ComplexMatrix m = zeros(dim);
        for (int r = 0; r < dim; r++) {
            if (entries[r].length != dim) {
                throw new IllegalArgumentException(
                    "Row " + r + " has " + entries[r].length + " entries, expected " + dim);
            }
            for (int c = 0; c < dim; c++) {
                m.data[2 * (r * dim + c)] = entries[r][c].getReal();
                m.data[2 * (r * dim + c) + 1] = entries[r][c].getImaginary();
            }
        }
        return m;
    }

    /**
     * Create a matrix with purely real entries. The array must be square.
     */
    public static ComplexMatrix ofReal(double[][] entries) {
        int dim = entries.length;
        ComplexMatrix m = zeros(dim);
        for (int r = 0; r < dim; r++) {
            if (entries[r].length != dim) {
                throw new IllegalArgumentException(
                    "Row " + r + " has " + entries[r].length + " entries, expected " + dim);
            }
            for (int c = 0; c < dim; c++) {
                m.data[2 * (r * dim + c)] = entries[r][c];
            }
        }
        return m;
    }

    /**
     * Create a matrix from separate real and imaginary parts.
     */
    public static ComplexMatrix of(double[][] real, double[][] imag) {
        int dim = real.length;
        if (imag.length != dim) {
            throw new IllegalArgumentException("Real and imaginary parts differ in size");
        }
        ComplexMatrix m = ofReal(real);
        for (int r = 0; r < dim; r++) {
            if (imag[r].length != dim) {
                throw new IllegalArgumentException(
                    "Row " + r + " has " + imag[r].length + " imaginary entries, expected " + dim);
            }
            for (int c = 0; c < dim; c++) {
                m.data[2 * (r * dim + c) + 1] = imag[r][c];
            }
        }
        return m;
    }

    /**
     * Wrap a copy of an interleaved row-major buffer.
     */
    public static ComplexMatrix fromInterleaved(int dim, double[] interleaved) {
        if (interleaved.length != 2L * dim * dim) {
            throw new IllegalArgumentException(
                "Buffer length " + interleaved.length + " doesn't match dimension " + dim);
        }
        return new ComplexMatrix(dim, interleaved.clone());
    }

    /**
     * Outer product {@code |a⟩⟨b|}, given both vectors in interleaved form.
     */
    public static ComplexMatrix outer(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vectors differ in length");
        }
        int dim = a.length / 2;
        ComplexMatrix m = zeros(dim);
        for (int r = 0; r < dim; r++) {
            double ar = a[2 * r];
            double ai = a[2 * r + 1];
            for (int c = 0; c < dim; c++) {
                double br = b[2 * c];
                double bi = -b[2 * c + 1];
                int idx = 2 * (r * dim + c);
                m.data[idx] = ar * br - ai * bi;
                m.data[idx + 1] = ar * bi + ai * br;
            }
        }
        return m;
    }

    // ==================== Accessors ====================

    public int dimension() {
        return dim;
    }

    public Complex get(int row, int col) {
        int idx = index(row, col);
        return new Complex(data[idx], data[idx + 1]);
    }

    public double real(int row, int col) {
        return data[index(row, col)];
    }

    public double imag(int row, int col) {
        return data[index(row, col) + 1];
    }

    /**
     * Copy out the interleaved row-major buffer.
     */
    public double[] toInterleaved() {
        return data.clone();
    }

    /**
     * Copy out the entries as a two-dimensional array.
     */
    public Complex[][] toArray() {
        Complex[][] out = new Complex[dim][dim];
        for (int r = 0; r < dim; r++) {
            for (int c = 0; c < dim; c++) {
                out[r][c] = get(r, c);
            }
        }
        return out;
    }

    // ==================== Arithmetic ====================

    public ComplexMatrix multiply(ComplexMatrix other) {
        requireSameDimension(other);
        double[] out = new double[data.length];
        for (int r = 0; r < dim; r++) {
            for (int k = 0; k < dim; k++) {
                int ak = 2 * (r * dim + k);
                double ar = data[ak];
                double ai = data[ak + 1];
                if (ar == 0.0 && ai == 0.0) {
                    continue;
                }
                for (int c = 0; c < dim; c++) {
                    int bk = 2 * (k * dim + c);
                    double br = other.data[bk];
                    double bi = other.data[bk + 1];
                    int oi = 2 * (r * dim + c);
                    out[oi] += ar * br - ai * bi;
                    out[oi + 1] += ar * bi + ai * br;
                }
            }
        }
        return new ComplexMatrix(dim, out);
    }

    public ComplexMatrix add(ComplexMatrix other) {
        requireSameDimension(other);
        double[] out = data.clone();
        for (int i = 0; i < out.length; i++) {
            out[i] += other.data[i];
        }
        return new ComplexMatrix(dim, out);
    }

    public ComplexMatrix subtract(ComplexMatrix other) {
        requireSameDimension(other);
        double[] out = data.clone();
        for (int i = 0; i < out.length; i++) {
            out[i] -= other.data[i];
        }
        return new ComplexMatrix(dim, out);
    }

    public ComplexMatrix scale(double factor) {
        double[] out = data.clone();
        for (int i = 0; i < out.length; i++) {
            out[i] *= factor;
        }
        return new ComplexMatrix(dim, out);
    }

    public ComplexMatrix scale(Complex factor) {
        double fr = factor.getReal();
        double fi = factor.getImaginary();
        double[] out = new double[data.length];
        for (int i = 0; i < out.length; i += 2) {
            out[i] = data[i] * fr - data[i + 1] * fi;
            out[i + 1] = data[i] * fi + data[i + 1] * fr;
        }
        return new ComplexMatrix(dim, out);
    }

    /**
     * Conjugate transpose.
     */
    public ComplexMatrix dagger() {
        double[] out = new double[data.length];
        for (int r = 0; r < dim; r++) {
            for (int c = 0; c < dim; c++) {
                int src = 2 * (r * dim + c);
                int dst = 2 * (c * dim + r);
                out[dst] = data[src];
                out[dst + 1] = -data[src + 1];
            }
        }
        return new ComplexMatrix(dim, out);
    }

    /**
     * Elementwise complex conjugate (no transpose).
     */
    public ComplexMatrix conjugate() {
        double[] out = data.clone();
        for (int i = 1; i < out.length; i += 2) {
            out[i] = -out[i];
        }
        return new ComplexMatrix(dim, out);
    }

    /**
     * Kronecker product {@code this ⊗ other}.
     */
    public ComplexMatrix kron(ComplexMatrix other) {
        int od = other.dim;
        int nd = dim * od;
        double[] out = new double[2 * nd * nd];
        for (int ar = 0; ar < dim; ar++) {
            for (int ac = 0; ac < dim; ac++) {
                int ai = 2 * (ar * dim + ac);
                double xr = data[ai];
                double xi = data[ai + 1];
                if (xr == 0.0 && xi == 0.0) {
                    continue;
                }
                for (int br = 0; br < od; br++) {
                    for (int bc = 0; bc < od; bc++) {
                        int bi = 2 * (br * od + bc);
                        double yr = other.data[bi];
                        double yi = other.data[bi + 1];
                        int oi = 2 * ((ar * od + br) * nd + (ac * od + bc));
                        out[oi] = xr * yr - xi * yi;
                        out[oi + 1] = xr * yi + xi * yr;
                    }
                }
            }
        }
        return new ComplexMatrix(nd, out);
    }

    public Complex trace() {
        double re = 0;
        double im = 0;
        for (int i = 0; i < dim; i++) {
            re += data[2 * (i * dim + i)];
            im += data[2 * (i * dim + i) + 1];
        }
        return new Complex(re, im);
    }

    /**
     * Real part of the diagonal.
     */
    public double[] diagonal() {
        double[] out = new double[dim];
        for (int i = 0; i < dim; i++) {
            out[i] = data[2 * (i * dim + i)];
        }
        return out;
    }

    // ==================== Predicates ====================

    /**
     * Largest absolute entry of {@code this - other}.
     */
    public double maxAbsDifference(ComplexMatrix other) {
        requireSameDimension(other);
        double max = 0;
        for (int i = 0; i < data.length; i += 2) {
            double dr = data[i] - other.data[i];
            double di = data[i + 1] - other.data[i + 1];
            max = Math.max(max, Math.hypot(dr, di));
        }
        return max;
    }

    public boolean approxEquals(ComplexMatrix other, double tolerance) {
        return dim == other.dim && maxAbsDifference(other) <= tolerance;
    }

    /**
     * Largest absolute entry of {@code U U† - I}.
     */
    public double unitarityDeviation() {
        return multiply(dagger()).maxAbsDifference(identity(dim));
    }

    public boolean isUnitary(double tolerance) {
        return unitarityDeviation() <= tolerance;
    }

    public boolean isHermitian(double tolerance) {
        return maxAbsDifference(dagger()) <= tolerance;
    }

    private int index(int row, int col) {
        if (row < 0 || row >= dim || col < 0 || col >= dim) {
            throw new IndexOutOfBoundsException(
                "Entry (" + row + ", " + col + ") out of bounds for dimension " + dim);
        }
        return 2 * (row * dim + col);
    }

    private void requireSameDimension(ComplexMatrix other) {
        if (other.dim != dim) {
            throw new IllegalArgumentException(
                "Dimension mismatch: " + dim + " vs " + other.dim);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComplexMatrix)) return false;
        ComplexMatrix that = (ComplexMatrix) o;
        return dim == that.dim && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * dim + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ComplexMatrix[").append(dim).append("x").append(dim).append("]");
        if (dim <= 4) {
            sb.append(Arrays.deepToString(toArray()));
        }
        return sb.toString();
    }
}
