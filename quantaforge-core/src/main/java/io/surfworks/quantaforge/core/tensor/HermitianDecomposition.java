package io.surfworks.quantaforge.core.tensor;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.Arrays;
import java.util.function.DoubleUnaryOperator;

/**
 * Eigen-decomposition of a Hermitian matrix.
 *
 * <p>A Hermitian {@code H = A + iB} is decomposed through its real symmetric
 * embedding {@code [[A, -B], [B, A]]}, which has the same eigenvalues as
 * {@code H}, each with doubled multiplicity. Functions of {@code H} are read back
 * from the top-left (real part) and bottom-left (imaginary part) blocks of the
 * same function applied to the embedding.
 */
public final class HermitianDecomposition {

    private final int dim;
    private final EigenDecomposition eigen;

    private HermitianDecomposition(int dim, EigenDecomposition eigen) {
        this.dim = dim;
        this.eigen = eigen;
    }

    /**
     * Decompose a Hermitian matrix. The matrix is symmetrized first, so small
     * numerical asymmetry is tolerated.
     */
    public static HermitianDecomposition of(ComplexMatrix matrix) {
        int n = matrix.dim;
        double[][] s = new double[2 * n][2 * n];
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                double a = 0.5 * (matrix.real(r, c) + matrix.real(c, r));
                double b = 0.5 * (matrix.imag(r, c) - matrix.imag(c, r));
                s[r][c] = a;
                s[r + n][c + n] = a;
                s[r][c + n] = -b;
                s[r + n][c] = b;
            }
        }
        return new HermitianDecomposition(n, new EigenDecomposition(new Array2DRowRealMatrix(s, false)));
    }

    /**
     * Eigenvalues of the Hermitian matrix in ascending order.
     */
    public double[] eigenvalues() {
        double[] doubled = eigen.getRealEigenvalues().clone();
        Arrays.sort(doubled);
        double[] out = new double[dim];
        for (int i = 0; i < dim; i++) {
            out[i] = 0.5 * (doubled[2 * i] + doubled[2 * i + 1]);
        }
        return out;
    }

    /**
     * Unit eigenvector of the largest eigenvalue, interleaved, with an arbitrary global phase.
     */
    public double[] leadingEigenvector() {
        double[] values = eigen.getRealEigenvalues();
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) {
                best = i;
            }
        }
        RealVector v = eigen.getEigenvector(best);
        double[] out = new double[2 * dim];
        double norm = 0;
        for (int i = 0; i < dim; i++) {
            out[2 * i] = v.getEntry(i);
            out[2 * i + 1] = v.getEntry(i + dim);
            norm += out[2 * i] * out[2 * i] + out[2 * i + 1] * out[2 * i + 1];
        }
        double inv = 1.0 / Math.sqrt(norm);
        for (int i = 0; i < out.length; i++) {
            out[i] *= inv;
        }
        return out;
    }

    /**
     * Apply a scalar function to the eigenvalues: {@code V f(Λ) V†}.
     */
    public ComplexMatrix apply(DoubleUnaryOperator f) {
        RealMatrix v = eigen.getV();
        double[] values = eigen.getRealEigenvalues();
        int n2 = 2 * dim;
        double[] fv = new double[n2];
        for (int k = 0; k < n2; k++) {
            fv[k] = f.applyAsDouble(values[k]);
        }
        ComplexMatrix out = ComplexMatrix.zeros(dim);
        for (int r = 0; r < dim; r++) {
            for (int c = 0; c < dim; c++) {
                double re = 0;
                double im = 0;
                for (int k = 0; k < n2; k++) {
                    double w = fv[k] * v.getEntry(c, k);
                    re += v.getEntry(r, k) * w;
                    im += v.getEntry(r + dim, k) * w;
                }
                out.data[2 * (r * dim + c)] = re;
                out.data[2 * (r * dim + c) + 1] = im;
            }
        }
        return out;
    }

    /**
     * Principal square root, with negative eigenvalues (numerical noise) clamped to zero.
     */
    public ComplexMatrix sqrt() {
        return apply(x -> Math.sqrt(Math.max(x, 0.0)));
    }
}
