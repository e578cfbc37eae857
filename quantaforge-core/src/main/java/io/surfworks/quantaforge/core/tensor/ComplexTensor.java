package io.surfworks.quantaforge.core.tensor;

import org.apache.commons.math3.complex.Complex;

import java.util.Arrays;

/**
 * A rank-r complex tensor in which every axis has extent 2.
 *
 * <p>This is the storage behind a quantum state: rank {@code n} for an n-qubit
 * statevector, rank {@code 2n} for an n-qubit density matrix (row axes
 * {@code [0, n)}, column axes {@code [n, 2n)}). Elements are stored row-major
 * with interleaved real/imaginary parts, and axis 0 is the most significant bit
 * of the flat index.
 *
 * <p>The buffer is split into chunks of at most {@code 2^CHUNK_BITS} entries, so
 * a tensor may hold more doubles than a single Java array. Entry indices stay
 * {@code int}.
 *
 * <p>Tensors are mutable; gate and channel application rewrite the buffer in place.
 */
public final class ComplexTensor {

    /** Largest rank whose entry count still fits in an {@code int}. */
    public static final int MAX_RANK = 30;

    /** Largest rank that can be copied out to a single interleaved array. */
    public static final int MAX_ARRAY_RANK = 29;

    /** log2 of the entries per chunk (1 GiB of doubles). */
    static final int CHUNK_BITS = 26;

    private final int rank;
    private final int chunkBits;
    private final int chunkMask;
    private final double[][] chunks;

    private ComplexTensor(int rank, int chunkBits, double[][] chunks) {
        this.rank = rank;
        this.chunkBits = chunkBits;
        this.chunkMask = (1 << chunkBits) - 1;
        this.chunks = chunks;
    }

    // ==================== Factory Methods ====================

    /**
     * Create a zero-initialized tensor of the given rank.
     */
    public static ComplexTensor zeros(int rank) {
        return zeros(rank, CHUNK_BITS);
    }

    static ComplexTensor zeros(int rank, int chunkBits) {
        if (rank < 0 || rank > MAX_RANK) {
            throw new IllegalArgumentException(
                "Tensor rank " + rank + " outside supported range [0, " + MAX_RANK + "]");
        }
        if (rank <= chunkBits) {
            return new ComplexTensor(rank, chunkBits, new double[][] {new double[2 << rank]});
        }
        double[][] chunks = new double[1 << (rank - chunkBits)][];
        for (int i = 0; i < chunks.length; i++) {
            chunks[i] = new double[2 << chunkBits];
        }
        return new ComplexTensor(rank, chunkBits, chunks);
    }

    /**
     * Create a tensor with a single unit entry at {@code index}.
     */
    public static ComplexTensor basis(int rank, int index) {
        ComplexTensor t = zeros(rank);
        t.set(index, 1.0, 0.0);
        return t;
    }

    /**
     * Create a tensor from complex entries. The length must be {@code 2^rank}.
     */
    public static ComplexTensor of(int rank, Complex[] entries) {
        ComplexTensor t = zeros(rank);
        if (entries.length != t.size()) {
            throw new IllegalArgumentException(
                "Entry count " + entries.length + " doesn't match rank " + rank + " (expected " + t.size() + ")");
        }
        for (int i = 0; i < entries.length; i++) {
            t.set(i, entries[i].getReal(), entries[i].getImaginary());
        }
        return t;
    }

    /**
     * Create a rank-{@code 2n} tensor holding the entries of a {@code 2^n x 2^n} matrix.
     */
    public static ComplexTensor fromMatrix(ComplexMatrix matrix) {
        int n = Integer.numberOfTrailingZeros(matrix.dim);
        if (Integer.bitCount(matrix.dim) != 1) {
            throw new IllegalArgumentException("Matrix dimension " + matrix.dim + " is not a power of two");
        }
        ComplexTensor t = zeros(2 * n);
        t.copyIn(matrix.data);
        return t;
    }

    // ==================== Element Access ====================

    public int rank() {
        return rank;
    }

    /**
     * Number of complex entries, {@code 2^rank}.
     */
    public int size() {
        return 1 << rank;
    }

    public double real(int index) {
        return chunks[index >>> chunkBits][2 * (index & chunkMask)];
    }

    public double imag(int index) {
        return chunks[index >>> chunkBits][2 * (index & chunkMask) + 1];
    }

    public Complex get(int index) {
        return new Complex(real(index), imag(index));
    }

    public void set(int index, double re, double im) {
        double[] chunk = chunks[index >>> chunkBits];
        int offset = 2 * (index & chunkMask);
        chunk[offset] = re;
        chunk[offset + 1] = im;
    }

    /**
     * Squared magnitude of the entry at {@code index}.
     */
    public double absSquared(int index) {
        double[] chunk = chunks[index >>> chunkBits];
        int offset = 2 * (index & chunkMask);
        double re = chunk[offset];
        double im = chunk[offset + 1];
        return re * re + im * im;
    }

    // ==================== Bulk Operations ====================

    public ComplexTensor copy() {
        double[][] copied = new double[chunks.length][];
        for (int i = 0; i < chunks.length; i++) {
            copied[i] = chunks[i].clone();
        }
        return new ComplexTensor(rank, chunkBits, copied);
    }

    /**
     * Overwrite this tensor's entries with those of {@code other}.
     */
    public void copyFrom(ComplexTensor other) {
        requireSameRank(other);
        for (int i = 0; i < size(); i++) {
            set(i, other.real(i), other.imag(i));
        }
    }

    /**
     * Add {@code other} into this tensor entry by entry.
     */
    public void addInPlace(ComplexTensor other) {
        requireSameRank(other);
        for (int i = 0; i < size(); i++) {
            set(i, real(i) + other.real(i), imag(i) + other.imag(i));
        }
    }

    private void requireSameRank(ComplexTensor other) {
        if (other.rank != rank) {
            throw new IllegalArgumentException("Rank mismatch: " + rank + " vs " + other.rank);
        }
    }

    public void scaleInPlace(double factor) {
        for (double[] chunk : chunks) {
            for (int i = 0; i < chunk.length; i++) {
                chunk[i] *= factor;
            }
        }
    }

    public void fill(double re, double im) {
        for (double[] chunk : chunks) {
            for (int i = 0; i < chunk.length; i += 2) {
                chunk[i] = re;
                chunk[i + 1] = im;
            }
        }
    }

    /**
     * Sum of squared magnitudes of all entries.
     */
    public double normSquared() {
        double sum = 0;
        for (double[] chunk : chunks) {
            for (double v : chunk) {
                sum += v * v;
            }
        }
        return sum;
    }

    /**
     * View a rank-{@code 2n} tensor as a {@code 2^n x 2^n} matrix (copies the data).
     */
    public ComplexMatrix toMatrix() {
        if (rank % 2 != 0) {
            throw new IllegalStateException("Tensor of odd rank " + rank + " is not a matrix");
        }
        return new ComplexMatrix(1 << (rank / 2), toInterleaved());
    }

    /**
     * Copy out the interleaved buffer.
     *
     * @throws IllegalStateException if the rank exceeds {@link #MAX_ARRAY_RANK}
     */
    public double[] toInterleaved() {
        if (rank > MAX_ARRAY_RANK) {
            throw new IllegalStateException(
                "Tensor of rank " + rank + " is too large for a single array (at most " + MAX_ARRAY_RANK + ")");
        }
        if (chunks.length == 1) {
            return chunks[0].clone();
        }
        double[] out = new double[2 << rank];
        int pos = 0;
        for (double[] chunk : chunks) {
            System.arraycopy(chunk, 0, out, pos, chunk.length);
            pos += chunk.length;
        }
        return out;
    }

    private void copyIn(double[] interleaved) {
        int pos = 0;
        for (double[] chunk : chunks) {
            System.arraycopy(interleaved, pos, chunk, 0, chunk.length);
            pos += chunk.length;
        }
    }

    public Complex[] toArray() {
        Complex[] out = new Complex[size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = get(i);
        }
        return out;
    }

    // ==================== Contraction ====================

    /**
     * Contract a {@code 2^k x 2^k} matrix against {@code k} axes of this tensor, in place.
     *
     * <p>The matrix's input indices are summed against the listed axes and its
     * output indices take their place, so the axis order is preserved. The first
     * listed axis is the most significant bit of the matrix row/column index. When
     * {@code conjugate} is set the elementwise conjugate of the matrix is used,
     * which is how {@code ρ U†} is evaluated on the column axes of a density matrix.
     *
     * @param matrix    operator of dimension {@code 2^axes.length}
     * @param axes      distinct target axes in {@code [0, rank)}
     * @param conjugate contract with {@code conj(matrix)} instead of {@code matrix}
     */
    public void applyOnAxes(ComplexMatrix matrix, int[] axes, boolean conjugate) {
        int k = axes.length;
        int m = 1 << k;
        if (matrix.dim != m) {
            throw new IllegalArgumentException(
                "Matrix dimension " + matrix.dim + " doesn't match " + k + " target axes");
        }
        int[] offsets = new int[m];
        int mask = 0;
        for (int j = 0; j < k; j++) {
            int axis = axes[j];
            if (axis < 0 || axis >= rank) {
                throw new IndexOutOfBoundsException("Axis " + axis + " out of range for rank " + rank);
            }
            int bit = 1 << (rank - 1 - axis);
            if ((mask & bit) != 0) {
                throw new IllegalArgumentException("Duplicate target axis " + axis + " in " + Arrays.toString(axes));
            }
            mask |= bit;
            for (int g = 0; g < m; g++) {
                if (((g >> (k - 1 - j)) & 1) != 0) {
                    offsets[g] |= bit;
                }
            }
        }

        double sign = conjugate ? -1.0 : 1.0;
        double[] u = matrix.data;
        double[] inRe = new double[m];
        double[] inIm = new double[m];
        int size = size();
        for (int base = 0; base < size; base++) {
            if ((base & mask) != 0) {
                continue;
            }
            for (int g = 0; g < m; g++) {
                int idx = base | offsets[g];
                inRe[g] = real(idx);
                inIm[g] = imag(idx);
            }
            for (int r = 0; r < m; r++) {
                double accRe = 0;
                double accIm = 0;
                int row = 2 * r * m;
                for (int c = 0; c < m; c++) {
                    double ur = u[row + 2 * c];
                    double ui = sign * u[row + 2 * c + 1];
                    accRe += ur * inRe[c] - ui * inIm[c];
                    accIm += ur * inIm[c] + ui * inRe[c];
                }
                set(base | offsets[r], accRe, accIm);
            }
        }
    }

    @Override
    public String toString() {
        return "ComplexTensor[rank=" + rank + ", size=" + size() + "]";
    }
}
