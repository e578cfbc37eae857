package io.surfworks.quantaforge.core.gate;

import io.surfworks.quantaforge.core.error.NonUnitaryGateException;
import io.surfworks.quantaforge.core.tensor.ComplexMatrix;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An immutable quantum gate: a kind, a name, an arity and its real parameters.
 *
 * <p>Named gates compute their unitary from the kind and parameters on demand.
 * Custom gates carry a matrix validated as unitary at construction.
 * Instances are created through {@link Gates}.
 */
public final class Gate {

    /** Tolerance on {@code U U† = I} for custom gates. */
    public static final double UNITARITY_TOLERANCE = 1e-8;

    private final GateType type;
    private final String name;
    private final int arity;
    private final double[] params;
    private final ComplexMatrix customMatrix;

    private Gate(GateType type, String name, int arity, double[] params, ComplexMatrix customMatrix) {
        this.type = type;
        this.name = name;
        this.arity = arity;
        this.params = params;
        this.customMatrix = customMatrix;
    }

    static Gate named(GateType type, double... params) {
        if (type == GateType.CUSTOM) {
            throw new IllegalArgumentException("Custom gates need a matrix");
        }
        if (params.length != type.parameterCount()) {
            throw new IllegalArgumentException(
                type + " takes " + type.parameterCount() + " parameter(s), got " + params.length);
        }
        for (double p : params) {
            if (!Double.isFinite(p)) {
                throw new IllegalArgumentException(type + " parameter must be finite, got " + p);
            }
        }
        return new Gate(type, type.name(), type.arity(), params.clone(), null);
    }

    static Gate custom(String name, ComplexMatrix matrix) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(matrix, "matrix cannot be null");
        int dim = matrix.dimension();
        if (dim < 2 || Integer.bitCount(dim) != 1) {
            throw new NonUnitaryGateException(name, Double.NaN);
        }
        double deviation = matrix.unitarityDeviation();
        if (!(deviation <= UNITARITY_TOLERANCE)) {
            throw new NonUnitaryGateException(name, deviation);
        }
        return new Gate(GateType.CUSTOM, name, Integer.numberOfTrailingZeros(dim), new double[0], matrix);
    }

    public GateType type() {
        return type;
    }

    public String name() {
        return name;
    }

    /**
     * Number of qubits this gate acts on.
     */
    public int arity() {
        return arity;
    }

    public List<Double> params() {
        return Arrays.stream(params).boxed().collect(Collectors.toUnmodifiableList());
    }

    public double param(int index) {
        return params[index];
    }

    /**
     * The {@code 2^k x 2^k} unitary of this gate. For multi-qubit gates the
     * first qubit operand is the most significant bit of the row/column index.
     */
    public ComplexMatrix matrix() {
        return switch (type) {
            case X -> GateMatrices.PAULI_X;
            case Y -> GateMatrices.PAULI_Y;
            case Z -> GateMatrices.PAULI_Z;
            case H -> GateMatrices.HADAMARD;
            case S -> GateMatrices.PHASE_S;
            case T -> GateMatrices.PHASE_T;
            case RX -> GateMatrices.rx(params[0]);
            case RY -> GateMatrices.ry(params[0]);
            case RZ -> GateMatrices.rz(params[0]);
            case CNOT -> GateMatrices.CNOT;
            case CZ -> GateMatrices.CZ;
            case SWAP -> GateMatrices.SWAP;
            case TOFFOLI -> GateMatrices.TOFFOLI;
            case CUSTOM -> customMatrix;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Gate)) return false;
        Gate gate = (Gate) o;
        return type == gate.type
            && arity == gate.arity
            && name.equals(gate.name)
            && Arrays.equals(params, gate.params)
            && Objects.equals(customMatrix, gate.customMatrix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, arity, Arrays.hashCode(params));
    }

    @Override
    public String toString() {
        if (params.length == 0) {
            return name;
        }
        return name + Arrays.stream(params)
            .mapToObj(Double::toString)
            .collect(Collectors.joining(", ", "(", ")"));
    }
}
