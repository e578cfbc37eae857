package io.surfworks.quantaforge.core.gate;

import io.surfworks.quantaforge.core.tensor.ComplexMatrix;

/**
 * Factory methods for gates.
 *
 * <pre>{@code
 * Gate h = Gates.h();
 * Gate rx = Gates.rx(Math.PI / 2);
 * Gate iswap = Gates.custom("ISWAP", matrix);
 * }</pre>
 */
public final class Gates {

    private static final Gate X = Gate.named(GateType.X);
    private static final Gate Y = Gate.named(GateType.Y);
    private static final Gate Z = Gate.named(GateType.Z);
    private static final Gate H = Gate.named(GateType.H);
    private static final Gate S = Gate.named(GateType.S);
    private static final Gate T = Gate.named(GateType.T);
    private static final Gate CNOT = Gate.named(GateType.CNOT);
    private static final Gate CZ = Gate.named(GateType.CZ);
    private static final Gate SWAP = Gate.named(GateType.SWAP);
    private static final Gate TOFFOLI = Gate.named(GateType.TOFFOLI);

    private Gates() {}

    public static Gate x() {
        return X;
    }

    public static Gate y() {
        return Y;
    }

    public static Gate z() {
        return Z;
    }

    public static Gate h() {
        return H;
    }

    public static Gate s() {
        return S;
    }

    public static Gate t() {
        return T;
    }

    /**
     * Rotation about X by {@code theta} radians.
     */
    public static Gate rx(double theta) {
        return Gate.named(GateType.RX, theta);
    }

    /**
     * Rotation about Y by {@code theta} radians.
     */
    public static Gate ry(double theta) {
        return Gate.named(GateType.RY, theta);
    }

    /**
     * Rotation about Z by {@code theta} radians.
     */
    public static Gate rz(double theta) {
        return Gate.named(GateType.RZ, theta);
    }

    public static Gate cnot() {
        return CNOT;
    }

    public static Gate cz() {
        return CZ;
    }

    public static Gate swap() {
        return SWAP;
    }

    public static Gate toffoli() {
        return TOFFOLI;
    }

    /**
     * A named gate of the given kind.
     *
     * @throws IllegalArgumentException if the parameter count doesn't match the kind
     */
    public static Gate of(GateType type, double... params) {
        return Gate.named(type, params);
    }

    /**
     * A gate defined by an arbitrary unitary of dimension {@code 2^k}, {@code k >= 1}.
     *
     * @throws io.surfworks.quantaforge.core.error.NonUnitaryGateException
     *         if the matrix isn't unitary within {@link Gate#UNITARITY_TOLERANCE}
     */
    public static Gate custom(String name, ComplexMatrix matrix) {
        return Gate.custom(name, matrix);
    }
}
