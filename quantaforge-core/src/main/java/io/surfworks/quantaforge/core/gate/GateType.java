package io.surfworks.quantaforge.core.gate;

/**
 * The closed set of gate kinds understood by the engine.
 *
 * <p>Each named kind fixes its arity and parameter count. {@link #CUSTOM}
 * gates carry their own matrix and arity.
 */
public enum GateType {
    X(1, 0),
    Y(1, 0),
    Z(1, 0),
    H(1, 0),
    S(1, 0),
    T(1, 0),
    RX(1, 1),
    RY(1, 1),
    RZ(1, 1),
    CNOT(2, 0),
    CZ(2, 0),
    SWAP(2, 0),
    TOFFOLI(3, 0),
    CUSTOM(-1, 0);

    private final int arity;
    private final int parameterCount;

    GateType(int arity, int parameterCount) {
        this.arity = arity;
        this.parameterCount = parameterCount;
    }

    /**
     * Number of qubits the gate acts on, or -1 for {@link #CUSTOM}.
     */
    public int arity() {
        return arity;
    }

    public int parameterCount() {
        return parameterCount;
    }

    public boolean isParameterized() {
        return parameterCount > 0;
    }
}
