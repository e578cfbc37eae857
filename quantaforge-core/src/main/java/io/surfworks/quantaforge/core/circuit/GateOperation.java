package io.surfworks.quantaforge.core.circuit;

import io.surfworks.quantaforge.core.gate.Gate;

import java.util.Arrays;
import java.util.Objects;

/**
 * A gate applied to an ordered list of qubits.
 */
public record GateOperation(Gate gate, int[] qubits) {

    public GateOperation {
        Objects.requireNonNull(gate, "gate cannot be null");
        qubits = qubits.clone();
    }

    @Override
    public int[] qubits() {
        return qubits.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GateOperation)) return false;
        GateOperation that = (GateOperation) o;
        return gate.equals(that.gate) && Arrays.equals(qubits, that.qubits);
    }

    @Override
    public int hashCode() {
        return 31 * gate.hashCode() + Arrays.hashCode(qubits);
    }

    @Override
    public String toString() {
        return gate + " " + Arrays.toString(qubits);
    }
}
