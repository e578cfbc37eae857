package io.surfworks.quantaforge.backend.cpu;

import io.surfworks.quantaforge.core.circuit.Circuit;
import io.surfworks.quantaforge.core.circuit.GateOperation;
import io.surfworks.quantaforge.core.gate.Gate;
import io.surfworks.quantaforge.core.gate.GateType;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * The Clifford gates {H, S, CNOT, CZ, X, Y, Z, SWAP}.
 *
 * <p>Membership is by gate kind; a custom gate is never Clifford, whatever its name.
 */
public final class CliffordGateSet {

    private static final Set<GateType> CLIFFORD = EnumSet.of(
        GateType.H, GateType.S, GateType.CNOT, GateType.CZ,
        GateType.X, GateType.Y, GateType.Z, GateType.SWAP);

    private CliffordGateSet() {}

    public static boolean isClifford(Gate gate) {
        return CLIFFORD.contains(gate.type());
    }

    /**
     * The first gate of the circuit outside the Clifford set, if any.
     */
    public static Optional<Gate> firstNonClifford(Circuit circuit) {
        for (GateOperation op : circuit.gates()) {
            if (!isClifford(op.gate())) {
                return Optional.of(op.gate());
            }
        }
        return Optional.empty();
    }

    public static boolean isCliffordCircuit(Circuit circuit) {
        return firstNonClifford(circuit).isEmpty();
    }
}
