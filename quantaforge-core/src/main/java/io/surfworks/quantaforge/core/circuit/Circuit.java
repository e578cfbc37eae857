package io.surfworks.quantaforge.core.circuit;

import io.surfworks.quantaforge.core.error.GateArityException;
import io.surfworks.quantaforge.core.error.QubitIndexException;
import io.surfworks.quantaforge.core.gate.Gate;
import io.surfworks.quantaforge.core.gate.Gates;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An immutable quantum circuit: an ordered gate list and an ordered list of
 * measurements, over a fixed number of qubits and classical bits.
 *
 * <p>Build one with {@link #builder(int, int)}:
 * <pre>{@code
 * Circuit bell = Circuit.builder(2, 2)
 *     .h(0)
 *     .cnot(0, 1)
 *     .measure(0, 0)
 *     .measure(1, 1)
 *     .build();
 * }</pre>
 */
public final class Circuit {

    private final int numQubits;
    private final int numClassicalBits;
    private final List<GateOperation> gates;
    private final List<Measurement> measurements;

    private Circuit(int numQubits, int numClassicalBits, List<GateOperation> gates, List<Measurement> measurements) {
        this.numQubits = numQubits;
        this.numClassicalBits = numClassicalBits;
        this.gates = Collections.unmodifiableList(gates);
        this.measurements = Collections.unmodifiableList(measurements);
    }

    public static Builder builder(int numQubits) {
        return new Builder(numQubits, 0);
    }

    public static Builder builder(int numQubits, int numClassicalBits) {
        return new Builder(numQubits, numClassicalBits);
    }

    public int numQubits() {
        return numQubits;
    }

    public int numClassicalBits() {
        return numClassicalBits;
    }

    public List<GateOperation> gates() {
        return gates;
    }

    public List<Measurement> measurements() {
        return measurements;
    }

    public int gateCount() {
        return gates.size();
    }

    /**
     * Number of layers when each gate is placed one layer after the latest layer
     * used by any of its qubits. Zero for an empty circuit.
     */
    public int depth() {
        int[] lastLayer = new int[numQubits];
        Arrays.fill(lastLayer, -1);
        int depth = 0;
        for (GateOperation op : gates) {
            int layer = -1;
            for (int q : op.qubits()) {
                layer = Math.max(layer, lastLayer[q]);
            }
            layer++;
            for (int q : op.qubits()) {
                lastLayer[q] = layer;
            }
            depth = Math.max(depth, layer + 1);
        }
        return depth;
    }

    /**
     * Gate name to occurrence count, in first-appearance order.
     */
    public Map<String, Integer> gateCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (GateOperation op : gates) {
            counts.merge(op.gate().name(), 1, Integer::sum);
        }
        return Collections.unmodifiableMap(counts);
    }

    /**
     * Distinct gate names in first-appearance order.
     */
    public Set<String> gateNames() {
        Set<String> names = new LinkedHashSet<>();
        for (GateOperation op : gates) {
            names.add(op.gate().name());
        }
        return Collections.unmodifiableSet(names);
    }

    @Override
    public String toString() {
        return "Circuit(" + numQubits + " qubits, " + gates.size() + " gates, depth=" + depth() + ")";
    }

    /**
     * Fluent builder. Every operation is validated as it is added.
     */
    public static final class Builder {
        private final int numQubits;
        private final int numClassicalBits;
        private final List<GateOperation> gates = new ArrayList<>();
        private final List<Measurement> measurements = new ArrayList<>();
        private final Set<Integer> explicitBits = new HashSet<>();
        private final Set<Integer> autoBits = new HashSet<>();

        private Builder(int numQubits, int numClassicalBits) {
            if (numQubits <= 0) {
                throw new IllegalArgumentException("Number of qubits must be positive, got " + numQubits);
            }
            if (numClassicalBits < 0) {
                throw new IllegalArgumentException(
                    "Number of classical bits must be non-negative, got " + numClassicalBits);
            }
            this.numQubits = numQubits;
            this.numClassicalBits = numClassicalBits;
        }

        /**
         * Append {@code gate} acting on {@code qubits}.
         *
         * @throws QubitIndexException if a qubit is outside {@code [0, numQubits)}
         * @throws GateArityException  if the qubit count differs from the gate's arity
         */
        public Builder gate(Gate gate, int... qubits) {
            for (int q : qubits) {
                QubitIndexException.check(q, numQubits);
            }
            if (qubits.length != gate.arity()) {
                throw new GateArityException(gate.name(), gate.arity(), qubits.length);
            }
            for (int i = 0; i < qubits.length; i++) {
                for (int j = i + 1; j < qubits.length; j++) {
                    if (qubits[i] == qubits[j]) {
                        throw new IllegalArgumentException(
                            gate.name() + " acts on qubit " + qubits[i] + " more than once");
                    }
                }
            }
            gates.add(new GateOperation(gate, qubits));
            return this;
        }

        public Builder x(int qubit) {
            return gate(Gates.x(), qubit);
        }

        public Builder y(int qubit) {
            return gate(Gates.y(), qubit);
        }

        public Builder z(int qubit) {
            return gate(Gates.z(), qubit);
        }

        public Builder h(int qubit) {
            return gate(Gates.h(), qubit);
        }

        public Builder s(int qubit) {
            return gate(Gates.s(), qubit);
        }

        public Builder t(int qubit) {
            return gate(Gates.t(), qubit);
        }

        public Builder rx(int qubit, double theta) {
            return gate(Gates.rx(theta), qubit);
        }

        public Builder ry(int qubit, double theta) {
            return gate(Gates.ry(theta), qubit);
        }

        public Builder rz(int qubit, double theta) {
            return gate(Gates.rz(theta), qubit);
        }

        public Builder cnot(int control, int target) {
            return gate(Gates.cnot(), control, target);
        }

        public Builder cz(int control, int target) {
            return gate(Gates.cz(), control, target);
        }

        public Builder swap(int qubit1, int qubit2) {
            return gate(Gates.swap(), qubit1, qubit2);
        }

        public Builder toffoli(int control1, int control2, int target) {
            return gate(Gates.toffoli(), control1, control2, target);
        }

        /**
         * Measure {@code qubit} into the next classical bit, numbered by measurement order.
         *
         * <p>A circuit built without classical bits numbers them freely; otherwise the
         * bit must lie in {@code [0, numClassicalBits)}.
         *
         * @throws IllegalArgumentException if the bit is out of range or already written
         */
        public Builder measure(int qubit) {
            QubitIndexException.check(qubit, numQubits);
            int bit = measurements.size();
            checkAutoBit(bit);
            autoBits.add(bit);
            measurements.add(new Measurement(qubit, bit));
            return this;
        }

        /**
         * Measure {@code qubit} into {@code classicalBit}. An explicit bit may be written
         * again by a later explicit measurement.
         *
         * @throws IllegalArgumentException if the bit is outside {@code [0, numClassicalBits)}
         *                                  or was auto-assigned to an earlier measurement
         */
        public Builder measure(int qubit, int classicalBit) {
            QubitIndexException.check(qubit, numQubits);
            if (classicalBit < 0 || classicalBit >= numClassicalBits) {
                throw new IllegalArgumentException(
                    "Classical bit index " + classicalBit + " out of range [0, " + numClassicalBits + ")");
            }
            if (autoBits.contains(classicalBit)) {
                throw new IllegalArgumentException(
                    "Classical bit " + classicalBit + " is already auto-assigned to an earlier measurement");
            }
            explicitBits.add(classicalBit);
            measurements.add(new Measurement(qubit, classicalBit));
            return this;
        }

        /**
         * Measure every qubit {@code q} into classical bit {@code q}. Nothing is added
         * if any of those bits is unavailable.
         *
         * @throws IllegalArgumentException if a bit is out of range or already written
         */
        public Builder measureAll() {
            for (int q = 0; q < numQubits; q++) {
                checkAutoBit(q);
            }
            for (int q = 0; q < numQubits; q++) {
                autoBits.add(q);
                measurements.add(new Measurement(q, q));
            }
            return this;
        }

        private void checkAutoBit(int bit) {
            if (numClassicalBits > 0 && bit >= numClassicalBits) {
                throw new IllegalArgumentException(
                    "Auto-assigned classical bit " + bit + " out of range [0, " + numClassicalBits + ")");
            }
            if (explicitBits.contains(bit) || autoBits.contains(bit)) {
                throw new IllegalArgumentException("Classical bit " + bit + " is already written by a measurement");
            }
        }

        public Circuit build() {
            return new Circuit(numQubits, numClassicalBits, new ArrayList<>(gates), new ArrayList<>(measurements));
        }
    }
}
