package io.surfworks.quantaforge.backend.cpu;

import io.surfworks.quantaforge.core.backend.CapabilityCheck;
import io.surfworks.quantaforge.core.backend.ExecutionOptions;
import io.surfworks.quantaforge.core.backend.ExecutionResult;
import io.surfworks.quantaforge.core.circuit.Circuit;
import io.surfworks.quantaforge.core.error.NonCliffordGateException;
import io.surfworks.quantaforge.core.error.UnsupportedCircuitException;
import io.surfworks.quantaforge.core.gate.Gates;
import io.surfworks.quantaforge.core.testing.StateAssert;
import io.surfworks.quantaforge.core.testing.ToleranceConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StabilizerBackendTest {

    private static final double S = 1 / Math.sqrt(2);

    private StabilizerBackend backend;

    @BeforeEach
    void setUp() {
        backend = new StabilizerBackend();
    }

    @Test
    void backendProperties() {
        assertEquals("stabilizer", backend.name());
        assertTrue(backend.capabilities().cliffordOnly());
        assertFalse(backend.capabilities().supportsNoise());
    }

    @Test
    void runsCliffordCircuitAndRelabelsResult() {
        Circuit circuit = Circuit.builder(2).h(0).cnot(0, 1).s(1).z(0).build();
        ExecutionResult result = backend.execute(circuit, ExecutionOptions.builder().recordHistory(true).build());

        Map<String, Object> metadata = result.metadata();
        assertEquals("stabilizer", result.backendName());
        assertEquals("statevector", metadata.get(ExecutionResult.KEY_EXECUTED_BY));
        assertEquals(StabilizerBackend.NOTE, metadata.get(ExecutionResult.KEY_NOTE));
        assertEquals(4, metadata.get(ExecutionResult.KEY_NUM_GATES));
        assertEquals(5, result.history().orElseThrow().size());
        assertEquals(0.5, result.probabilities()[0], 1e-12);
        assertEquals(0.5, result.probabilities()[3], 1e-12);
    }

    @Test
    void matchesStatevectorResult() {
        Circuit circuit = Circuit.builder(3).h(0).cnot(0, 2).swap(1, 2).cz(0, 1).y(2).build();
        StateAssert.assertAmplitudes(
            new StatevectorBackend().execute(circuit).state().amplitudes(),
            backend.execute(circuit).state(),
            ToleranceConfig.forCheck("amplitude"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"T", "RX", "TOFFOLI"})
    void refusesNonCliffordGates(String gateName) {
        Circuit.Builder builder = Circuit.builder(3).h(0);
        switch (gateName) {
            case "T" -> builder.t(1);
            case "RX" -> builder.rx(1, 0.3);
            default -> builder.toffoli(0, 1, 2);
        }
        Circuit circuit = builder.build();

        CapabilityCheck check = backend.canExecute(circuit);
        assertFalse(check.executable());
        assertEquals("Non-Clifford gate: " + gateName, check.message().orElseThrow());

        NonCliffordGateException e = assertThrows(NonCliffordGateException.class, () -> backend.execute(circuit));
        assertEquals(gateName, e.gateName());
    }

    @Test
    void customGateIsNeverClifford() {
        Circuit circuit = Circuit.builder(1).gate(Gates.custom("H", Gates.h().matrix()), 0).build();
        assertThrows(NonCliffordGateException.class, () -> backend.execute(circuit));
        assertFalse(CliffordGateSet.isCliffordCircuit(circuit));
    }

    @Test
    void cliffordGateSetMembership() {
        assertTrue(CliffordGateSet.isClifford(Gates.swap()));
        assertTrue(CliffordGateSet.isClifford(Gates.cz()));
        assertFalse(CliffordGateSet.isClifford(Gates.t()));
        assertFalse(CliffordGateSet.isClifford(Gates.rz(Math.PI / 2)));
        assertEquals("T", CliffordGateSet.firstNonClifford(Circuit.builder(1).h(0).t(0).s(0).build())
            .orElseThrow().name());
        assertTrue(CliffordGateSet.isCliffordCircuit(Circuit.builder(2).build()));
    }

    @Test
    void sizeLimitStillApplies() {
        Circuit huge = Circuit.builder(31).h(0).build();
        assertFalse(backend.canExecute(huge).executable());
        assertThrows(UnsupportedCircuitException.class, () -> backend.execute(huge));
    }
}
