package io.surfworks.quantaforge.backend.cpu;

import io.surfworks.quantaforge.core.backend.CapabilityCheck;
import io.surfworks.quantaforge.core.backend.ExecutionOptions;
import io.surfworks.quantaforge.core.backend.ExecutionResult;
import io.surfworks.quantaforge.core.backend.ShotMode;
import io.surfworks.quantaforge.core.circuit.Circuit;
import io.surfworks.quantaforge.core.error.UnsupportedCircuitException;
import io.surfworks.quantaforge.core.state.QuantumState;
import io.surfworks.quantaforge.core.tensor.ComplexMatrix;
import io.surfworks.quantaforge.core.testing.StateAssert;
import io.surfworks.quantaforge.core.testing.ToleranceConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DensityMatrixBackendTest {

    private static final ToleranceConfig TOL = ToleranceConfig.forCheck("trace");

    private DensityMatrixBackend backend;

    @BeforeEach
    void setUp() {
        backend = new DensityMatrixBackend();
    }

    @Test
    void backendProperties() {
        assertEquals("density_matrix", backend.name());
        assertTrue(backend.capabilities().supportsNoise());
        assertEquals(15, backend.capabilities().maxQubits());
    }

    @Nested
    @DisplayName("Evolution")
    class Evolution {

        @Test
        void bellStateDensityMatrix() {
            ExecutionResult result = backend.execute(Circuit.builder(2).h(0).cnot(0, 1).build());
            ComplexMatrix rho = backend.densityMatrix(result);
            assertTrue(result.state().isDensityMatrix());
            assertEquals(0.5, rho.real(0, 0), 1e-12);
            assertEquals(0.5, rho.real(0, 3), 1e-12);
            assertEquals(0.5, rho.real(3, 3), 1e-12);
            StateAssert.assertPhysical(result.state(), TOL);
        }

        @Test
        void agreesWithStatevectorOnThreeQubitCircuit() {
            Circuit circuit = Circuit.builder(3)
                .h(0).ry(1, 0.6).t(1).toffoli(0, 1, 2).rz(2, 1.1).swap(0, 2).cz(1, 0)
                .build();
            QuantumState pure = new StatevectorBackend().execute(circuit).state();
            QuantumState mixed = backend.execute(circuit).state();
            StateAssert.assertMatrixEquals(pure.densityMatrix(), mixed.densityMatrix(), ToleranceConfig.forCheck("amplitude"));
        }

        @Test
        void pureInitialStateIsConverted() {
            QuantumState one = QuantumState.fromRealAmplitudes(1, 0, 1);
            ExecutionResult result = backend.execute(Circuit.builder(1).x(0).build(),
                ExecutionOptions.builder().initialState(one).build());
            assertTrue(result.state().isDensityMatrix());
            assertEquals(1.0, result.probabilities()[0], 1e-12);
        }

        @Test
        void mixedInitialStateEvolves() {
            QuantumState mixed = QuantumState.fromDensityMatrix(1,
                ComplexMatrix.ofReal(new double[][] {{0.75, 0}, {0, 0.25}}));
            ExecutionResult result = backend.execute(Circuit.builder(1).x(0).build(),
                ExecutionOptions.builder().initialState(mixed).build());
            assertArrayEquals(new double[] {0.25, 0.75}, result.probabilities(), 1e-12);
            // caller's state is untouched
            assertEquals(0.75, mixed.probabilities()[0], 1e-12);
        }
    }

    @Nested
    @DisplayName("Analysis helpers")
    class Analysis {

        @Test
        void partialTraceOfBellState() {
            ExecutionResult result = backend.execute(Circuit.builder(2).h(0).cnot(0, 1).build());
            StateAssert.assertMatrixEquals(ComplexMatrix.identity(2).scale(0.5), backend.partialTrace(result, 0), TOL);
        }

        @Test
        void purityAndEntropy() {
            ExecutionResult result = backend.execute(Circuit.builder(2).h(0).cnot(0, 1).build());
            assertEquals(1.0, backend.purity(result), 1e-9);
            assertEquals(0.5, backend.purity(result, 1), 1e-9);
            assertEquals(0.0, backend.vonNeumannEntropy(result), 1e-7);
            assertEquals(1.0, backend.vonNeumannEntropy(result, 0), 1e-7);
        }
    }

    @Nested
    @DisplayName("Measurement")
    class Measurement {

        @Test
        void collapsedStateIsReused() {
            Circuit coin = Circuit.builder(1, 1).h(0).measure(0, 0).build();
            ExecutionResult result = backend.execute(coin, ExecutionOptions.builder().shots(30).seed(9).build());
            assertEquals(1, result.counts().size());
            StateAssert.assertPhysical(result.state(), TOL);
        }

        @Test
        void independentShots() {
            Circuit coin = Circuit.builder(1, 1).h(0).measure(0, 0).build();
            ExecutionResult result = backend.execute(coin, ExecutionOptions.builder()
                .shots(60).seed(9).shotMode(ShotMode.INDEPENDENT).build());
            assertEquals(List.of("0", "1"), List.copyOf(result.counts().keySet()));
        }
    }

    @Test
    void refusesMoreThanFifteenQubits() {
        Circuit circuit = Circuit.builder(16).h(0).build();
        assertFalse(backend.canExecute(circuit).executable());
        assertThrows(UnsupportedCircuitException.class, () -> backend.execute(circuit));
    }

    @Test
    void defaultCapabilitiesWarnAboveTenGibibytes() {
        CapabilityCheck atLimit = backend.canExecute(Circuit.builder(15).h(0).build());
        assertTrue(atLimit.executable());
        assertTrue(atLimit.hasWarning());
        assertFalse(backend.canExecute(Circuit.builder(14).h(0).build()).hasWarning());
    }
}
