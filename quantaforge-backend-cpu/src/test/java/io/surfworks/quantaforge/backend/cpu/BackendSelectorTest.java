package io.surfworks.quantaforge.backend.cpu;

import io.surfworks.quantaforge.core.backend.BackendInfo;
import io.surfworks.quantaforge.core.backend.BackendRegistry;
import io.surfworks.quantaforge.core.circuit.Circuit;
import io.surfworks.quantaforge.core.error.UnknownBackendException;
import io.surfworks.quantaforge.core.noise.NoiseChannel;
import io.surfworks.quantaforge.core.noise.NoiseModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BackendSelectorTest {

    private BackendSelector selector;

    @BeforeEach
    void setUp() {
        selector = new BackendSelector();
    }

    @Nested
    @DisplayName("Automatic selection")
    class Automatic {

        @Test
        void cliffordCircuitGoesToStabilizer() {
            BackendSelector.Selection selection = selector.select(Circuit.builder(2).h(0).cnot(0, 1).build());
            assertInstanceOf(StabilizerBackend.class, selection.backend());
            assertEquals("Circuit is Clifford, using the stabilizer backend", selection.explanation());
        }

        @Test
        void nonCliffordCircuitGoesToStatevector() {
            BackendSelector.Selection selection = selector.select(Circuit.builder(2).h(0).t(1).build());
            assertInstanceOf(StatevectorBackend.class, selection.backend());
            assertTrue(selection.explanation().startsWith("Using the statevector backend (circuit requires ~"));
        }

        @Test
        void largeNonCliffordCircuitStillGetsStatevector() {
            BackendSelector.Selection selection = selector.select(Circuit.builder(40).t(0).build());
            assertEquals("statevector", selection.backend().name());
            assertFalse(selection.backend().canExecute(Circuit.builder(40).t(0).build()).executable());
        }

        @Test
        void emptyCircuitIsClifford() {
            assertEquals("stabilizer", selector.select(Circuit.builder(1).build()).backend().name());
        }
    }

    @Nested
    @DisplayName("Explicit selection")
    class Explicit {

        @Test
        void requestedBackendWins() {
            BackendSelector.Selection selection = selector.select(Circuit.builder(2).h(0).build(), "density_matrix");
            assertInstanceOf(DensityMatrixBackend.class, selection.backend());
            assertEquals("Using user-specified backend: density_matrix", selection.explanation());
        }

        @Test
        void nameIsCaseInsensitive() {
            assertEquals("statevector", selector.select(Circuit.builder(1).h(0).build(), "StateVector").backend().name());
        }

        @Test
        void unknownNameIsRejected() {
            UnknownBackendException e = assertThrows(UnknownBackendException.class,
                () -> selector.select(Circuit.builder(1).h(0).build(), "tensor_network"));
            assertEquals("tensor_network", e.name());
            assertEquals(List.of("density_matrix", "stabilizer", "statevector"), e.available());
        }
    }

    @Nested
    @DisplayName("Noise")
    class Noise {

        @Test
        void nonEmptyNoiseModelWrapsChoice() {
            NoiseModel model = NoiseModel.empty().add(0, NoiseChannel.bitFlip(0.1));
            BackendSelector.Selection selection = selector.select(Circuit.builder(2).h(0).t(1).build(), null, model);

            NoisyBackend noisy = assertInstanceOf(NoisyBackend.class, selection.backend());
            assertEquals("statevector", noisy.baseBackend().name());
            assertTrue(selection.explanation().endsWith(" with noise model"));
        }

        @Test
        void selectionCopiesTheModel() {
            NoiseModel model = NoiseModel.empty().add(0, NoiseChannel.bitFlip(0.1));
            NoisyBackend noisy = (NoisyBackend) selector.select(Circuit.builder(1).h(0).build(), null, model).backend();
            model.add(0, NoiseChannel.phaseFlip(0.1));
            assertEquals(1, noisy.noiseModel().channelsFor(0).size());
        }

        @Test
        void emptyNoiseModelStillWraps() {
            BackendSelector.Selection selection = selector.select(Circuit.builder(1).h(0).build(), null, NoiseModel.empty());
            NoisyBackend noisy = assertInstanceOf(NoisyBackend.class, selection.backend());
            assertEquals("stabilizer", noisy.baseBackend().name());
            assertTrue(noisy.noiseModel().isEmpty());
            assertTrue(selection.explanation().endsWith(" with noise model"));
        }

        @Test
        void useNoiseFlagControlsWrapping() {
            Circuit circuit = Circuit.builder(2).h(0).t(1).build();
            NoiseModel model = NoiseModel.empty().add(0, NoiseChannel.bitFlip(0.1));

            assertInstanceOf(StatevectorBackend.class, selector.select(circuit, null, model, false).backend());
            NoisyBackend noisy = assertInstanceOf(NoisyBackend.class,
                selector.select(circuit, "density_matrix", null, true).backend());
            assertEquals("density_matrix", noisy.baseBackend().name());
            assertTrue(noisy.noiseModel().isEmpty());
        }

        @Test
        void noModelMeansNoWrapping() {
            BackendSelector.Selection selection = selector.select(Circuit.builder(2).h(0).t(1).build(), null, null);
            assertInstanceOf(StatevectorBackend.class, selection.backend());
            assertFalse(selection.explanation().contains("noise"));
        }
    }

    @Nested
    @DisplayName("Registry")
    class Registry {

        @Test
        void describesBackends() {
            assertEquals(List.of("density_matrix", "stabilizer", "statevector"), selector.availableBackends());
            BackendInfo info = selector.backendInfo("density_matrix");
            assertEquals(CpuBackends.DENSITY_MATRIX, info);
            assertTrue(selector.capabilities("stabilizer").cliffordOnly());
        }

        @Test
        void customRegistry() {
            BackendRegistry registry = new BackendRegistry()
                .register(CpuBackends.STATEVECTOR, StatevectorBackend::new);
            BackendSelector custom = new BackendSelector(registry);
            assertEquals(List.of("statevector"), custom.availableBackends());
            // Clifford circuits need the stabilizer backend to be registered
            assertThrows(UnknownBackendException.class, () -> custom.select(Circuit.builder(1).h(0).build()));
        }
    }
}
