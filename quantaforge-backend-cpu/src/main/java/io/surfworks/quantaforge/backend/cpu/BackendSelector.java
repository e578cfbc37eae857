package io.surfworks.quantaforge.backend.cpu;

import io.surfworks.quantaforge.core.backend.Backend;
import io.surfworks.quantaforge.core.backend.BackendCapabilities;
import io.surfworks.quantaforge.core.backend.BackendInfo;
import io.surfworks.quantaforge.core.backend.BackendRegistry;
import io.surfworks.quantaforge.core.circuit.Circuit;
import io.surfworks.quantaforge.core.error.UnknownBackendException;
import io.surfworks.quantaforge.core.noise.NoiseModel;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Chooses a backend for a circuit.
 *
 * <p>Priority: an explicitly requested backend (which must be registered); else
 * the stabilizer backend for an all-Clifford circuit; else the statevector
 * backend, whatever the circuit size. When noise is requested the choice is
 * wrapped in a {@link NoisyBackend}, even if the model has no channels.
 */
public final class BackendSelector {

    private static final Logger LOGGER = Logger.getLogger(BackendSelector.class.getName());

    private final BackendRegistry registry;

    /**
     * A chosen backend and a human-readable reason.
     */
    public record Selection(Backend backend, String explanation) {
    }

    public BackendSelector() {
        this(CpuBackends.registry());
    }

    public BackendSelector(BackendRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    }

    public Selection select(Circuit circuit) {
        return select(circuit, null, null, false);
    }

    public Selection select(Circuit circuit, String preferredBackend) {
        return select(circuit, preferredBackend, null, false);
    }

    /**
     * Select a backend, wrapping it with {@code noiseModel} whenever a model is given.
     */
    public Selection select(Circuit circuit, String preferredBackend, NoiseModel noiseModel) {
        return select(circuit, preferredBackend, noiseModel, noiseModel != null);
    }

    /**
     * Select a backend.
     *
     * @param circuit          circuit to run
     * @param preferredBackend requested backend name, or {@code null} to choose automatically
     * @param noiseModel       noise to apply; {@code null} means an empty model
     * @param useNoise         wrap the choice in a {@link NoisyBackend}
     * @throws UnknownBackendException if {@code preferredBackend} is not registered
     */
    public Selection select(Circuit circuit, String preferredBackend, NoiseModel noiseModel, boolean useNoise) {
        Objects.requireNonNull(circuit, "circuit cannot be null");
        Backend backend;
        String explanation;
        if (preferredBackend != null) {
            backend = registry.get(preferredBackend);
            explanation = "Using user-specified backend: " + backend.name();
        } else if (CliffordGateSet.isCliffordCircuit(circuit)) {
            backend = registry.get(StabilizerBackend.NAME);
            explanation = "Circuit is Clifford, using the stabilizer backend";
        } else {
            backend = registry.get(StatevectorBackend.NAME);
            long bytes = backend.capabilities().estimateMemoryBytes(circuit.numQubits());
            explanation = String.format("Using the statevector backend (circuit requires ~%.2f GiB)",
                bytes / (1024.0 * 1024.0 * 1024.0));
        }
        if (useNoise) {
            backend = new NoisyBackend(backend, noiseModel == null ? NoiseModel.empty() : noiseModel.copy());
            explanation += " with noise model";
        }
        LOGGER.info("Selected " + backend.name() + " for " + circuit + ": " + explanation);
        return new Selection(backend, explanation);
    }

    /**
     * Static description of a registered backend.
     *
     * @throws UnknownBackendException if the name is not registered
     */
    public BackendInfo backendInfo(String name) {
        return registry.info(name);
    }

    /**
     * Capabilities of a registered backend.
     */
    public BackendCapabilities capabilities(String name) {
        return registry.get(name).capabilities();
    }

    public List<String> availableBackends() {
        return registry.available();
    }
}
