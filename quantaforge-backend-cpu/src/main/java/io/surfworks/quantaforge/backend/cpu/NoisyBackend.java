package io.surfworks.quantaforge.backend.cpu;

import io.surfworks.quantaforge.core.backend.Backend;
import io.surfworks.quantaforge.core.backend.BackendCapabilities;
import io.surfworks.quantaforge.core.backend.CapabilityCheck;
import io.surfworks.quantaforge.core.backend.ExecutionResult;
import io.surfworks.quantaforge.core.backend.NoiseApplication;
import io.surfworks.quantaforge.core.backend.StateRepresentation;
import io.surfworks.quantaforge.core.circuit.Circuit;
import io.surfworks.quantaforge.core.circuit.GateOperation;
import io.surfworks.quantaforge.core.error.NonCliffordGateException;
import io.surfworks.quantaforge.core.error.SimulationException;
import io.surfworks.quantaforge.core.gate.Gate;
import io.surfworks.quantaforge.core.metrics.StateMetrics;
import io.surfworks.quantaforge.core.noise.NoiseChannel;
import io.surfworks.quantaforge.core.noise.NoiseModel;
import io.surfworks.quantaforge.core.state.QuantumState;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies a {@link NoiseModel} after every gate.
 *
 * <p>The state is always evolved as a density matrix, whatever the base
 * backend. The base backend decides which circuits are accepted: a circuit it
 * refuses is refused here too. After each gate, every qubit the gate touched
 * gets its channels in registration order, and each application is recorded as
 * a {@link NoiseApplication}. Crosstalk channels draw the qubits they spread to
 * from the execution's random source and record one application per qubit.
 */
public class NoisyBackend extends AbstractCpuBackend {

    public static final String NAME = "noisy";

    private static final Logger LOGGER = Logger.getLogger(NoisyBackend.class.getName());

    private final Backend base;
    private final NoiseModel noiseModel;

    public NoisyBackend() {
        this(new DensityMatrixBackend(), NoiseModel.empty());
    }

    public NoisyBackend(Backend base) {
        this(base, NoiseModel.empty());
    }

    public NoisyBackend(Backend base, NoiseModel noiseModel) {
        super(BackendCapabilities.builder()
            .representation(StateRepresentation.DENSITY_MATRIX)
            .supportsNoise(true)
            .cliffordOnly(base.capabilities().cliffordOnly())
            .build());
        this.base = Objects.requireNonNull(base, "base cannot be null");
        this.noiseModel = Objects.requireNonNull(noiseModel, "noiseModel cannot be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    public Backend baseBackend() {
        return base;
    }

    public NoiseModel noiseModel() {
        return noiseModel;
    }

    /**
     * Register {@code channel} on {@code qubit}, after any channels already there.
     *
     * @return this backend
     */
    public NoisyBackend addNoise(int qubit, NoiseChannel channel) {
        noiseModel.add(qubit, channel);
        return this;
    }

    @Override
    public CapabilityCheck canExecute(Circuit circuit) {
        CapabilityCheck baseCheck = base.canExecute(circuit);
        if (!baseCheck.executable()) {
            return baseCheck;
        }
        CapabilityCheck own = super.canExecute(circuit);
        return own.message().isPresent() ? own : baseCheck;
    }

    @Override
    protected SimulationException rejection(Circuit circuit, CapabilityCheck check) {
        if (capabilities().cliffordOnly()) {
            Optional<Gate> offending = CliffordGateSet.firstNonClifford(circuit);
            if (offending.isPresent()) {
                return new NonCliffordGateException(offending.get().name());
            }
        }
        return super.rejection(circuit, check);
    }

    @Override
    protected void afterGate(QuantumState state, int gateIndex, GateOperation op, ExecutionTrace trace,
                             Random rng) {
        trace.recordPreNoise(state);
        for (int qubit : op.qubits()) {
            for (NoiseChannel channel : noiseModel.channelsFor(qubit)) {
                // crosstalk: one application per qubit the noise reached
                NoiseChannel local = channel.baseChannel().orElse(channel);
                for (int target : channel.affectedQubits(qubit, rng)) {
                    QuantumState before = state.copy();
                    local.apply(state, target);
                    double fidelity = StateMetrics.fidelity(before, state);
                    trace.addNoiseApplication(new NoiseApplication(gateIndex, target, channel.name(), fidelity));
                    if (LOGGER.isLoggable(Level.FINE)) {
                        LOGGER.fine(String.format("Gate %d: %s on qubit %d, fidelity %.6f",
                            gateIndex, channel, target, fidelity));
                    }
                }
            }
        }
    }

    @Override
    protected void contributeMetadata(Map<String, Object> metadata, ExecutionTrace trace) {
        metadata.put(ExecutionResult.KEY_BASE_BACKEND, base.name());
        metadata.put(ExecutionResult.KEY_NOISE_APPLICATIONS, trace.noiseApplications());
        if (trace.recordHistory()) {
            metadata.put(ExecutionResult.KEY_IDEAL_STATE_HISTORY, trace.preNoiseHistory());
        }
    }

    @Override
    public String toString() {
        return "NoisyBackend[" + base.name() + ", " + noiseModel + "]";
    }
}
