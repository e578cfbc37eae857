package io.surfworks.quantaforge.backend.cpu;

import io.surfworks.quantaforge.core.backend.Backend;
import io.surfworks.quantaforge.core.backend.BackendCapabilities;
import io.surfworks.quantaforge.core.backend.CapabilityCheck;
import io.surfworks.quantaforge.core.backend.ExecutionOptions;
import io.surfworks.quantaforge.core.backend.ExecutionResult;
import io.surfworks.quantaforge.core.backend.ShotMode;
import io.surfworks.quantaforge.core.backend.StateRepresentation;
import io.surfworks.quantaforge.core.circuit.Circuit;
import io.surfworks.quantaforge.core.circuit.GateOperation;
import io.surfworks.quantaforge.core.circuit.Measurement;
import io.surfworks.quantaforge.core.error.DimensionMismatchException;
import io.surfworks.quantaforge.core.error.SimulationException;
import io.surfworks.quantaforge.core.error.UnsupportedCircuitException;
import io.surfworks.quantaforge.core.gate.GateKernel;
import io.surfworks.quantaforge.core.jfr.CircuitExecutionEvent;
import io.surfworks.quantaforge.core.state.QuantumState;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Shared execution loop of the CPU backends.
 *
 * <p>One call to {@link #execute} owns its state from start to finish:
 * <ol>
 *   <li>initialise from the caller's state or |0…0⟩, converted to this backend's representation</li>
 *   <li>apply each gate in place, then run {@link #afterGate} (noise, for the noisy backend)</li>
 *   <li>measure the requested qubits once per shot</li>
 *   <li>package state, outcomes, history, metadata and warnings</li>
 * </ol>
 * A {@link CircuitExecutionEvent} is committed for every completed execution.
 */
public abstract class AbstractCpuBackend implements Backend {

    private static final Logger LOGGER = Logger.getLogger(AbstractCpuBackend.class.getName());

    private final BackendCapabilities capabilities;

    protected AbstractCpuBackend(BackendCapabilities capabilities) {
        this.capabilities = capabilities;
    }

    @Override
    public BackendCapabilities capabilities() {
        return capabilities;
    }

    @Override
    public CapabilityCheck canExecute(Circuit circuit) {
        if (circuit == null) {
            return CapabilityCheck.refused("No circuit given");
        }
        return capabilities.checkSize(name(), circuit.numQubits());
    }

    @Override
    public final ExecutionResult execute(Circuit circuit, ExecutionOptions options) {
        Objects.requireNonNull(circuit, "circuit cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
        CircuitExecutionEvent event = new CircuitExecutionEvent();
        event.begin();

        CapabilityCheck check = canExecute(circuit);
        if (!check.executable()) {
            throw rejection(circuit, check);
        }
        List<String> warnings = new ArrayList<>();
        check.message().ifPresent(warning -> {
            LOGGER.warning(warning);
            warnings.add(warning);
        });
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Executing " + circuit + " on " + name() + " with " + options);
        }

        Random rng = options.newRandom();
        QuantumState state = prepareInitialState(circuit, options);
        ExecutionTrace trace = new ExecutionTrace(options.recordHistory());
        List<QuantumState> history = options.recordHistory() ? new ArrayList<>() : null;
        if (history != null) {
            history.add(state.copy());
        }

        List<GateOperation> gates = circuit.gates();
        for (int i = 0; i < gates.size(); i++) {
            GateOperation op = gates.get(i);
            GateKernel.apply(state, op.gate(), op.qubits());
            afterGate(state, i, op, trace, rng);
            if (history != null) {
                history.add(state.copy());
            }
        }

        List<SortedMap<Integer, Integer>> measurements = new ArrayList<>(options.shots());
        QuantumState postGates = options.shotMode() == ShotMode.INDEPENDENT ? state.copy() : null;
        for (int shot = 0; shot < options.shots(); shot++) {
            if (shot > 0) {
                state = postGates != null ? postGates.copy() : state.copy();
            }
            SortedMap<Integer, Integer> outcomes = new TreeMap<>();
            for (Measurement m : circuit.measurements()) {
                int outcome = state.measure(m.qubit(), rng);
                state.writeClassicalBit(m.classicalBit(), outcome);
                outcomes.put(m.classicalBit(), outcome);
            }
            measurements.add(outcomes);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ExecutionResult.KEY_BACKEND, name());
        metadata.put(ExecutionResult.KEY_NUM_QUBITS, circuit.numQubits());
        metadata.put(ExecutionResult.KEY_NUM_GATES, gates.size());
        metadata.put(ExecutionResult.KEY_CIRCUIT_DEPTH, circuit.depth());
        metadata.put(ExecutionResult.KEY_SHOTS, options.shots());
        metadata.put(ExecutionResult.KEY_SHOT_MODE, options.shotMode().name());
        contributeMetadata(metadata, trace);

        event.backend = name();
        event.numQubits = circuit.numQubits();
        event.numGates = gates.size();
        event.depth = circuit.depth();
        event.shots = options.shots();
        event.shotMode = options.shotMode().name();
        event.noiseApplications = trace.noiseApplications().size();
        event.stateBytes = capabilities.estimateMemoryBytes(circuit.numQubits());
        event.commit();

        return new ExecutionResult(state, measurements, history, metadata, warnings);
    }

    /**
     * The state execution starts from: a copy of the caller's state converted
     * to this backend's representation, or |0…0⟩.
     *
     * @throws DimensionMismatchException if the caller's state has a different qubit count
     */
    protected QuantumState prepareInitialState(Circuit circuit, ExecutionOptions options) {
        int n = circuit.numQubits();
        boolean mixed = capabilities.representation() == StateRepresentation.DENSITY_MATRIX;
        if (options.initialState().isEmpty()) {
            return mixed ? QuantumState.zeroDensity(n) : QuantumState.zero(n);
        }
        QuantumState initial = options.initialState().get();
        if (initial.numQubits() != n) {
            throw new DimensionMismatchException("Initial state qubit count", n, initial.numQubits());
        }
        QuantumState converted = mixed ? initial.toDensityMatrix() : initial.toStatevector();
        return converted == initial ? initial.copy() : converted;
    }

    /**
     * Called after each gate has been applied. {@code rng} is the execution's
     * random source. The default does nothing.
     */
    protected void afterGate(QuantumState state, int gateIndex, GateOperation op, ExecutionTrace trace,
                             Random rng) {
    }

    /**
     * Add backend-specific metadata. The default adds nothing.
     */
    protected void contributeMetadata(Map<String, Object> metadata, ExecutionTrace trace) {
    }

    /**
     * The exception thrown when {@link #canExecute} refuses a circuit.
     */
    protected SimulationException rejection(Circuit circuit, CapabilityCheck check) {
        return new UnsupportedCircuitException(name(), check.message().orElse(circuit.toString()));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name() + "]";
    }
}
