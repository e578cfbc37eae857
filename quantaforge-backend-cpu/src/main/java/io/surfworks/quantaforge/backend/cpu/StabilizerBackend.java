package io.surfworks.quantaforge.backend.cpu;

import io.surfworks.quantaforge.core.backend.Backend;
import io.surfworks.quantaforge.core.backend.BackendCapabilities;
import io.surfworks.quantaforge.core.backend.CapabilityCheck;
import io.surfworks.quantaforge.core.backend.ExecutionOptions;
import io.surfworks.quantaforge.core.backend.ExecutionResult;
import io.surfworks.quantaforge.core.circuit.Circuit;
import io.surfworks.quantaforge.core.error.NonCliffordGateException;
import io.surfworks.quantaforge.core.gate.Gate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Accepts Clifford circuits only and runs them on the statevector path.
 *
 * <p>This is a capability check in front of {@link StatevectorBackend}, not a
 * tableau simulator: cost is still {@code O(2^n)}. Results are relabelled with
 * this backend's name, a note, and the name of the backend that ran them.
 */
public class StabilizerBackend implements Backend {

    public static final String NAME = "stabilizer";

    static final String NOTE = "Clifford circuit executed by statevector simulation; no stabilizer tableau is used";

    private final StatevectorBackend delegate;
    private final BackendCapabilities capabilities;

    public StabilizerBackend() {
        this(new StatevectorBackend());
    }

    public StabilizerBackend(StatevectorBackend delegate) {
        this.delegate = delegate;
        BackendCapabilities base = delegate.capabilities();
        this.capabilities = BackendCapabilities.builder()
            .representation(base.representation())
            .supportsNoise(false)
            .cliffordOnly(true)
            .maxQubits(base.maxQubits())
            .memoryWarningBytes(base.memoryWarningBytes())
            .build();
    }

    @Override
    public String name() {
        return NAME;
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
        Optional<Gate> offending = CliffordGateSet.firstNonClifford(circuit);
        if (offending.isPresent()) {
            return CapabilityCheck.refused("Non-Clifford gate: " + offending.get().name());
        }
        return capabilities.checkSize(NAME, circuit.numQubits());
    }

    @Override
    public ExecutionResult execute(Circuit circuit, ExecutionOptions options) {
        requireClifford(circuit);
        ExecutionResult result = delegate.execute(circuit, options);
        Map<String, Object> metadata = new LinkedHashMap<>(result.metadata());
        metadata.put(ExecutionResult.KEY_BACKEND, NAME);
        metadata.put(ExecutionResult.KEY_NOTE, NOTE);
        metadata.put(ExecutionResult.KEY_EXECUTED_BY, delegate.name());
        return new ExecutionResult(
            result.state(),
            result.measurements(),
            result.history().orElse(null),
            metadata,
            result.warnings());
    }

    /**
     * @throws NonCliffordGateException naming the first gate outside the Clifford set
     */
    static void requireClifford(Circuit circuit) {
        Optional<Gate> offending = CliffordGateSet.firstNonClifford(circuit);
        if (offending.isPresent()) {
            throw new NonCliffordGateException(offending.get().name());
        }
    }

    @Override
    public String toString() {
        return "StabilizerBackend[" + NAME + " -> " + delegate.name() + "]";
    }
}
