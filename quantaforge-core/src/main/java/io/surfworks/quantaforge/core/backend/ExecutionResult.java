package io.surfworks.quantaforge.core.backend;

import io.surfworks.quantaforge.core.state.QuantumState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Result of executing a circuit on a backend.
 *
 * <p>Holds the final state, one map of classical bit to outcome per shot, the
 * state history when it was recorded, backend metadata and soft warnings.
 * All collections are read-only.
 */
public final class ExecutionResult {

    public static final String KEY_BACKEND = "backend";
    public static final String KEY_NUM_QUBITS = "numQubits";
    public static final String KEY_NUM_GATES = "numGates";
    public static final String KEY_CIRCUIT_DEPTH = "circuitDepth";
    public static final String KEY_SHOTS = "shots";
    public static final String KEY_SHOT_MODE = "shotMode";
    public static final String KEY_BASE_BACKEND = "baseBackend";
    public static final String KEY_NOISE_APPLICATIONS = "noiseApplications";
    public static final String KEY_IDEAL_STATE_HISTORY = "idealStateHistory";
    public static final String KEY_NOTE = "note";
    public static final String KEY_EXECUTED_BY = "executedBy";

    private final QuantumState state;
    private final List<SortedMap<Integer, Integer>> measurements;
    private final List<QuantumState> history;
    private final Map<String, Object> metadata;
    private final List<String> warnings;

    public ExecutionResult(QuantumState state,
                           List<? extends Map<Integer, Integer>> measurements,
                           List<QuantumState> history,
                           Map<String, Object> metadata,
                           List<String> warnings) {
        this.state = Objects.requireNonNull(state, "state cannot be null");
        this.measurements = measurements.stream()
            .map(m -> Collections.unmodifiableSortedMap(new TreeMap<>(m)))
            .collect(Collectors.toUnmodifiableList());
        this.history = history == null ? null : List.copyOf(history);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.warnings = List.copyOf(warnings);
    }

    /**
     * The final state, returned by reference.
     */
    public QuantumState state() {
        return state;
    }

    /**
     * One map per shot, classical bit to outcome (0 or 1).
     */
    public List<SortedMap<Integer, Integer>> measurements() {
        return measurements;
    }

    /**
     * States after initialisation and after each gate, if history was recorded.
     */
    public Optional<List<QuantumState>> history() {
        return Optional.ofNullable(history);
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public List<String> warnings() {
        return warnings;
    }

    /**
     * Name of the backend that produced this result.
     */
    public String backendName() {
        return String.valueOf(metadata.get(KEY_BACKEND));
    }

    /**
     * The noise trace of a noisy execution; empty otherwise.
     */
    @SuppressWarnings("unchecked")
    public List<NoiseApplication> noiseApplications() {
        Object trace = metadata.get(KEY_NOISE_APPLICATIONS);
        return trace == null ? List.of() : (List<NoiseApplication>) trace;
    }

    /**
     * Histogram of shot outcomes. Each key concatenates a shot's outcomes in
     * ascending classical-bit order; shots without measurements count under "".
     */
    public SortedMap<String, Integer> counts() {
        SortedMap<String, Integer> counts = new TreeMap<>();
        for (SortedMap<Integer, Integer> shot : measurements) {
            StringBuilder key = new StringBuilder(shot.size());
            for (int outcome : shot.values()) {
                key.append(outcome);
            }
            counts.merge(key.toString(), 1, Integer::sum);
        }
        return Collections.unmodifiableSortedMap(counts);
    }

    /**
     * Basis-state probabilities of the final state, indexed by basis index.
     */
    public double[] probabilities() {
        return state.probabilities();
    }

    @Override
    public String toString() {
        return "ExecutionResult[backend=" + backendName() + ", shots=" + measurements.size()
            + ", warnings=" + warnings.size() + "]";
    }
}
