package io.surfworks.quantaforge.backend.cpu;

import io.surfworks.quantaforge.core.backend.NoiseApplication;
import io.surfworks.quantaforge.core.state.QuantumState;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-execution record of what happened between gates.
 */
public final class ExecutionTrace {

    private final boolean recordHistory;
    private final List<NoiseApplication> noiseApplications = new ArrayList<>();
    private final List<QuantumState> preNoiseHistory = new ArrayList<>();

    ExecutionTrace(boolean recordHistory) {
        this.recordHistory = recordHistory;
    }

    public boolean recordHistory() {
        return recordHistory;
    }

    public void addNoiseApplication(NoiseApplication application) {
        noiseApplications.add(application);
    }

    /**
     * Snapshot the state after a gate and before its noise, if history is recorded.
     */
    public void recordPreNoise(QuantumState state) {
        if (recordHistory) {
            preNoiseHistory.add(state.copy());
        }
    }

    public List<NoiseApplication> noiseApplications() {
        return List.copyOf(noiseApplications);
    }

    public List<QuantumState> preNoiseHistory() {
        return List.copyOf(preNoiseHistory);
    }
}
