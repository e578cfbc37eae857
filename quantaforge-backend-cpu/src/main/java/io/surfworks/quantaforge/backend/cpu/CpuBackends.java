package io.surfworks.quantaforge.backend.cpu;

import io.surfworks.quantaforge.core.backend.BackendInfo;
import io.surfworks.quantaforge.core.backend.BackendRegistry;

/**
 * Registry wiring for the CPU backends.
 */
public final class CpuBackends {

    public static final BackendInfo STATEVECTOR = new BackendInfo(
        StatevectorBackend.NAME,
        "Full statevector simulation. Supports any circuit; memory scales as 2^n.",
        "O(2^n) memory, O(2^n) time per gate");

    public static final BackendInfo DENSITY_MATRIX = new BackendInfo(
        DensityMatrixBackend.NAME,
        "Density matrix simulation. Supports mixed states and noise; memory scales as 4^n.",
        "O(4^n) memory, O(4^n) time per gate");

    public static final BackendInfo STABILIZER = new BackendInfo(
        StabilizerBackend.NAME,
        "Clifford circuits only. Validates the gate set, then runs the statevector path.",
        "O(2^n) memory, O(2^n) time per gate (statevector delegate)");

    private CpuBackends() {}

    /**
     * A new registry holding the statevector, density matrix and stabilizer backends.
     */
    public static BackendRegistry registry() {
        return new BackendRegistry()
            .register(STATEVECTOR, StatevectorBackend::new)
            .register(DENSITY_MATRIX, DensityMatrixBackend::new)
            .register(STABILIZER, StabilizerBackend::new);
    }
}
