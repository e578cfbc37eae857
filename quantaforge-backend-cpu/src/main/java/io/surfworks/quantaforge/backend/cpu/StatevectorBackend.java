package io.surfworks.quantaforge.backend.cpu;

import io.surfworks.quantaforge.core.backend.BackendCapabilities;

/**
 * Pure-state simulation of the full {@code 2^n} amplitude vector.
 */
public class StatevectorBackend extends AbstractCpuBackend {

    public static final String NAME = "statevector";

    public StatevectorBackend() {
        this(BackendCapabilities.statevector());
    }

    public StatevectorBackend(BackendCapabilities capabilities) {
        super(capabilities);
    }

    @Override
    public String name() {
        return NAME;
    }
}
