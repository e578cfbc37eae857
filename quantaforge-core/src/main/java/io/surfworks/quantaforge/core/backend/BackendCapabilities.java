package io.surfworks.quantaforge.core.backend;

import io.surfworks.quantaforge.core.tensor.ComplexTensor;

/**
 * Describes the capabilities of a backend.
 *
 * @param representation        how the backend holds the state
 * @param supportsNoise         whether noise channels can be applied during execution
 * @param cliffordOnly          whether the backend only accepts Clifford gates
 * @param maxQubits             largest qubit count the backend can allocate
 * @param memoryWarningBytes    estimated state size above which a soft warning is raised
 */
public record BackendCapabilities(
    StateRepresentation representation,
    boolean supportsNoise,
    boolean cliffordOnly,
    int maxQubits,
    long memoryWarningBytes
) {
    /** 10 GiB. */
    public static final long DEFAULT_MEMORY_WARNING_BYTES = 10L * 1024 * 1024 * 1024;

    /** Bytes per complex128 entry. */
    public static final int BYTES_PER_AMPLITUDE = 16;

    /**
     * Default capabilities for a pure-state backend.
     */
    public static BackendCapabilities statevector() {
        return builder().build();
    }

    /**
     * Default capabilities for a mixed-state backend.
     */
    public static BackendCapabilities densityMatrix() {
        return builder()
            .representation(StateRepresentation.DENSITY_MATRIX)
            .supportsNoise(true)
            .build();
    }

    /**
     * Estimated bytes to hold the state: {@code 2^n * 16} for a statevector,
     * {@code 4^n * 16} for a density matrix. Saturates at {@link Long#MAX_VALUE}.
     */
    public long estimateMemoryBytes(int numQubits) {
        int bits = representation.rankFor(numQubits);
        if (bits >= Long.SIZE - 5) {
            return Long.MAX_VALUE;
        }
        return (long) BYTES_PER_AMPLITUDE << bits;
    }

    /**
     * Pre-flight check of qubit count and memory estimate.
     *
     * <p>A qubit count above {@link #maxQubits()} is refused. An estimate above
     * {@link #memoryWarningBytes()} yields an executable result with a warning.
     */
    public CapabilityCheck checkSize(String backendName, int numQubits) {
        long bytes = estimateMemoryBytes(numQubits);
        if (numQubits > maxQubits) {
            return CapabilityCheck.refused(String.format(
                "%s supports at most %d qubits, circuit has %d (estimated memory %s)",
                backendName, maxQubits, numQubits, formatBytes(bytes)));
        }
        if (bytes > memoryWarningBytes) {
            return CapabilityCheck.warning(String.format(
                "Estimated memory %s for %d qubits on %s exceeds %s",
                formatBytes(bytes), numQubits, backendName, formatBytes(memoryWarningBytes)));
        }
        return CapabilityCheck.ok();
    }

    static String formatBytes(long bytes) {
        if (bytes == Long.MAX_VALUE) {
            return "more than 8 EiB";
        }
        double gib = bytes / (1024.0 * 1024.0 * 1024.0);
        if (gib >= 1.0) {
            return String.format("%.2f GiB", gib);
        }
        return String.format("%.2f MiB", bytes / (1024.0 * 1024.0));
    }

    /**
     * Builder for custom capabilities.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private StateRepresentation representation = StateRepresentation.STATEVECTOR;
        private boolean supportsNoise = false;
        private boolean cliffordOnly = false;
        private Integer maxQubits;
        private long memoryWarningBytes = DEFAULT_MEMORY_WARNING_BYTES;

        public Builder representation(StateRepresentation representation) {
            this.representation = representation;
            return this;
        }

        public Builder supportsNoise(boolean supports) {
            this.supportsNoise = supports;
            return this;
        }

        public Builder cliffordOnly(boolean cliffordOnly) {
            this.cliffordOnly = cliffordOnly;
            return this;
        }

        public Builder maxQubits(int maxQubits) {
            this.maxQubits = maxQubits;
            return this;
        }

        public Builder memoryWarningBytes(long bytes) {
            this.memoryWarningBytes = bytes;
            return this;
        }

        /**
         * Builds the capabilities. Without an explicit limit, {@code maxQubits}
         * is the largest count {@link ComplexTensor} can allocate: 30 for a
         * statevector, 15 for a density matrix (16 GiB each, above the default
         * warning threshold).
         */
        public BackendCapabilities build() {
            int limit = maxQubits != null
                ? maxQubits
                : (representation == StateRepresentation.STATEVECTOR
                    ? ComplexTensor.MAX_RANK
                    : ComplexTensor.MAX_RANK / 2);
            return new BackendCapabilities(representation, supportsNoise, cliffordOnly, limit, memoryWarningBytes);
        }
    }
}
