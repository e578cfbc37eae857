package io.surfworks.quantaforge.core.testing;

import java.util.Locale;
import java.util.Map;

/**
 * Configuration for numerical tolerance in state comparisons.
 * Provides per-check tolerance settings.
 *
 * <p>Tolerance is computed using the standard formula:
 * {@code |expected - actual| <= atol + rtol * |expected|}
 *
 * @param atol Absolute tolerance
 * @param rtol Relative tolerance
 */
public record ToleranceConfig(double atol, double rtol) {

    /**
     * Default tolerances by check.
     */
    private static final Map<String, ToleranceConfig> CHECK_DEFAULTS = Map.ofEntries(
        // Invariants kept by every gate and channel
        Map.entry("norm", new ToleranceConfig(1e-9, 0)),
        Map.entry("trace", new ToleranceConfig(1e-9, 0)),
        Map.entry("hermitian", new ToleranceConfig(1e-9, 0)),
        Map.entry("amplitude", new ToleranceConfig(1e-9, 0)),
        Map.entry("probability", new ToleranceConfig(1e-9, 0)),

        // Construction-time validation
        Map.entry("unitarity", new ToleranceConfig(1e-8, 0)),
        Map.entry("completeness", new ToleranceConfig(1e-8, 0)),

        // Derived through an eigen-decomposition
        Map.entry("purity", new ToleranceConfig(1e-6, 0)),
        Map.entry("fidelity", new ToleranceConfig(1e-7, 0)),
        Map.entry("entropy", new ToleranceConfig(1e-7, 0))
    );

    /**
     * Strict tolerance (exact match).
     */
    public static final ToleranceConfig STRICT = new ToleranceConfig(0, 0);

    /**
     * Loose tolerance for sampled statistics.
     */
    public static final ToleranceConfig LOOSE = new ToleranceConfig(1e-2, 1e-2);

    /**
     * Get tolerance for a named check.
     *
     * @param check Check name (e.g., "norm", "fidelity")
     * @return Tolerance configuration for the check
     */
    public static ToleranceConfig forCheck(String check) {
        return CHECK_DEFAULTS.getOrDefault(check.toLowerCase(Locale.ROOT), new ToleranceConfig(1e-9, 0));
    }

    /**
     * Check if two values are close within tolerance.
     *
     * @param expected Expected value
     * @param actual   Actual value
     * @return true if values are within tolerance
     */
    public boolean isClose(double expected, double actual) {
        if (Double.isNaN(expected) && Double.isNaN(actual)) {
            return true;
        }
        if (Double.isNaN(expected) || Double.isNaN(actual)) {
            return false;
        }
        if (Double.isInfinite(expected) || Double.isInfinite(actual)) {
            return expected == actual;
        }
        return Math.abs(expected - actual) <= bound(expected);
    }

    /**
     * Largest allowed deviation from {@code expected}.
     */
    public double bound(double expected) {
        return atol + rtol * Math.abs(expected);
    }
}
