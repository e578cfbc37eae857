package io.surfworks.quantaforge.core.error;

/**
 * Thrown when a supplied state does not match the expected Hilbert-space dimension.
 */
public class DimensionMismatchException extends SimulationException {

    private final long expected;
    private final long actual;

    public DimensionMismatchException(String what, long expected, long actual) {
        super(String.format("%s: expected %d, got %d", what, expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public long expected() {
        return expected;
    }

    public long actual() {
        return actual;
    }
}
