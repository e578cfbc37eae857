package io.surfworks.quantaforge.core.error;

/**
 * Base class for every error raised by the simulation engine.
 *
 * <p>All engine errors are unchecked. Construction-time violations (non-unitary
 * gates, incomplete Kraus sets, out-of-range channel parameters) fail fast;
 * execution-time capability mismatches are surfaced to the caller unchanged.
 * Nothing in the engine retries: given fixed inputs and a fixed seed every
 * operation is deterministic.
 */
public class SimulationException extends RuntimeException {

    public SimulationException(String message) {
        super(message);
    }

    public SimulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
