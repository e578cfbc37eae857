package io.surfworks.quantaforge.core.error;

/**
 * Thrown when a Clifford-restricted backend is asked to run a non-Clifford gate.
 */
public class NonCliffordGateException extends SimulationException {

    private final String gateName;

    public NonCliffordGateException(String gateName) {
        super(String.format("Non-Clifford gate '%s' detected. Stabilizer backend only supports Clifford gates.",
            gateName));
        this.gateName = gateName;
    }

    public String gateName() {
        return gateName;
    }
}
