package io.surfworks.quantaforge.core.error;

/**
 * Thrown when the qubit list handed to a gate does not match its declared arity.
 */
public class GateArityException extends SimulationException {

    private final String gateName;
    private final int expected;
    private final int actual;

    public GateArityException(String gateName, int expected, int actual) {
        super(String.format("Gate %s requires %d qubit(s), got %d", gateName, expected, actual));
        this.gateName = gateName;
        this.expected = expected;
        this.actual = actual;
    }

    public String gateName() {
        return gateName;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
