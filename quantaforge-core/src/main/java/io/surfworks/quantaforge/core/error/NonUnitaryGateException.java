package io.surfworks.quantaforge.core.error;

/**
 * Thrown when a custom gate matrix fails the {@code U U† = I} check at construction.
 */
public class NonUnitaryGateException extends SimulationException {

    private final String gateName;
    private final double deviation;

    /**
     * @param gateName  name of the rejected gate
     * @param deviation largest absolute entry of {@code U U† - I}, or {@code NaN}
     *                  when the matrix shape itself is invalid
     */
    public NonUnitaryGateException(String gateName, double deviation) {
        super(Double.isNaN(deviation)
            ? String.format("Gate %s matrix is not a square power-of-two matrix", gateName)
            : String.format("Gate %s matrix is not unitary (max |UU† - I| = %.3e)", gateName, deviation));
        this.gateName = gateName;
        this.deviation = deviation;
    }

    public String gateName() {
        return gateName;
    }

    public double deviation() {
        return deviation;
    }
}
