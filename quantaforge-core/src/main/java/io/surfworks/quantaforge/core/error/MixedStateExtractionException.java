package io.surfworks.quantaforge.core.error;

/**
 * Thrown when a statevector is requested from a density matrix that is not pure.
 */
public class MixedStateExtractionException extends SimulationException {

    private final double purity;

    public MixedStateExtractionException(double purity) {
        super(String.format("Cannot extract statevector from mixed state (purity %.6f)", purity));
        this.purity = purity;
    }

    public double purity() {
        return purity;
    }
}
