package io.surfworks.quantaforge.core.error;

/**
 * Thrown when a custom Kraus set does not satisfy {@code Σ K_i† K_i = I}.
 */
public class IncompleteChannelException extends SimulationException {

    private final String channel;
    private final double deviation;

    public IncompleteChannelException(String channel, double deviation) {
        super(String.format("Kraus operators of %s do not satisfy completeness (max deviation %.3e)",
            channel, deviation));
        this.channel = channel;
        this.deviation = deviation;
    }

    public IncompleteChannelException(String channel, String reason) {
        super(String.format("Kraus operators of %s are invalid: %s", channel, reason));
        this.channel = channel;
        this.deviation = Double.NaN;
    }

    public String channel() {
        return channel;
    }

    /**
     * Returns the largest absolute entry of {@code Σ K_i† K_i - I}, or {@code NaN}
     * when the set was rejected for a structural reason.
     */
    public double deviation() {
        return deviation;
    }
}
