package io.surfworks.quantaforge.core.error;

/**
 * Thrown when a noise channel probability or damping parameter lies outside [0, 1].
 */
public class InvalidChannelParameterException extends SimulationException {

    private final String channel;
    private final String parameter;
    private final double value;

    public InvalidChannelParameterException(String channel, String parameter, double value) {
        super(String.format("%s parameter %s must be in [0, 1], got %s", channel, parameter, value));
        this.channel = channel;
        this.parameter = parameter;
        this.value = value;
    }

    public String channel() {
        return channel;
    }

    public String parameter() {
        return parameter;
    }

    public double value() {
        return value;
    }
}
