package io.surfworks.quantaforge.core.backend;

/**
 * One entry of the noise trace recorded by a noisy execution.
 *
 * @param gateIndex      index of the gate after which the channel ran
 * @param qubit          qubit the channel acted on
 * @param channelName    channel name, e.g. "Depolarizing"
 * @param fidelityBefore fidelity between the state before and after the channel
 */
public record NoiseApplication(int gateIndex, int qubit, String channelName, double fidelityBefore) {
}
