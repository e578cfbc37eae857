package io.surfworks.quantaforge.core.circuit;

/**
 * A computational-basis measurement of {@code qubit} written to {@code classicalBit}.
 */
public record Measurement(int qubit, int classicalBit) {
}
