package io.surfworks.quantaforge.core.noise;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Per-qubit noise channels, applied in registration order after every gate
 * that touches the qubit.
 */
public final class NoiseModel {

    private final Map<Integer, List<NoiseChannel>> channels = new TreeMap<>();

    public static NoiseModel empty() {
        return new NoiseModel();
    }

    /**
     * Register {@code channel} on {@code qubit}, after any channels already there.
     *
     * @return this model
     */
    public NoiseModel add(int qubit, NoiseChannel channel) {
        Objects.requireNonNull(channel, "channel cannot be null");
        if (qubit < 0) {
            throw new IllegalArgumentException("Qubit index must be non-negative, got " + qubit);
        }
        channels.computeIfAbsent(qubit, q -> new ArrayList<>()).add(channel);
        return this;
    }

    /**
     * Channels registered on {@code qubit}, in registration order; empty if none.
     */
    public List<NoiseChannel> channelsFor(int qubit) {
        List<NoiseChannel> list = channels.get(qubit);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    /**
     * Qubits with at least one channel, ascending.
     */
    public Set<Integer> qubits() {
        return Collections.unmodifiableSet(channels.keySet());
    }

    public boolean isEmpty() {
        return channels.isEmpty();
    }

    public NoiseModel copy() {
        NoiseModel copy = new NoiseModel();
        channels.forEach((q, list) -> copy.channels.put(q, new ArrayList<>(list)));
        return copy;
    }

    @Override
    public String toString() {
        return "NoiseModel" + channels;
    }
}
