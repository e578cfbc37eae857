package io.surfworks.quantaforge.core.noise;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NoiseModelTest {

    @Test
    void emptyModel() {
        NoiseModel model = NoiseModel.empty();
        assertTrue(model.isEmpty());
        assertEquals(List.of(), model.channelsFor(0));
    }

    @Test
    void channelsKeepRegistrationOrder() {
        NoiseChannel first = NoiseChannel.bitFlip(0.1);
        NoiseChannel second = NoiseChannel.phaseFlip(0.2);
        NoiseModel model = NoiseModel.empty().add(1, first).add(1, second).add(0, first);
        assertEquals(List.of(first, second), model.channelsFor(1));
        assertEquals(Set.of(0, 1), model.qubits());
        assertFalse(model.isEmpty());
    }

    @Test
    void copyIsIndependent() {
        NoiseModel model = NoiseModel.empty().add(0, NoiseChannel.bitFlip(0.1));
        NoiseModel copy = model.copy();
        copy.add(0, NoiseChannel.phaseFlip(0.1));
        assertEquals(1, model.channelsFor(0).size());
        assertEquals(2, copy.channelsFor(0).size());
    }

    @Test
    void rejectsNegativeQubit() {
        assertThrows(IllegalArgumentException.class, () -> NoiseModel.empty().add(-1, NoiseChannel.bitFlip(0.1)));
    }

    @Test
    void channelListIsReadOnly() {
        NoiseModel model = NoiseModel.empty().add(0, NoiseChannel.bitFlip(0.1));
        assertThrows(UnsupportedOperationException.class,
            () -> model.channelsFor(0).add(NoiseChannel.phaseFlip(0.1)));
    }
}
