package io.surfworks.quantaforge.core.noise;

import io.surfworks.quantaforge.core.error.QubitIndexException;
import io.surfworks.quantaforge.core.gate.Gates;
import io.surfworks.quantaforge.core.state.QuantumState;
import io.surfworks.quantaforge.core.tensor.ComplexMatrix;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KrausOperatorsTest {

    @Test
    void embedPlacesOperatorAtQubit() {
        ComplexMatrix x = Gates.x().matrix();
        ComplexMatrix embedded = KrausOperators.embed(x, 0, 2);
        assertEquals(4, embedded.dimension());
        // X on the most significant qubit maps |00> to |10>
        assertEquals(1.0, embedded.real(2, 0), 1e-12);
        assertTrue(KrausOperators.embed(x, 1, 2).approxEquals(ComplexMatrix.identity(2).kron(x), 1e-12));
    }

    @Test
    void embedRejectsQubitOutOfRange() {
        assertThrows(QubitIndexException.class, () -> KrausOperators.embed(Gates.x().matrix(), 2, 2));
    }

    @Test
    void completenessOfIdentity() {
        assertEquals(0.0, KrausOperators.completenessDeviation(List.of(ComplexMatrix.identity(2))), 1e-15);
        assertTrue(KrausOperators.verifyCompleteness(List.of(Gates.h().matrix())));
        assertFalse(KrausOperators.verifyCompleteness(List.of(ComplexMatrix.zeros(2))));
    }

    @Test
    void emptySetHasNoCompleteness() {
        assertThrows(IllegalArgumentException.class, () -> KrausOperators.completenessDeviation(List.of()));
    }

    @Test
    void fullSpaceApplication() {
        ComplexMatrix rho = QuantumState.zero(1).densityMatrix();
        ComplexMatrix out = KrausOperators.apply(rho, List.of(Gates.x().matrix()));
        assertEquals(1.0, out.real(1, 1), 1e-12);
    }

    @Test
    void localApplicationRequiresDensityMatrix() {
        assertThrows(IllegalStateException.class,
            () -> KrausOperators.applyLocal(QuantumState.zero(1), List.of(ComplexMatrix.identity(2)), 0));
    }
}
