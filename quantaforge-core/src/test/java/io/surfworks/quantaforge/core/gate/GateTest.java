package io.surfworks.quantaforge.core.gate;

import io.surfworks.quantaforge.core.error.NonUnitaryGateException;
import io.surfworks.quantaforge.core.tensor.ComplexMatrix;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GateTest {

    private static Gate sample(GateType type) {
        double[] params = new double[type.parameterCount()];
        Arrays.fill(params, 0.37);
        return Gates.of(type, params);
    }

    @Nested
    @DisplayName("Named gates")
    class NamedGates {

        @ParameterizedTest
        @EnumSource(value = GateType.class, names = "CUSTOM", mode = EnumSource.Mode.EXCLUDE)
        void everyNamedGateIsUnitary(GateType type) {
            Gate gate = sample(type);
            ComplexMatrix m = gate.matrix();
            assertEquals(1 << type.arity(), m.dimension());
            assertTrue(m.isUnitary(Gate.UNITARITY_TOLERANCE), type + " is not unitary");
        }

        @ParameterizedTest
        @ValueSource(doubles = {0.0, 0.5, Math.PI, -2.0})
        void rotationsAreUnitary(double theta) {
            assertTrue(Gates.rx(theta).matrix().isUnitary(1e-12));
            assertTrue(Gates.ry(theta).matrix().isUnitary(1e-12));
            assertTrue(Gates.rz(theta).matrix().isUnitary(1e-12));
        }

        @Test
        void arities() {
            assertEquals(1, Gates.h().arity());
            assertEquals(2, Gates.cnot().arity());
            assertEquals(3, Gates.toffoli().arity());
        }

        @Test
        void rxOfPiIsXUpToPhase() {
            ComplexMatrix rx = Gates.rx(Math.PI).matrix();
            assertEquals(0.0, rx.real(0, 1), 1e-12);
            assertEquals(-1.0, rx.imag(0, 1), 1e-12);
            assertEquals(0.0, rx.real(0, 0), 1e-12);
        }

        @Test
        void tSquaredIsS() {
            ComplexMatrix t = Gates.t().matrix();
            assertTrue(t.multiply(t).approxEquals(Gates.s().matrix(), 1e-12));
        }

        @Test
        void parametersAreExposed() {
            Gate rz = Gates.rz(0.25);
            assertEquals(List.of(0.25), rz.params());
            assertEquals(0.25, rz.param(0));
            assertTrue(rz.type().isParameterized());
            assertFalse(GateType.H.isParameterized());
        }

        @Test
        void rejectsWrongParameterCount() {
            assertThrows(IllegalArgumentException.class, () -> Gates.of(GateType.RX));
            assertThrows(IllegalArgumentException.class, () -> Gates.of(GateType.H, 1.0));
        }

        @Test
        void rejectsNonFiniteAngle() {
            assertThrows(IllegalArgumentException.class, () -> Gates.rx(Double.NaN));
        }

        @Test
        void equalityIsByTypeAndParameters() {
            assertEquals(Gates.rx(0.5), Gates.rx(0.5));
            assertNotEquals(Gates.rx(0.5), Gates.rx(0.6));
            assertEquals(Gates.rx(0.5).hashCode(), Gates.rx(0.5).hashCode());
        }
    }

    @Nested
    @DisplayName("Custom gates")
    class CustomGates {

        @Test
        void acceptsUnitaryMatrix() {
            Gate gate = Gates.custom("myX", Gates.x().matrix());
            assertEquals(GateType.CUSTOM, gate.type());
            assertEquals("myX", gate.name());
            assertEquals(1, gate.arity());
            assertEquals(Gates.x().matrix(), gate.matrix());
        }

        @Test
        void twoQubitCustomGateHasArityTwo() {
            assertEquals(2, Gates.custom("iSwapLike", Gates.swap().matrix()).arity());
        }

        @Test
        void rejectsNonUnitaryMatrix() {
            ComplexMatrix m = ComplexMatrix.ofReal(new double[][] {{1, 0}, {0, 2}});
            NonUnitaryGateException e = assertThrows(NonUnitaryGateException.class, () -> Gates.custom("bad", m));
            assertEquals("bad", e.gateName());
            assertEquals(3.0, e.deviation(), 1e-12);
        }

        @Test
        void rejectsNonPowerOfTwoDimension() {
            assertThrows(NonUnitaryGateException.class, () -> Gates.custom("three", ComplexMatrix.identity(3)));
        }

        @Test
        void customGateIsNeverParameterized() {
            assertTrue(Gates.custom("id", ComplexMatrix.identity(2)).params().isEmpty());
        }
    }
}
