package io.surfworks.quantaforge.core.tensor;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComplexMatrixTest {

    private static final double TOL = 1e-12;

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        void identityHasUnitDiagonal() {
            ComplexMatrix id = ComplexMatrix.identity(4);
            assertEquals(4, id.dimension());
            for (int r = 0; r < 4; r++) {
                for (int c = 0; c < 4; c++) {
                    assertEquals(r == c ? 1.0 : 0.0, id.real(r, c));
                    assertEquals(0.0, id.imag(r, c));
                }
            }
        }

        @Test
        void ofComplexEntries() {
            ComplexMatrix m = ComplexMatrix.of(new Complex[][] {
                {new Complex(1, 2), Complex.ZERO},
                {Complex.ZERO, new Complex(0, -1)}
            });
            assertEquals(new Complex(1, 2), m.get(0, 0));
            assertEquals(-1.0, m.imag(1, 1));
        }

        @Test
        void outerProduct() {
            // |+><+| from interleaved (re, im) amplitudes
            double s = 1 / Math.sqrt(2);
            ComplexMatrix m = ComplexMatrix.outer(new double[] {s, 0, s, 0}, new double[] {s, 0, s, 0});
            assertEquals(0.5, m.real(0, 1), TOL);
            assertEquals(1.0, m.trace().getReal(), TOL);
        }
    }

    @Nested
    @DisplayName("Algebra")
    class Algebra {

        @Test
        void multiplyByIdentity() {
            ComplexMatrix m = ComplexMatrix.of(new double[][] {{1, 2}, {3, 4}}, new double[][] {{0, 1}, {-1, 0}});
            assertTrue(m.multiply(ComplexMatrix.identity(2)).approxEquals(m, TOL));
        }

        @Test
        void daggerConjugatesAndTransposes() {
            ComplexMatrix m = ComplexMatrix.of(new double[][] {{0, 1}, {0, 0}}, new double[][] {{0, 1}, {0, 0}});
            ComplexMatrix d = m.dagger();
            assertEquals(1.0, d.real(1, 0));
            assertEquals(-1.0, d.imag(1, 0));
            assertEquals(0.0, d.real(0, 1));
        }

        @Test
        void kronDimensionsAndEntries() {
            ComplexMatrix x = ComplexMatrix.ofReal(new double[][] {{0, 1}, {1, 0}});
            ComplexMatrix k = ComplexMatrix.identity(2).kron(x);
            assertEquals(4, k.dimension());
            assertEquals(1.0, k.real(0, 1));
            assertEquals(1.0, k.real(3, 2));
            assertEquals(0.0, k.real(0, 2));
        }

        @Test
        void addSubtractScale() {
            ComplexMatrix id = ComplexMatrix.identity(2);
            assertTrue(id.add(id).approxEquals(id.scale(2.0), TOL));
            assertEquals(0.0, id.subtract(id).maxAbsDifference(ComplexMatrix.zeros(2)), TOL);
            assertEquals(1.0, id.scale(Complex.I).imag(0, 0), TOL);
        }
    }

    @Nested
    @DisplayName("Predicates")
    class Predicates {

        @Test
        void unitaryMatrices() {
            double s = 1 / Math.sqrt(2);
            ComplexMatrix h = ComplexMatrix.ofReal(new double[][] {{s, s}, {s, -s}});
            assertTrue(h.isUnitary(1e-12));
            assertFalse(ComplexMatrix.ofReal(new double[][] {{1, 0}, {0, 2}}).isUnitary(1e-8));
        }

        @Test
        void hermitianMatrices() {
            ComplexMatrix y = ComplexMatrix.of(new double[][] {{0, 0}, {0, 0}}, new double[][] {{0, -1}, {1, 0}});
            assertTrue(y.isHermitian(TOL));
            ComplexMatrix notHermitian = ComplexMatrix.of(new double[][] {{0, 0}, {0, 0}}, new double[][] {{0, 1}, {1, 0}});
            assertFalse(notHermitian.isHermitian(TOL));
        }

        @Test
        void equalityIsByValue() {
            assertEquals(ComplexMatrix.identity(2), ComplexMatrix.identity(2));
            assertEquals(ComplexMatrix.identity(2).hashCode(), ComplexMatrix.identity(2).hashCode());
            assertNotEquals(ComplexMatrix.identity(2), ComplexMatrix.zeros(2));
        }
    }
}
