package org.Aayush.probcheck.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ProbabilityTest {

    @Test
    @DisplayName("Arithmetic: complement and product stay in the unit interval")
    void testArithmetic() {
        Probability p = Probability.of(0.25d);

        assertEquals(0.75d, p.complement().value(), 1e-12);
        assertEquals(0.125d, p.multiply(Probability.of(0.5d)).value(), 1e-12);
        assertTrue(Probability.ONE.isOne());
        assertTrue(Probability.ZERO.isZero());
        assertTrue(p.compareTo(Probability.ONE) < 0);
    }

    @Test
    @DisplayName("Rounding noise within tolerance is clamped")
    void testClampWithinTolerance() {
        assertEquals(1.0d, Probability.of(1.0d + 1e-12).value());
        assertEquals(0.0d, Probability.of(-1e-12).value());
        assertTrue(Probability.isApproximately(1.0d, 0.1d + 0.2d + 0.7d));
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1d, 1.1d, Double.NaN})
    @DisplayName("Values outside [0, 1] are rejected")
    void testOutOfRangeRejected(double value) {
        assertThrows(IllegalArgumentException.class, () -> Probability.of(value));
    }
}
