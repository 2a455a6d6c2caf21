package com.example.cointegration.calculators;

import com.example.shared.exceptions.DegenerateStatisticException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationCalculatorTest {

    @Test
    void testPerfectAndInverseCorrelation() {
        double[] x = {1, 2, 3, 4, 5};
        double[] y = {2, 4, 6, 8, 10};
        double[] z = {5, 4, 3, 2, 1};

        assertEquals(1.0, CorrelationCalculator.calculate(x, y), 1e-12);
        assertEquals(-1.0, CorrelationCalculator.calculate(x, z), 1e-12);
    }

    @Test
    void testZeroVarianceIsDegenerate() {
        double[] x = {1, 2, 3};
        double[] flat = {7, 7, 7};

        assertThrows(DegenerateStatisticException.class, () -> CorrelationCalculator.calculate(x, flat));
    }

    @Test
    void testTooFewObservations() {
        assertThrows(DegenerateStatisticException.class,
                () -> CorrelationCalculator.calculate(new double[]{1}, new double[]{2}));
    }

    @Test
    void testLengthMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> CorrelationCalculator.calculate(new double[]{1, 2}, new double[]{1, 2, 3}));
    }
}
