package com.example.cointegration.service;

import com.example.cointegration.SyntheticPrices;
import com.example.cointegration.dto.CointegrationResult;
import com.example.cointegration.dto.RegressionResult;
import com.example.shared.exceptions.DegenerateStatisticException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CointegrationServiceTest {

    private final CointegrationService cointegrationService = new CointegrationService(new ADFService());

    @Test
    void testMackinnonPValueMatchesCriticalValues() {
        // критические значения Engle-Granger для двух рядов с константой: 5% ~ -3.34, 1% ~ -3.90
        assertEquals(0.05, cointegrationService.mackinnonPValue(-3.34), 0.005);
        assertEquals(0.01, cointegrationService.mackinnonPValue(-3.90), 0.002);
    }

    @Test
    void testMackinnonPValueClampedOutsideSurface() {
        assertEquals(1.0, cointegrationService.mackinnonPValue(1.5));
        assertEquals(0.0, cointegrationService.mackinnonPValue(-20.0));
    }

    @Test
    void testMackinnonPValueIsMonotonic() {
        double previous = 0.0;
        for (double stat = -18.0; stat <= 0.9; stat += 0.1) {
            double p = cointegrationService.mackinnonPValue(stat);
            assertTrue(p >= previous, "p-value decreased at " + stat);
            previous = p;
        }
    }

    @Test
    void testRegressionRecoversHedgeRatio() {
        double[] x = {1, 2, 3, 4, 5, 6};
        double[] y = {3.1, 4.9, 7.1, 8.9, 11.1, 12.9};

        RegressionResult result = cointegrationService.fitRegression(y, x);

        assertEquals(1.98, result.getBeta(), 0.05);
        assertEquals(1.1, result.getAlpha(), 0.2);
        assertEquals(6, result.getResiduals().length);
        assertTrue(result.getResidualStd() > 0);
    }

    @Test
    void testCointegratedSeriesAccepted() {
        double[] x = SyntheticPrices.randomWalk(42L, 600, 200.0, 0.5);
        double[] y = SyntheticPrices.cointegratedWith(x, 43L, 10.0, 0.5, 0.3, 0.05);

        CointegrationResult result = cointegrationService.testCointegration(y, x);

        assertEquals(0.5, result.getBeta(), 0.02);
        assertTrue(result.getPValue() < 0.01, "p=" + result.getPValue());
    }

    @Test
    void testIndependentRandomWalksNotCointegrated() {
        double[] x = SyntheticPrices.randomWalk(1L, 600, 200.0, 0.5);
        double[] y = SyntheticPrices.randomWalk(2L, 600, 150.0, 0.5);

        CointegrationResult result = cointegrationService.testCointegration(y, x);

        assertTrue(result.getPValue() > 0.001, "p=" + result.getPValue());
    }

    @Test
    void testConstantRegressorIsDegenerate() {
        double[] x = {5, 5, 5, 5};
        double[] y = {1, 2, 3, 4};

        assertThrows(DegenerateStatisticException.class, () -> cointegrationService.fitRegression(y, x));
    }
}
