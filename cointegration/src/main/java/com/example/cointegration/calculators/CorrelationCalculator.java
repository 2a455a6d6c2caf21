package com.example.cointegration.calculators;

import com.example.shared.exceptions.DegenerateStatisticException;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

public final class CorrelationCalculator {
    private CorrelationCalculator() {
    }

    /**
     * Корреляция Пирсона двух выровненных рядов доходностей (значение в [-1, 1])
     */
    public static double calculate(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("Ряды разной длины: " + x.length + " и " + y.length);
        }
        if (x.length < 2) {
            throw new DegenerateStatisticException("Недостаточно наблюдений для корреляции: " + x.length);
        }
        if (StatUtils.variance(x) == 0.0 || StatUtils.variance(y) == 0.0) {
            throw new DegenerateStatisticException("Нулевая дисперсия ряда доходностей");
        }

        double correlation = new PearsonsCorrelation().correlation(x, y);
        if (Double.isNaN(correlation)) {
            throw new DegenerateStatisticException("Корреляция не определена");
        }
        return correlation;
    }
}
