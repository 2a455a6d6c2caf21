package com.example.cointegration.service;

import com.example.cointegration.dto.AdfResult;
import com.example.cointegration.dto.CointegrationResult;
import com.example.cointegration.dto.RegressionResult;
import com.example.shared.exceptions.DegenerateStatisticException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.springframework.stereotype.Service;

/**
 * Тест коинтеграции Энгла-Грейнджера для двух рядов цен:
 * 1) OLS y = alpha + beta * x, 2) ADF остатков, 3) p-value по поверхности МакКиннона (2010)
 * для двух переменных с константой.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CointegrationService {

    // MacKinnon (2010), регрессия с константой, N = 2
    private static final double TAU_MAX = 0.92;
    private static final double TAU_MIN = -18.86;
    private static final double TAU_STAR = -2.62;
    private static final double[] TAU_SMALL_P = {2.92, 1.5012, 0.039796};
    private static final double[] TAU_LARGE_P = {2.1945, 0.64695, -0.29198, -0.042377};

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

    private final ADFService adfService;

    public CointegrationResult testCointegration(double[] y, double[] x) {
        RegressionResult regression = fitRegression(y, x);
        if (regression.getResidualStd() == 0.0) {
            throw new DegenerateStatisticException("Остатки регрессии тождественно равны нулю");
        }

        AdfResult adf = adfService.test(regression.getResiduals());
        double pValue = mackinnonPValue(adf.getTestStatistic());

        return CointegrationResult.builder()
                .regression(regression)
                .adf(adf)
                .pValue(pValue)
                .build();
    }

    /**
     * OLS y = alpha + beta * x
     */
    public RegressionResult fitRegression(double[] y, double[] x) {
        if (y.length != x.length) {
            throw new IllegalArgumentException("Arrays must be of equal length");
        }
        if (y.length < 3) {
            throw new DegenerateStatisticException("Недостаточно наблюдений для регрессии: " + y.length);
        }
        if (StatUtils.variance(x) == 0.0) {
            throw new DegenerateStatisticException("Нулевая дисперсия регрессора");
        }

        double[][] xData = new double[x.length][1];
        for (int i = 0; i < x.length; i++) {
            xData[i][0] = x[i];
        }

        OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
        try {
            regression.newSampleData(y, xData);
            double[] params = regression.estimateRegressionParameters();
            double[] residuals = regression.estimateResiduals();

            return RegressionResult.builder()
                    .alpha(params[0])
                    .beta(params[1])
                    .rSquared(regression.calculateRSquared())
                    .residuals(residuals)
                    .residualStd(new DescriptiveStatistics(residuals).getStandardDeviation())
                    .build();
        } catch (SingularMatrixException e) {
            throw new DegenerateStatisticException("Регрессия: сингулярная матрица", e);
        }
    }

    /**
     * Приближенное p-value статистики ADF остатков: Φ(полином от статистики)
     */
    public double mackinnonPValue(double testStatistic) {
        if (testStatistic > TAU_MAX) {
            return 1.0;
        }
        if (testStatistic < TAU_MIN) {
            return 0.0;
        }
        double[] coefficients = testStatistic <= TAU_STAR ? TAU_SMALL_P : TAU_LARGE_P;

        double value = 0.0;
        for (int i = coefficients.length - 1; i >= 0; i--) {
            value = value * testStatistic + coefficients[i];
        }
        return STANDARD_NORMAL.cumulativeProbability(value);
    }
}
