package com.example.cointegration.service;

import com.example.cointegration.dto.AdfResult;
import com.example.shared.exceptions.DegenerateStatisticException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.springframework.stereotype.Service;

/**
 * Augmented Dickey-Fuller без константы и тренда (остатки коинтеграционной регрессии уже центрированы).
 * Регрессия: Δy_t = γ·y_{t-1} + Σ φ_i·Δy_{t-i} + ε_t, статистика = γ / se(γ).
 */
@Slf4j
@Service
public class ADFService {

    /**
     * ADF с выбором числа лагов по AIC, максимум ceil(12 * (n/100)^(1/4))
     */
    public AdfResult test(double[] series) {
        int n = series.length;
        int maxLag = (int) Math.ceil(12.0 * Math.pow(n / 100.0, 0.25));
        maxLag = Math.min(n / 2 - 1, maxLag);
        if (maxLag < 0) {
            throw new DegenerateStatisticException("Слишком короткий ряд для ADF: " + n);
        }

        // все модели оцениваются на одной выборке, иначе AIC несравнимы
        int bestLag = 0;
        double bestAic = Double.POSITIVE_INFINITY;
        for (int lag = 0; lag <= maxLag; lag++) {
            OLSMultipleLinearRegression regression = fit(series, lag, maxLag);
            int observations = n - 1 - maxLag;
            double ssr = regression.calculateResidualSumOfSquares();
            if (ssr <= 0) {
                throw new DegenerateStatisticException("Нулевая сумма квадратов остатков в ADF");
            }
            double aic = observations * Math.log(ssr / observations) + 2.0 * (lag + 1);
            if (aic < bestAic) {
                bestAic = aic;
                bestLag = lag;
            }
        }

        return test(series, bestLag);
    }

    /**
     * ADF с фиксированным числом лагов
     */
    public AdfResult test(double[] series, int lags) {
        OLSMultipleLinearRegression regression = fit(series, lags, lags);
        double[] beta = regression.estimateRegressionParameters();
        double[] stderr = regression.estimateRegressionParametersStandardErrors();
        if (stderr[0] == 0.0 || Double.isNaN(stderr[0])) {
            throw new DegenerateStatisticException("Нулевая стандартная ошибка коэффициента при y(t-1)");
        }

        double statistic = beta[0] / stderr[0];
        log.trace("ADF: lag={}, stat={}", lags, statistic);
        return AdfResult.builder()
                .testStatistic(statistic)
                .usedLag(lags)
                .observations(series.length - 1 - lags)
                .build();
    }

    /**
     * @param lags     число лагированных разностей в модели
     * @param startLag с какого индекса разностей начинается выборка (>= lags)
     */
    private OLSMultipleLinearRegression fit(double[] series, int lags, int startLag) {
        int n = series.length;
        int rows = n - 1 - startLag;
        if (rows <= lags + 1) {
            throw new DegenerateStatisticException("Недостаточно наблюдений для ADF: ряд " + n + ", лагов " + lags);
        }

        double[] diff = new double[n - 1];
        for (int i = 0; i < n - 1; i++) {
            diff[i] = series[i + 1] - series[i];
        }

        double[] deltaY = new double[rows];
        double[][] regressors = new double[rows][1 + lags]; // y_{t-1}, Δy_{t-1}, ..., Δy_{t-lags}
        for (int t = startLag; t < n - 1; t++) {
            int row = t - startLag;
            deltaY[row] = diff[t];
            regressors[row][0] = series[t];
            for (int i = 1; i <= lags; i++) {
                regressors[row][i] = diff[t - i];
            }
        }

        OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
        regression.setNoIntercept(true);
        try {
            regression.newSampleData(deltaY, regressors);
            regression.estimateRegressionParameters();
        } catch (SingularMatrixException e) {
            throw new DegenerateStatisticException("ADF: сингулярная матрица", e);
        }
        return regression;
    }
}
