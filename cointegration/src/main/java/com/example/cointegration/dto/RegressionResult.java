package com.example.cointegration.dto;

import lombok.Builder;
import lombok.Value;

/**
 * OLS y = alpha + beta * x по уровням цен
 */
@Value
@Builder
public class RegressionResult {
    double alpha;
    double beta;
    double rSquared;
    double[] residuals;
    double residualStd;
}
