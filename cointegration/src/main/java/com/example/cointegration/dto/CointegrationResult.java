package com.example.cointegration.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Результат теста Энгла-Грейнджера: регрессия уровней + ADF остатков
 */
@Value
@Builder
public class CointegrationResult {
    RegressionResult regression;
    AdfResult adf;
    double pValue;

    public double getBeta() {
        return regression.getBeta();
    }

    public double getAlpha() {
        return regression.getAlpha();
    }
}
