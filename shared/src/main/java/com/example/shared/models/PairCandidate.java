package com.example.shared.models;

import lombok.Builder;
import lombok.Value;

/**
 * Коинтегрированная пара после скрининга. Регрессия: price_A = alpha + beta * price_B.
 */
@Value
@Builder
public class PairCandidate {
    String instrumentA;
    String instrumentB;
    double correlation;
    double alpha;
    double hedgeRatio;
    double residualStd;
    double adfStatistic;
    double pValue;
    int usedLag;
    int overlapCount;

    public String getPairName() {
        return instrumentA + "/" + instrumentB;
    }
}
