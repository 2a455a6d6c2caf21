package com.example.shared.models;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Точка сигнала пары. zscore == null означает "сигнала нет" (окно не заполнено или std == 0).
 */
@Value
@Builder
public class SignalPoint {
    Instant timestamp;
    double priceA;
    double priceB;
    double bidA;
    double askA;
    double bidB;
    double askB;
    double spread;
    Double rollingMean;
    Double rollingStd;
    Double zscore;

    public boolean hasZScore() {
        return zscore != null;
    }
}
