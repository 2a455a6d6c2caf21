package com.example.cointegration.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AdfResult {
    double testStatistic;
    int usedLag;
    int observations;
}
