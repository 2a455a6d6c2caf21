package com.example.backtesting.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SelectedPair {
    String instrumentA;
    String instrumentB;
    double alpha;
    double hedgeRatio;
    boolean fromScreening;

    public String getPairName() {
        return instrumentA + "/" + instrumentB;
    }
}
