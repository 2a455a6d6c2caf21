package com.example.shared.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SignalSeries {
    String instrumentA;
    String instrumentB;
    double alpha;
    double hedgeRatio;
    int window;
    List<SignalPoint> points;

    public String getPairName() {
        return instrumentA + "/" + instrumentB;
    }

    public long countDefinedZScores() {
        return points.stream().filter(SignalPoint::hasZScore).count();
    }
}
