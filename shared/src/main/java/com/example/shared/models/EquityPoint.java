package com.example.shared.models;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class EquityPoint {
    Instant timestamp;
    double pnl;
    double cumulativePnl;
}
