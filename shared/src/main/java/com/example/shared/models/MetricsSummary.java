package com.example.shared.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Сводная статистика по журналу сделок. Для пустого журнала значения NaN, totalTrades = 0.
 */
@Value
@Builder
public class MetricsSummary {
    String pairName;
    int totalTrades;
    int winningTrades;
    double winRate;
    double averagePnl;
    double pnlStd;
    double totalPnl;
    double sharpeRatio;
    double maxDrawdown;
    @JsonIgnore
    List<EquityPoint> equityCurve;
}
