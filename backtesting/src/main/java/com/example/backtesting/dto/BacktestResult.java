package com.example.backtesting.dto;

import com.example.shared.models.MetricsSummary;
import com.example.shared.models.ScreeningReport;
import com.example.shared.models.SignalSeries;
import com.example.shared.models.TradeLedger;
import lombok.Builder;
import lombok.Value;

/**
 * Результат прогона пайплайна. Если пара не выбрана, pair/signal/ledger/summary равны null.
 */
@Value
@Builder
public class BacktestResult {
    ScreeningReport screeningReport;
    SelectedPair pair;
    SignalSeries signal;
    TradeLedger ledger;
    MetricsSummary summary;

    public boolean hasPair() {
        return pair != null;
    }
}
