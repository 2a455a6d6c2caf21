package com.example.backtesting.service;

import com.example.shared.models.EquityPoint;
import com.example.shared.models.MetricsSummary;
import com.example.shared.models.Settings;
import com.example.shared.models.Trade;
import com.example.shared.models.TradeLedger;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Slf4j
@Service
public class MetricsService {

    /**
     * Сводка по закрытым сделкам. Sharpe = mean / std * sqrt(annualizationFactor) по P&L сделок,
     * NaN при менее чем двух сделках или нулевом std. Пустой журнал не является ошибкой.
     */
    public MetricsSummary calculate(TradeLedger ledger, String pairName, Settings settings) {
        List<Trade> trades = new ArrayList<>(ledger.getTrades());
        trades.sort(Comparator.comparing(Trade::getExitTimestamp));

        DescriptiveStatistics pnlStats = new DescriptiveStatistics();
        int winningTrades = 0;
        for (Trade trade : trades) {
            pnlStats.addValue(trade.getRealizedPnl());
            if (trade.isWin()) {
                winningTrades++;
            }
        }

        int total = trades.size();
        double averagePnl = total > 0 ? pnlStats.getMean() : Double.NaN;
        double pnlStd = total > 1 ? pnlStats.getStandardDeviation() : Double.NaN;
        double sharpe = pnlStd > 0
                ? averagePnl / pnlStd * Math.sqrt(settings.getAnnualizationFactor())
                : Double.NaN;

        List<EquityPoint> equityCurve = buildEquityCurve(trades);

        return MetricsSummary.builder()
                .pairName(pairName)
                .totalTrades(total)
                .winningTrades(winningTrades)
                .winRate(total > 0 ? (double) winningTrades / total : Double.NaN)
                .averagePnl(averagePnl)
                .pnlStd(pnlStd)
                .totalPnl(total > 0 ? pnlStats.getSum() : 0.0)
                .sharpeRatio(sharpe)
                .maxDrawdown(maxDrawdown(equityCurve))
                .equityCurve(equityCurve)
                .build();
    }

    /**
     * Накопленный P&L по времени закрытия сделок
     */
    public List<EquityPoint> buildEquityCurve(List<Trade> tradesByExit) {
        List<EquityPoint> curve = new ArrayList<>(tradesByExit.size());
        double cumulative = 0.0;
        for (Trade trade : tradesByExit) {
            cumulative += trade.getRealizedPnl();
            curve.add(EquityPoint.builder()
                    .timestamp(trade.getExitTimestamp())
                    .pnl(trade.getRealizedPnl())
                    .cumulativePnl(cumulative)
                    .build());
        }
        return curve;
    }

    /**
     * Максимальная просадка кривой капитала от пика (старт с нуля), неотрицательное число
     */
    private double maxDrawdown(List<EquityPoint> curve) {
        double peak = 0.0;
        double maxDrawdown = 0.0;
        for (EquityPoint point : curve) {
            peak = Math.max(peak, point.getCumulativePnl());
            maxDrawdown = Math.max(maxDrawdown, peak - point.getCumulativePnl());
        }
        return maxDrawdown;
    }
}
