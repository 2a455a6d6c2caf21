package com.example.backtesting.service;

import com.example.shared.enums.ExitReasonType;
import com.example.shared.enums.PositionState;
import com.example.shared.models.MetricsSummary;
import com.example.shared.models.Settings;
import com.example.shared.models.Trade;
import com.example.shared.models.TradeLedger;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MetricsServiceTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private final MetricsService metricsService = new MetricsService();
    private final Settings settings = Settings.builder().build();

    private Trade trade(int exitMinute, double pnl) {
        return Trade.builder()
                .entryTimestamp(START.plusSeconds(60L * (exitMinute - 1)))
                .exitTimestamp(START.plusSeconds(60L * exitMinute))
                .direction(PositionState.LONG_SPREAD)
                .instrumentA("A")
                .instrumentB("B")
                .realizedPnl(pnl)
                .exitReason(ExitReasonType.EXIT_REASON_BY_Z_EXIT)
                .build();
    }

    @Test
    void testSummaryStatistics() {
        TradeLedger ledger = new TradeLedger();
        // в журнале не по порядку закрытия
        ledger.append(trade(30, 200.0));
        ledger.append(trade(10, 100.0));
        ledger.append(trade(20, -50.0));

        MetricsSummary summary = metricsService.calculate(ledger, "A/B", settings);

        assertEquals(3, summary.getTotalTrades());
        assertEquals(2, summary.getWinningTrades());
        assertEquals(2.0 / 3.0, summary.getWinRate(), 1e-12);
        assertEquals(250.0, summary.getTotalPnl(), 1e-9);
        assertEquals(250.0 / 3.0, summary.getAveragePnl(), 1e-9);

        double std = Math.sqrt(31666.666666666668 / 2.0);
        assertEquals(std, summary.getPnlStd(), 1e-6);
        assertEquals(250.0 / 3.0 / std * Math.sqrt(252), summary.getSharpeRatio(), 1e-6);

        // кривая 100, 50, 250: просадка 50
        assertEquals(50.0, summary.getMaxDrawdown(), 1e-9);
        assertEquals(3, summary.getEquityCurve().size());
        assertEquals(START.plusSeconds(600), summary.getEquityCurve().get(0).getTimestamp());
        assertEquals(250.0, summary.getEquityCurve().get(2).getCumulativePnl(), 1e-9);
    }

    @Test
    void testDrawdownFromZeroPeak() {
        TradeLedger ledger = new TradeLedger();
        ledger.append(trade(1, -30.0));
        ledger.append(trade(2, -20.0));
        ledger.append(trade(3, 10.0));

        MetricsSummary summary = metricsService.calculate(ledger, "A/B", settings);

        assertEquals(50.0, summary.getMaxDrawdown(), 1e-9);
        assertTrue(summary.getSharpeRatio() < 0);
    }

    @Test
    void testSingleTradeHasNoSharpe() {
        TradeLedger ledger = new TradeLedger();
        ledger.append(trade(1, 42.0));

        MetricsSummary summary = metricsService.calculate(ledger, "A/B", settings);

        assertEquals(1, summary.getTotalTrades());
        assertEquals(42.0, summary.getAveragePnl());
        assertTrue(Double.isNaN(summary.getPnlStd()));
        assertTrue(Double.isNaN(summary.getSharpeRatio()));
    }

    @Test
    void testIdenticalPnlHasNoSharpe() {
        TradeLedger ledger = new TradeLedger();
        ledger.append(trade(1, 10.0));
        ledger.append(trade(2, 10.0));

        MetricsSummary summary = metricsService.calculate(ledger, "A/B", settings);

        assertEquals(0.0, summary.getPnlStd());
        assertTrue(Double.isNaN(summary.getSharpeRatio()));
    }

    @Test
    void testEmptyLedger() {
        MetricsSummary summary = assertDoesNotThrow(() -> metricsService.calculate(new TradeLedger(), "A/B", settings));

        assertEquals(0, summary.getTotalTrades());
        assertEquals(0.0, summary.getTotalPnl());
        assertTrue(Double.isNaN(summary.getWinRate()));
        assertTrue(Double.isNaN(summary.getAveragePnl()));
        assertTrue(Double.isNaN(summary.getSharpeRatio()));
        assertEquals(0.0, summary.getMaxDrawdown());
        assertTrue(summary.getEquityCurve().isEmpty());
    }
}
