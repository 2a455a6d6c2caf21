package com.example.backtesting.service;

import com.example.shared.enums.ExitReasonType;
import com.example.shared.enums.PositionState;
import com.example.shared.models.EquityPoint;
import com.example.shared.models.MetricsSummary;
import com.example.shared.models.PairCandidate;
import com.example.shared.models.SignalPoint;
import com.example.shared.models.SignalSeries;
import com.example.shared.models.Trade;
import com.example.shared.models.TradeLedger;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvExportServiceTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private final CsvExportService csvExportService = new CsvExportService();
    private final ReportService reportService = new ReportService();

    @Test
    void testCandidatesCsv(@TempDir Path dir) throws Exception {
        PairCandidate candidate = PairCandidate.builder()
                .instrumentA("lme_cu").instrumentB("shfe_cu")
                .correlation(0.9).alpha(10.0).hedgeRatio(0.5).residualStd(0.05)
                .adfStatistic(-12.0).pValue(0.0001).usedLag(1).overlapCount(599)
                .build();

        Path file = csvExportService.writeCandidates(dir, List.of(candidate));

        List<String> lines = Files.readAllLines(file);
        assertEquals("cointegrated_pairs.csv", file.getFileName().toString());
        assertEquals("instrument_a,instrument_b,correlation,alpha,beta,residual_std,adf_statistic,p_value,used_lag,overlap_count", lines.get(0));
        assertEquals("lme_cu,shfe_cu,0.9,10.0,0.5,0.05,-12.0,1.0E-4,1,599", lines.get(1));
    }

    @Test
    void testSignalCsvLeavesUndefinedZScoreEmpty(@TempDir Path dir) throws Exception {
        SignalSeries signal = SignalSeries.builder()
                .instrumentA("lme/cu").instrumentB("shfe cu")
                .hedgeRatio(0.5).window(2)
                .points(List.of(
                        SignalPoint.builder().timestamp(START).priceA(110).priceB(200).spread(10).build(),
                        SignalPoint.builder().timestamp(START.plusSeconds(60)).priceA(111).priceB(200).spread(11).zscore(0.7071).build()))
                .build();

        Path file = csvExportService.writeSignals(dir, signal);

        assertEquals("spread_signals_lme_cu_shfe_cu.csv", file.getFileName().toString());
        List<String> lines = Files.readAllLines(file);
        assertEquals("timestamp,price_a,price_b,spread,zscore", lines.get(0));
        assertEquals("2024-01-01T00:00:00Z,110.0,200.0,10.0,", lines.get(1));
        assertEquals("2024-01-01T00:01:00Z,111.0,200.0,11.0,0.7071", lines.get(2));
    }

    @Test
    void testTradesAndEquityCsv(@TempDir Path dir) throws Exception {
        TradeLedger ledger = new TradeLedger();
        ledger.append(Trade.builder()
                .entryTimestamp(START).exitTimestamp(START.plusSeconds(300))
                .direction(PositionState.SHORT_SPREAD).instrumentA("A").instrumentB("B")
                .entryPriceA(97).entryPriceB(53).exitPriceA(93).exitPriceB(47)
                .quantityA(2).quantityB(1).notionalPerLeg(100)
                .entryZScore(2.1).exitZScore(0.2).commission(0).realizedPnl(2)
                .exitReason(ExitReasonType.EXIT_REASON_BY_Z_EXIT)
                .build());

        List<String> trades = Files.readAllLines(csvExportService.writeTrades(dir, "A", "B", ledger));
        assertEquals(2, trades.size());
        assertTrue(trades.get(0).startsWith("entry_timestamp,exit_timestamp,direction,"));
        assertTrue(trades.get(1).contains("SHORT_SPREAD"));
        assertTrue(trades.get(1).endsWith("2.0,EXIT_REASON_BY_Z_EXIT"));

        Path pnl = csvExportService.writeEquityCurve(dir, "A", "B",
                List.of(EquityPoint.builder().timestamp(START.plusSeconds(300)).pnl(2).cumulativePnl(2).build()));
        assertEquals(List.of("timestamp,pnl,cum_pnl", "2024-01-01T00:05:00Z,2.0,2.0"), Files.readAllLines(pnl));
    }

    @Test
    void testSummaryJsonWithoutEquityCurve(@TempDir Path dir) throws Exception {
        MetricsSummary summary = MetricsSummary.builder()
                .pairName("A/B").totalTrades(0)
                .winRate(Double.NaN).averagePnl(Double.NaN).pnlStd(Double.NaN).sharpeRatio(Double.NaN)
                .totalPnl(0).maxDrawdown(0)
                .equityCurve(List.of())
                .build();

        Path file = reportService.writeSummaryJson(dir, "A", "B", summary);

        JsonNode json = new ObjectMapper().readTree(file.toFile());
        assertEquals("A/B", json.get("pairName").asText());
        assertEquals(0, json.get("totalTrades").asInt());
        assertFalse(json.has("equityCurve"));
        assertEquals("summary_A_B.json", file.getFileName().toString());
    }
}
