package com.example.backtesting.service;

import com.example.shared.exceptions.DataException;
import com.example.shared.models.EquityPoint;
import com.example.shared.models.PairCandidate;
import com.example.shared.models.SignalPoint;
import com.example.shared.models.SignalSeries;
import com.example.shared.models.Trade;
import com.example.shared.models.TradeLedger;
import com.example.shared.utils.StringUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

@Slf4j
@Service
public class CsvExportService {

    public static final String PAIRS_FILE = "cointegrated_pairs.csv";

    public Path writeCandidates(Path dir, List<PairCandidate> candidates) {
        return write(dir.resolve(PAIRS_FILE), writer -> {
            writer.println("instrument_a,instrument_b,correlation,alpha,beta,residual_std,adf_statistic,p_value,used_lag,overlap_count");
            for (PairCandidate c : candidates) {
                writer.println(String.join(",",
                        c.getInstrumentA(), c.getInstrumentB(),
                        num(c.getCorrelation()), num(c.getAlpha()), num(c.getHedgeRatio()), num(c.getResidualStd()),
                        num(c.getAdfStatistic()), num(c.getPValue()),
                        String.valueOf(c.getUsedLag()), String.valueOf(c.getOverlapCount())));
            }
        });
    }

    public Path writeSignals(Path dir, SignalSeries signal) {
        String name = "spread_signals_" + StringUtils.pairFileSuffix(signal.getInstrumentA(), signal.getInstrumentB()) + ".csv";
        return write(dir.resolve(name), writer -> {
            writer.println("timestamp,price_a,price_b,spread,zscore");
            for (SignalPoint p : signal.getPoints()) {
                writer.println(String.join(",",
                        p.getTimestamp().toString(), num(p.getPriceA()), num(p.getPriceB()), num(p.getSpread()),
                        p.getZscore() != null ? num(p.getZscore()) : ""));
            }
        });
    }

    public Path writeTrades(Path dir, String instrumentA, String instrumentB, TradeLedger ledger) {
        String name = "trades_" + StringUtils.pairFileSuffix(instrumentA, instrumentB) + ".csv";
        return write(dir.resolve(name), writer -> {
            writer.println("entry_timestamp,exit_timestamp,direction,entry_price_a,entry_price_b,exit_price_a,exit_price_b,"
                    + "quantity_a,quantity_b,notional_per_leg,entry_zscore,exit_zscore,commission,realized_pnl,exit_reason");
            for (Trade t : ledger.getTrades()) {
                writer.println(String.join(",",
                        t.getEntryTimestamp().toString(), t.getExitTimestamp().toString(), t.getDirection().name(),
                        num(t.getEntryPriceA()), num(t.getEntryPriceB()), num(t.getExitPriceA()), num(t.getExitPriceB()),
                        num(t.getQuantityA()), num(t.getQuantityB()), num(t.getNotionalPerLeg()),
                        num(t.getEntryZScore()), num(t.getExitZScore()), num(t.getCommission()), num(t.getRealizedPnl()),
                        t.getExitReason().name()));
            }
        });
    }

    public Path writeEquityCurve(Path dir, String instrumentA, String instrumentB, List<EquityPoint> curve) {
        String name = "pnl_" + StringUtils.pairFileSuffix(instrumentA, instrumentB) + ".csv";
        return write(dir.resolve(name), writer -> {
            writer.println("timestamp,pnl,cum_pnl");
            for (EquityPoint p : curve) {
                writer.println(String.join(",", p.getTimestamp().toString(), num(p.getPnl()), num(p.getCumulativePnl())));
            }
        });
    }

    private Path write(Path file, Consumer<PrintWriter> body) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8))) {
                body.accept(writer);
            }
            log.info("✅ CSV сохранен: {}", file);
            return file;
        } catch (IOException e) {
            log.error("❌ Ошибка при записи CSV файла {}: {}", file, e.getMessage(), e);
            throw new DataException("Не удалось записать " + file, e);
        }
    }

    private String num(double value) {
        return Double.isNaN(value) ? "" : Double.toString(value);
    }
}
