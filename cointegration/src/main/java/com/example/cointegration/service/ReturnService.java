package com.example.cointegration.service;

import com.example.shared.exceptions.DataException;
import com.example.shared.models.PriceBar;
import com.example.shared.models.PriceSeries;
import com.example.shared.models.ReturnMatrix;
import com.example.shared.utils.StringUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

@Slf4j
@Service
public class ReturnService {

    /**
     * Группирует строки таблицы цен по инструментам и проверяет каждый ряд.
     * Порядок строк внутри инструмента сохраняется: повтор той же метки времени - оставляем первую строку.
     * Инструмент с некорректными данными исключается целиком, остальные обрабатываются дальше.
     */
    public Map<String, PriceSeries> buildPriceSeries(List<PriceBar> bars) {
        Map<String, List<PriceBar>> grouped = new LinkedHashMap<>();
        for (PriceBar bar : bars) {
            if (bar.getInstrumentId() == null || bar.getInstrumentId().isBlank()) {
                throw new DataException("Строка цены без id инструмента, timestamp=" + bar.getTimestamp());
            }
            grouped.computeIfAbsent(bar.getInstrumentId(), k -> new ArrayList<>()).add(bar);
        }

        Map<String, PriceSeries> result = new TreeMap<>();
        grouped.forEach((id, instrumentBars) -> {
            try {
                result.put(id, toSeries(id, instrumentBars));
            } catch (DataException e) {
                log.error("❌ Инструмент {} исключен: {} (строк {}, период {})", id, e.getMessage(),
                        instrumentBars.size(), range(instrumentBars));
            }
        });
        if (result.size() < grouped.size()) {
            log.warn("⚠️ Исключено инструментов с ошибками данных: {} из {}", grouped.size() - result.size(), grouped.size());
        }
        log.debug("📦 Построено {} ценовых рядов из {} строк", result.size(), bars.size());
        return result;
    }

    /**
     * Лог-доходности всех инструментов. Доходность в t берется относительно
     * предыдущего наблюдения того же инструмента, а не предыдущей строки общей таблицы.
     */
    public ReturnMatrix computeReturns(Map<String, PriceSeries> seriesMap) {
        Map<String, NavigableMap<Instant, Double>> columns = new TreeMap<>();
        for (PriceSeries series : seriesMap.values()) {
            NavigableMap<Instant, Double> returns = computeLogReturns(series);
            if (returns.isEmpty()) {
                log.warn("⚠️ Инструмент {}: наблюдений {} - доходности не рассчитываются", series.getInstrumentId(), series.size());
                continue;
            }
            columns.put(series.getInstrumentId(), returns);
        }
        log.info("📈 Рассчитаны лог-доходности для {} из {} инструментов", columns.size(), seriesMap.size());
        return new ReturnMatrix(columns);
    }

    public NavigableMap<Instant, Double> computeLogReturns(PriceSeries series) {
        NavigableMap<Instant, Double> returns = new TreeMap<>();
        PriceBar previous = null;
        for (PriceBar bar : series.getBars().values()) {
            if (previous != null) {
                returns.put(bar.getTimestamp(), Math.log(bar.getMid()) - Math.log(previous.getMid()));
            }
            previous = bar;
        }
        return returns;
    }

    private PriceSeries toSeries(String instrumentId, List<PriceBar> bars) {
        List<PriceBar> clean = new ArrayList<>(bars.size());
        PriceBar previous = null;
        int duplicates = 0;

        for (PriceBar bar : bars) {
            if (bar.getTimestamp() == null) {
                throw new DataException("Строка цены без timestamp для инструмента " + instrumentId);
            }
            validateQuote(instrumentId, bar);
            if (previous != null) {
                int cmp = bar.getTimestamp().compareTo(previous.getTimestamp());
                if (cmp < 0) {
                    throw new DataException(String.format("Инструмент %s: немонотонный ряд, %s после %s",
                            instrumentId, bar.getTimestamp(), previous.getTimestamp()));
                }
                if (cmp == 0) {
                    duplicates++;
                    continue;
                }
            }
            clean.add(bar);
            previous = bar;
        }

        if (duplicates > 0) {
            log.warn("⚠️ Инструмент {}: отброшено {} дубликатов по timestamp", instrumentId, duplicates);
        }
        return new PriceSeries(instrumentId, clean);
    }

    private void validateQuote(String instrumentId, PriceBar bar) {
        double mid = bar.getMid();
        if (!Double.isFinite(mid) || mid <= 0) {
            throw new DataException(String.format("Инструмент %s: некорректная mid цена %s в %s",
                    instrumentId, mid, bar.getTimestamp()));
        }
        if (!Double.isFinite(bar.getBid()) || !Double.isFinite(bar.getAsk())) {
            throw new DataException(String.format("Инструмент %s: некорректная котировка bid=%s ask=%s в %s",
                    instrumentId, bar.getBid(), bar.getAsk(), bar.getTimestamp()));
        }
        if (bar.getAsk() < bar.getBid()) {
            throw new DataException(String.format("Инструмент %s: перевернутая котировка ask %s < bid %s в %s",
                    instrumentId, bar.getAsk(), bar.getBid(), bar.getTimestamp()));
        }
    }

    private String range(List<PriceBar> bars) {
        Instant from = null;
        Instant to = null;
        for (PriceBar bar : bars) {
            Instant ts = bar.getTimestamp();
            if (ts == null) {
                continue;
            }
            if (from == null || ts.isBefore(from)) {
                from = ts;
            }
            if (to == null || ts.isAfter(to)) {
                to = ts;
            }
        }
        return StringUtils.range(from, to);
    }
}
