package com.example.shared.models;

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Упорядоченный ряд котировок одного инструмента.
 * Метки времени строго возрастают, дубликатов нет - проверяется при построении в ReturnService.
 */
public class PriceSeries {

    @Getter
    private final String instrumentId;
    private final NavigableMap<Instant, PriceBar> bars;

    public PriceSeries(String instrumentId, List<PriceBar> orderedBars) {
        this.instrumentId = instrumentId;
        TreeMap<Instant, PriceBar> map = new TreeMap<>();
        for (PriceBar bar : orderedBars) {
            map.put(bar.getTimestamp(), bar);
        }
        this.bars = Collections.unmodifiableNavigableMap(map);
    }

    public NavigableMap<Instant, PriceBar> getBars() {
        return bars;
    }

    public PriceBar get(Instant timestamp) {
        return bars.get(timestamp);
    }

    public boolean contains(Instant timestamp) {
        return bars.containsKey(timestamp);
    }

    public int size() {
        return bars.size();
    }

    public Instant getFirstTimestamp() {
        return bars.isEmpty() ? null : bars.firstKey();
    }

    public Instant getLastTimestamp() {
        return bars.isEmpty() ? null : bars.lastKey();
    }
}
