package com.example.shared.models;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * Разреженная таблица лог-доходностей: timestamp -> (инструмент -> доходность).
 * Хранится по колонкам, пропуски не заполняются, строки глобально не удаляются.
 */
public class ReturnMatrix {

    private final Map<String, NavigableMap<Instant, Double>> columns;

    public ReturnMatrix(Map<String, NavigableMap<Instant, Double>> columns) {
        TreeMap<String, NavigableMap<Instant, Double>> copy = new TreeMap<>();
        columns.forEach((id, series) -> copy.put(id, Collections.unmodifiableNavigableMap(new TreeMap<>(series))));
        this.columns = Collections.unmodifiableMap(copy);
    }

    /**
     * Инструменты в лексикографическом порядке
     */
    public Set<String> getInstruments() {
        return columns.keySet();
    }

    public NavigableMap<Instant, Double> getReturns(String instrumentId) {
        NavigableMap<Instant, Double> series = columns.get(instrumentId);
        return series != null ? series : Collections.emptyNavigableMap();
    }

    public Double getReturn(Instant timestamp, String instrumentId) {
        return getReturns(instrumentId).get(timestamp);
    }

    public int size(String instrumentId) {
        return getReturns(instrumentId).size();
    }

    /**
     * Широкое представление: одна строка на метку времени, в строке только имеющиеся значения
     */
    public NavigableMap<Instant, Map<String, Double>> toRows() {
        TreeMap<Instant, Map<String, Double>> rows = new TreeMap<>();
        columns.forEach((id, series) ->
                series.forEach((ts, value) -> rows.computeIfAbsent(ts, k -> new TreeMap<>()).put(id, value)));
        return rows;
    }
}
