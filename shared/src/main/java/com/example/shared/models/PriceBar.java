package com.example.shared.models;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Одна строка нормализованной таблицы цен: котировки инструмента на момент времени (UTC)
 */
@Value
@Builder
public class PriceBar {
    Instant timestamp;
    String instrumentId;
    double bid;
    double ask;
    double mid;
}
