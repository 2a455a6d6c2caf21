package com.example.shared.models;

import com.example.shared.enums.DirectionPolicy;
import com.example.shared.enums.RankingType;
import com.example.shared.enums.SlippageMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Settings {

    // ====== СКРИНИНГ ПАР ======
    @Builder.Default
    private double minCorrelation = 0.5;
    @Builder.Default
    private int minOverlap = 500;
    @Builder.Default
    private double significanceLevel = 0.05;
    @Builder.Default
    private DirectionPolicy directionPolicy = DirectionPolicy.BEST;
    @Builder.Default
    private RankingType ranking = RankingType.CORRELATION;
    @Builder.Default
    private int screeningParallelism = 1;
    @Builder.Default
    private int largeUniverseWarning = 100; //кол-во инструментов, после которого предупреждаем про O(n^2)

    // ====== СИГНАЛ ======
    @Builder.Default
    private int rollingWindow = 60;

    // ====== СТРАТЕГИЯ ======
    @Builder.Default
    private double zEntry = 2.0;
    @Builder.Default
    private double zExit = 0.5;
    @Builder.Default
    private double notionalPerLeg = 100_000.0;
    @Builder.Default
    private boolean forceCloseAtEnd = false;

    @Builder.Default
    private SlippageMode slippageMode = SlippageMode.FULL_SPREAD;
    @Builder.Default
    private double tickSize = 0.0;
    @Builder.Default
    private int slippageTicks = 1;

    // Комиссия биржи по префиксу инструмента (lme, shfe), по умолчанию выключена
    @Builder.Default
    private boolean commissionEnabled = false;
    @Builder.Default
    private Map<String, Double> commissionRates = new HashMap<>();
    @Builder.Default
    private Map<String, Double> contractSizes = new HashMap<>();

    // ====== МЕТРИКИ ======
    @Builder.Default
    private double annualizationFactor = 252.0;

    // Пара для бэктеста, если не задана - берется лучшая пара скрининга
    private String pairA;
    private String pairB;

    public boolean hasConfiguredPair() {
        return pairA != null && !pairA.isBlank() && pairB != null && !pairB.isBlank();
    }
}
