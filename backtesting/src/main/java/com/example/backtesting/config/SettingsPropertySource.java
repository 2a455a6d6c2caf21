package com.example.backtesting.config;

import com.example.backtesting.service.SettingsValidationService;
import com.example.shared.enums.DirectionPolicy;
import com.example.shared.enums.RankingType;
import com.example.shared.enums.SlippageMode;
import com.example.shared.models.Settings;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@Data
@Configuration
public class SettingsPropertySource {

    @Value("${backtest.min-correlation:0.5}")
    private double minCorrelation;
    @Value("${backtest.min-overlap:500}")
    private int minOverlap;
    @Value("${backtest.significance-level:0.05}")
    private double significanceLevel;
    @Value("${backtest.direction-policy:BEST}")
    private DirectionPolicy directionPolicy;
    @Value("${backtest.ranking:CORRELATION}")
    private RankingType ranking;
    @Value("${backtest.screening-parallelism:1}")
    private int screeningParallelism;
    @Value("${backtest.large-universe-warning:100}")
    private int largeUniverseWarning;

    @Value("${backtest.rolling-window:60}")
    private int rollingWindow;

    @Value("${backtest.z-entry:2.0}")
    private double zEntry;
    @Value("${backtest.z-exit:0.5}")
    private double zExit;
    @Value("${backtest.notional-per-leg:100000}")
    private double notionalPerLeg;
    @Value("${backtest.force-close-at-end:false}")
    private boolean forceCloseAtEnd;

    @Value("${backtest.slippage-mode:FULL_SPREAD}")
    private SlippageMode slippageMode;
    @Value("${backtest.tick-size:0.0}")
    private double tickSize;
    @Value("${backtest.slippage-ticks:1}")
    private int slippageTicks;

    @Value("${backtest.commission.enabled:false}")
    private boolean commissionEnabled;
    @Value("#{${backtest.commission.rates:{:}}}")
    private Map<String, Double> commissionRates;
    @Value("#{${backtest.commission.contract-sizes:{:}}}")
    private Map<String, Double> contractSizes;

    @Value("${backtest.annualization-factor:252}")
    private double annualizationFactor;

    @Value("${backtest.pair.a:}")
    private String pairA;
    @Value("${backtest.pair.b:}")
    private String pairB;

    /**
     * Настройки собираются и проверяются при старте контекста, до любых расчетов
     */
    @Bean
    public Settings settings(SettingsValidationService settingsValidationService) {
        Settings settings = Settings.builder()
                .minCorrelation(minCorrelation)
                .minOverlap(minOverlap)
                .significanceLevel(significanceLevel)
                .directionPolicy(directionPolicy)
                .ranking(ranking)
                .screeningParallelism(screeningParallelism)
                .largeUniverseWarning(largeUniverseWarning)
                .rollingWindow(rollingWindow)
                .zEntry(zEntry)
                .zExit(zExit)
                .notionalPerLeg(notionalPerLeg)
                .forceCloseAtEnd(forceCloseAtEnd)
                .slippageMode(slippageMode)
                .tickSize(tickSize)
                .slippageTicks(slippageTicks)
                .commissionEnabled(commissionEnabled)
                .commissionRates(commissionRates != null ? new HashMap<>(commissionRates) : new HashMap<>())
                .contractSizes(contractSizes != null ? new HashMap<>(contractSizes) : new HashMap<>())
                .annualizationFactor(annualizationFactor)
                .pairA(pairA)
                .pairB(pairB)
                .build();

        settingsValidationService.validate(settings);
        log.info("⚙️ Настройки загружены: {}", settings);
        return settings;
    }
}
