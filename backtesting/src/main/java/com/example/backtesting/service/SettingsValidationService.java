package com.example.backtesting.service;

import com.example.shared.enums.SlippageMode;
import com.example.shared.exceptions.ConfigurationException;
import com.example.shared.models.Settings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class SettingsValidationService {

    /**
     * Проверяет все пороги разом и сообщает обо всех нарушениях одним исключением
     */
    public void validate(Settings settings) {
        List<String> errors = new ArrayList<>();

        if (!(settings.getMinCorrelation() >= 0.0 && settings.getMinCorrelation() < 1.0)) {
            errors.add("min-correlation должен быть в [0, 1): " + settings.getMinCorrelation());
        }
        if (settings.getMinOverlap() < 3) {
            errors.add("min-overlap должен быть >= 3: " + settings.getMinOverlap());
        }
        if (!(settings.getSignificanceLevel() > 0.0 && settings.getSignificanceLevel() < 1.0)) {
            errors.add("significance-level должен быть в (0, 1): " + settings.getSignificanceLevel());
        }
        if (settings.getDirectionPolicy() == null) {
            errors.add("direction-policy не задан");
        }
        if (settings.getRanking() == null) {
            errors.add("ranking не задан");
        }
        if (settings.getScreeningParallelism() < 1) {
            errors.add("screening-parallelism должен быть >= 1: " + settings.getScreeningParallelism());
        }
        if (settings.getRollingWindow() < 2) {
            errors.add("rolling-window должен быть >= 2: " + settings.getRollingWindow());
        }
        if (!(settings.getZEntry() > 0.0) || Double.isInfinite(settings.getZEntry())) {
            errors.add("z-entry должен быть > 0: " + settings.getZEntry());
        }
        if (!(settings.getZExit() < settings.getZEntry() && settings.getZExit() > -settings.getZEntry())) {
            errors.add("z-exit должен быть в (-z-entry, z-entry): " + settings.getZExit());
        }
        if (!(settings.getNotionalPerLeg() > 0.0) || Double.isInfinite(settings.getNotionalPerLeg())) {
            errors.add("notional-per-leg должен быть > 0: " + settings.getNotionalPerLeg());
        }
        if (!(settings.getAnnualizationFactor() > 0.0) || Double.isInfinite(settings.getAnnualizationFactor())) {
            errors.add("annualization-factor должен быть > 0: " + settings.getAnnualizationFactor());
        }
        if (settings.getSlippageMode() == null) {
            errors.add("slippage-mode не задан");
        } else if (settings.getSlippageMode() == SlippageMode.TICK) {
            if (!(settings.getTickSize() > 0.0)) {
                errors.add("tick-size должен быть > 0 для slippage-mode=TICK: " + settings.getTickSize());
            }
            if (settings.getSlippageTicks() < 0) {
                errors.add("slippage-ticks должен быть >= 0: " + settings.getSlippageTicks());
            }
        }
        if (settings.isCommissionEnabled()) {
            validateNonNegative(settings.getCommissionRates(), "commission.rates", errors);
            validateNonNegative(settings.getContractSizes(), "commission.contract-sizes", errors);
        }
        if (settings.hasConfiguredPair() && settings.getPairA().equals(settings.getPairB())) {
            errors.add("pair.a и pair.b совпадают: " + settings.getPairA());
        }

        if (!errors.isEmpty()) {
            errors.forEach(e -> log.error("❌ Ошибка настроек: {}", e));
            throw new ConfigurationException("Некорректные настройки: " + String.join("; ", errors));
        }
    }

    private void validateNonNegative(Map<String, Double> values, String name, List<String> errors) {
        if (values == null) {
            errors.add(name + " не задан");
            return;
        }
        values.forEach((key, value) -> {
            if (value == null || value < 0 || value.isNaN()) {
                errors.add(name + "[" + key + "] должен быть >= 0: " + value);
            }
        });
    }
}
