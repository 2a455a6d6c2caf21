package com.example.backtesting.service;

import com.example.shared.models.Settings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Биржевая комиссия за круг (вход + выход) по одной ноге:
 * rate * exitPrice * contractSize * quantity * 2. Ставка и размер контракта ищутся по префиксу id инструмента.
 */
@Slf4j
@Service
public class CommissionService {

    public double roundTripCommission(String instrumentId, double exitPrice, double quantity, Settings settings) {
        if (!settings.isCommissionEnabled()) {
            return 0.0;
        }
        double rate = lookup(settings.getCommissionRates(), instrumentId);
        double contractSize = lookup(settings.getContractSizes(), instrumentId);
        return rate * exitPrice * contractSize * quantity * 2;
    }

    private double lookup(Map<String, Double> values, String instrumentId) {
        String bestKey = null;
        for (String key : values.keySet()) {
            if (instrumentId.startsWith(key) && (bestKey == null || key.length() > bestKey.length())) {
                bestKey = key;
            }
        }
        if (bestKey == null) {
            log.debug("Для {} комиссия не задана", instrumentId);
            return 0.0;
        }
        return values.get(bestKey);
    }
}
