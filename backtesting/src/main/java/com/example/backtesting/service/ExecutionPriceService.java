package com.example.backtesting.service;

import com.example.shared.enums.SlippageMode;
import com.example.shared.models.Settings;
import org.springframework.stereotype.Service;

/**
 * Цены исполнения с проскальзыванием против трейдера.
 * FULL_SPREAD: покупка по ask + (ask - bid), продажа по bid - (ask - bid).
 * Шага цены в данных нет, поэтому спред котировки используется как проскальзывание (худший сценарий).
 */
@Service
public class ExecutionPriceService {

    public double buyPrice(double bid, double ask, Settings settings) {
        return ask + penalty(bid, ask, settings);
    }

    public double sellPrice(double bid, double ask, Settings settings) {
        return bid - penalty(bid, ask, settings);
    }

    private double penalty(double bid, double ask, Settings settings) {
        if (settings.getSlippageMode() == SlippageMode.TICK) {
            return settings.getSlippageTicks() * settings.getTickSize();
        }
        return ask - bid;
    }
}
