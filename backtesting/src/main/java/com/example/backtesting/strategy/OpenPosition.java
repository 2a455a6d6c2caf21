package com.example.backtesting.strategy;

import com.example.shared.enums.PositionState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Открытая позиция по паре: цены входа уже с проскальзыванием, количество = notional / цена входа
 */
@Value
@Builder
public class OpenPosition {
    PositionState direction;
    Instant entryTimestamp;
    double entryPriceA;
    double entryPriceB;
    double quantityA;
    double quantityB;
    double entryZScore;
}
