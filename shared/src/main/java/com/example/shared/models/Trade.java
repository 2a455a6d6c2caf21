package com.example.shared.models;

import com.example.shared.enums.ExitReasonType;
import com.example.shared.enums.PositionState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Закрытая сделка по паре. Создается один раз при закрытии позиции.
 */
@Value
@Builder
public class Trade {
    Instant entryTimestamp;
    Instant exitTimestamp;
    PositionState direction;
    String instrumentA;
    String instrumentB;
    double entryPriceA;
    double entryPriceB;
    double exitPriceA;
    double exitPriceB;
    double quantityA;
    double quantityB;
    double notionalPerLeg;
    double entryZScore;
    double exitZScore;
    double commission;
    double realizedPnl;
    ExitReasonType exitReason;

    public boolean isWin() {
        return realizedPnl > 0;
    }
}
