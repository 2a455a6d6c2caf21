package com.example.backtesting.strategy;

import com.example.shared.enums.PositionState;
import com.example.shared.models.Trade;
import lombok.Value;

import java.util.Optional;

/**
 * Результат одного шага автомата: новое состояние, открытая позиция (null во FLAT) и сделка при закрытии
 */
@Value
public class Transition {
    PositionState state;
    OpenPosition position;
    Trade trade;

    public static Transition stay(PositionState state, OpenPosition position) {
        return new Transition(state, position, null);
    }

    public static Transition opened(OpenPosition position) {
        return new Transition(position.getDirection(), position, null);
    }

    public static Transition closed(Trade trade) {
        return new Transition(PositionState.FLAT, null, trade);
    }

    public Optional<Trade> getClosedTrade() {
        return Optional.ofNullable(trade);
    }
}
