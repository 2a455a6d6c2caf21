package com.example.backtesting.strategy;

import com.example.backtesting.service.CommissionService;
import com.example.backtesting.service.ExecutionPriceService;
import com.example.shared.enums.ExitReasonType;
import com.example.shared.enums.PositionState;
import com.example.shared.exceptions.DataException;
import com.example.shared.models.Settings;
import com.example.shared.models.SignalPoint;
import com.example.shared.models.Trade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Автомат состояний позиции. Переход - чистая функция (состояние, позиция, точка сигнала) -> Transition.
 * <pre>
 * FLAT         z < -zEntry -> LONG_SPREAD  (покупаем A, продаем B)
 * FLAT         z > +zEntry -> SHORT_SPREAD (продаем A, покупаем B)
 * LONG_SPREAD  z >= zExit  -> FLAT
 * SHORT_SPREAD z <= zExit  -> FLAT
 * </pre>
 * Пока позиция открыта, сигналы входа игнорируются.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PositionStateMachine {

    private final ExecutionPriceService executionPriceService;
    private final CommissionService commissionService;

    public Transition next(PositionState state, OpenPosition position, SignalPoint point,
                           String instrumentA, String instrumentB, Settings settings) {
        if (!point.hasZScore()) {
            throw new IllegalArgumentException("Точка без Z-скора не участвует в стратегии: " + point.getTimestamp());
        }
        double z = point.getZscore();

        switch (state) {
            case FLAT:
                if (z < -settings.getZEntry()) {
                    return Transition.opened(open(PositionState.LONG_SPREAD, point, settings));
                }
                if (z > settings.getZEntry()) {
                    return Transition.opened(open(PositionState.SHORT_SPREAD, point, settings));
                }
                return Transition.stay(state, null);
            case LONG_SPREAD:
                if (z >= settings.getZExit()) {
                    return Transition.closed(close(position, point, instrumentA, instrumentB,
                            ExitReasonType.EXIT_REASON_BY_Z_EXIT, settings));
                }
                return Transition.stay(state, position);
            case SHORT_SPREAD:
                if (z <= settings.getZExit()) {
                    return Transition.closed(close(position, point, instrumentA, instrumentB,
                            ExitReasonType.EXIT_REASON_BY_Z_EXIT, settings));
                }
                return Transition.stay(state, position);
            default:
                throw new IllegalStateException("Неизвестное состояние позиции: " + state);
        }
    }

    /**
     * Принудительное закрытие по ценам последней точки
     */
    public Transition forceClose(OpenPosition position, SignalPoint point, String instrumentA, String instrumentB,
                                 Settings settings) {
        return Transition.closed(close(position, point, instrumentA, instrumentB,
                ExitReasonType.EXIT_REASON_END_OF_DATA, settings));
    }

    private OpenPosition open(PositionState direction, SignalPoint point, Settings settings) {
        double priceA;
        double priceB;
        if (direction == PositionState.LONG_SPREAD) {
            priceA = executionPriceService.buyPrice(point.getBidA(), point.getAskA(), settings);
            priceB = executionPriceService.sellPrice(point.getBidB(), point.getAskB(), settings);
        } else {
            priceA = executionPriceService.sellPrice(point.getBidA(), point.getAskA(), settings);
            priceB = executionPriceService.buyPrice(point.getBidB(), point.getAskB(), settings);
        }
        if (!(priceA > 0) || !(priceB > 0)) {
            throw new DataException(String.format("Неположительная цена входа в %s: A=%s, B=%s",
                    point.getTimestamp(), priceA, priceB));
        }

        return OpenPosition.builder()
                .direction(direction)
                .entryTimestamp(point.getTimestamp())
                .entryPriceA(priceA)
                .entryPriceB(priceB)
                .quantityA(settings.getNotionalPerLeg() / priceA)
                .quantityB(settings.getNotionalPerLeg() / priceB)
                .entryZScore(point.getZscore())
                .build();
    }

    private Trade close(OpenPosition position, SignalPoint point, String instrumentA, String instrumentB,
                        ExitReasonType exitReason, Settings settings) {
        double exitA;
        double exitB;
        double grossPnl;
        if (position.getDirection() == PositionState.LONG_SPREAD) {
            exitA = executionPriceService.sellPrice(point.getBidA(), point.getAskA(), settings);
            exitB = executionPriceService.buyPrice(point.getBidB(), point.getAskB(), settings);
            grossPnl = (exitA - position.getEntryPriceA()) * position.getQuantityA()
                    - (exitB - position.getEntryPriceB()) * position.getQuantityB();
        } else {
            exitA = executionPriceService.buyPrice(point.getBidA(), point.getAskA(), settings);
            exitB = executionPriceService.sellPrice(point.getBidB(), point.getAskB(), settings);
            grossPnl = (position.getEntryPriceA() - exitA) * position.getQuantityA()
                    - (position.getEntryPriceB() - exitB) * position.getQuantityB();
        }

        double commission = commissionService.roundTripCommission(instrumentA, exitA, position.getQuantityA(), settings)
                + commissionService.roundTripCommission(instrumentB, exitB, position.getQuantityB(), settings);

        return Trade.builder()
                .entryTimestamp(position.getEntryTimestamp())
                .exitTimestamp(point.getTimestamp())
                .direction(position.getDirection())
                .instrumentA(instrumentA)
                .instrumentB(instrumentB)
                .entryPriceA(position.getEntryPriceA())
                .entryPriceB(position.getEntryPriceB())
                .exitPriceA(exitA)
                .exitPriceB(exitB)
                .quantityA(position.getQuantityA())
                .quantityB(position.getQuantityB())
                .notionalPerLeg(settings.getNotionalPerLeg())
                .entryZScore(position.getEntryZScore())
                .exitZScore(point.getZscore() != null ? point.getZscore() : Double.NaN)
                .commission(commission)
                .realizedPnl(grossPnl - commission)
                .exitReason(exitReason)
                .build();
    }
}
