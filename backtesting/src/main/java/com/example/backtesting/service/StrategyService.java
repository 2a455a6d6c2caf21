package com.example.backtesting.service;

import com.example.backtesting.strategy.OpenPosition;
import com.example.backtesting.strategy.PositionStateMachine;
import com.example.backtesting.strategy.Transition;
import com.example.shared.enums.PositionState;
import com.example.shared.models.Settings;
import com.example.shared.models.SignalPoint;
import com.example.shared.models.SignalSeries;
import com.example.shared.models.Trade;
import com.example.shared.models.TradeLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class StrategyService {

    private final PositionStateMachine positionStateMachine;

    /**
     * Последовательный прогон автомата по точкам сигнала. Точки без Z-скора пропускаются.
     * P&L фиксируется только при закрытии, переоценки открытой позиции нет.
     */
    public TradeLedger run(SignalSeries signal, Settings settings) {
        String a = signal.getInstrumentA();
        String b = signal.getInstrumentB();
        TradeLedger ledger = new TradeLedger();

        PositionState state = PositionState.FLAT;
        OpenPosition position = null;
        SignalPoint lastEvaluated = null;
        int skipped = 0;

        for (SignalPoint point : signal.getPoints()) {
            if (!point.hasZScore()) {
                skipped++;
                continue;
            }
            lastEvaluated = point;

            Transition transition = positionStateMachine.next(state, position, point, a, b, settings);
            if (transition.getState() != state) {
                logTransition(state, transition, point);
            }
            transition.getClosedTrade().ifPresent(ledger::append);
            state = transition.getState();
            position = transition.getPosition();
        }

        if (state.isOpen()) {
            if (settings.isForceCloseAtEnd() && lastEvaluated != null) {
                Transition transition = positionStateMachine.forceClose(position, lastEvaluated, a, b, settings);
                logTransition(state, transition, lastEvaluated);
                transition.getClosedTrade().ifPresent(ledger::append);
            } else {
                log.info("ℹ️ Позиция {} открыта с {} и не закрыта к концу данных - в журнал не попадает",
                        state, position.getEntryTimestamp());
            }
        }

        log.info("✅ Стратегия {}/{}: сделок {}, точек без сигнала пропущено {}", a, b, ledger.size(), skipped);
        return ledger;
    }

    private void logTransition(PositionState from, Transition transition, SignalPoint point) {
        if (transition.getState().isOpen()) {
            OpenPosition position = transition.getPosition();
            log.debug("🟢 {} -> {} в {} | z={} | A={} | B={}", from, transition.getState(), point.getTimestamp(),
                    point.getZscore(), position.getEntryPriceA(), position.getEntryPriceB());
        } else {
            Trade trade = transition.getTrade();
            log.debug("🔴 {} -> FLAT в {} | z={} | PnL={} | {}", from, point.getTimestamp(), point.getZscore(),
                    trade.getRealizedPnl(), trade.getExitReason().getDescription());
        }
    }
}
