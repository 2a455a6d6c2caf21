package com.example.shared.models;

import com.example.shared.enums.ScreeningOutcome;
import lombok.Builder;
import lombok.Value;

/**
 * Диагностика проверки одной пары (и одного направления регрессии).
 * Для ACCEPTED заполнен candidate.
 */
@Value
@Builder
public class PairEvaluation {
    String instrumentA;
    String instrumentB;
    ScreeningOutcome outcome;
    int overlapCount;
    Double correlation;
    Double pValue;
    String message;
    PairCandidate candidate;

    public boolean isAccepted() {
        return outcome == ScreeningOutcome.ACCEPTED;
    }
}
