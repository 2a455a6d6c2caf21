package com.example.shared.models;

import com.example.shared.enums.ScreeningOutcome;
import lombok.Builder;
import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Value
@Builder
public class ScreeningReport {
    int instrumentCount;
    int evaluatedPairs;
    List<PairCandidate> candidates;
    List<PairEvaluation> evaluations;

    public Optional<PairCandidate> getTopCandidate() {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    public Map<ScreeningOutcome, Long> countByOutcome() {
        Map<ScreeningOutcome, Long> counts = new EnumMap<>(ScreeningOutcome.class);
        for (PairEvaluation evaluation : evaluations) {
            counts.merge(evaluation.getOutcome(), 1L, Long::sum);
        }
        return counts;
    }
}
