package com.example.cointegration.service;

import com.example.cointegration.calculators.CorrelationCalculator;
import com.example.cointegration.dto.CointegrationResult;
import com.example.shared.enums.DirectionPolicy;
import com.example.shared.enums.RankingType;
import com.example.shared.enums.ScreeningOutcome;
import com.example.shared.exceptions.DataException;
import com.example.shared.exceptions.DegenerateStatisticException;
import com.example.shared.models.PairCandidate;
import com.example.shared.models.PairEvaluation;
import com.example.shared.models.PriceBar;
import com.example.shared.models.PriceSeries;
import com.example.shared.models.ReturnMatrix;
import com.example.shared.models.ScreeningReport;
import com.example.shared.models.Settings;
import com.example.shared.utils.FormatUtil;
import com.example.shared.utils.StringUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class PairScreenerService {

    private static final Comparator<PairEvaluation> EVALUATION_ORDER = Comparator
            .comparing(PairEvaluation::getInstrumentA)
            .thenComparing(PairEvaluation::getInstrumentB);

    private final CointegrationService cointegrationService;

    /**
     * Проверяет все неупорядоченные пары инструментов: общий объем наблюдений, корреляция доходностей,
     * коинтеграция уровней цен. Результат не зависит от порядка перебора и числа потоков.
     */
    public ScreeningReport screen(ReturnMatrix returns, Map<String, PriceSeries> prices, Settings settings) {
        long startTime = System.currentTimeMillis();
        List<String> instruments = new ArrayList<>(returns.getInstruments());
        instruments.sort(Comparator.naturalOrder());

        int numInstruments = instruments.size();
        int totalPairs = numInstruments * (numInstruments - 1) / 2;
        if (numInstruments > settings.getLargeUniverseWarning()) {
            log.warn("⚠️ Инструментов {} > {}: перебор всех {} пар (O(n^2)) может занять много времени, пары не отбрасываются",
                    numInstruments, settings.getLargeUniverseWarning(), totalPairs);
        }
        log.info("🚀 Скрининг пар: инструментов {}, пар {}, потоков {}", numInstruments, totalPairs, settings.getScreeningParallelism());

        List<String[]> pairs = new ArrayList<>(totalPairs);
        for (int i = 0; i < numInstruments; i++) {
            for (int j = i + 1; j < numInstruments; j++) {
                pairs.add(new String[]{instruments.get(i), instruments.get(j)});
            }
        }

        List<PairEvaluation> evaluations = settings.getScreeningParallelism() > 1
                ? evaluateInParallel(pairs, returns, prices, settings)
                : pairs.stream()
                .flatMap(p -> evaluatePair(p[0], p[1], returns, prices, settings).stream())
                .collect(Collectors.toList());
        evaluations.sort(EVALUATION_ORDER);

        List<PairCandidate> candidates = evaluations.stream()
                .filter(PairEvaluation::isAccepted)
                .map(PairEvaluation::getCandidate)
                .sorted(rankingComparator(settings.getRanking()))
                .collect(Collectors.toList());

        ScreeningReport report = ScreeningReport.builder()
                .instrumentCount(numInstruments)
                .evaluatedPairs(totalPairs)
                .candidates(candidates)
                .evaluations(evaluations)
                .build();

        logReport(report, settings, startTime);
        return report;
    }

    /**
     * Оценка одной пары. Ошибки этапа не пробрасываются: пара исключается с соответствующим outcome.
     */
    public List<PairEvaluation> evaluatePair(String a, String b, ReturnMatrix returns,
                                             Map<String, PriceSeries> prices, Settings settings) {
        NavigableMap<Instant, Double> returnsA = returns.getReturns(a);
        NavigableMap<Instant, Double> returnsB = returns.getReturns(b);
        List<Instant> overlap = returnsA.keySet().stream()
                .filter(returnsB::containsKey)
                .collect(Collectors.toList());

        if (overlap.size() < settings.getMinOverlap()) {
            return List.of(rejected(a, b, ScreeningOutcome.INSUFFICIENT_OVERLAP, overlap.size(), null, null,
                    "Общих наблюдений " + overlap.size() + " < " + settings.getMinOverlap()));
        }

        try {
            double[] xa = new double[overlap.size()];
            double[] xb = new double[overlap.size()];
            for (int i = 0; i < overlap.size(); i++) {
                xa[i] = returnsA.get(overlap.get(i));
                xb[i] = returnsB.get(overlap.get(i));
            }

            double correlation = CorrelationCalculator.calculate(xa, xb);
            if (Math.abs(correlation) <= settings.getMinCorrelation()) {
                return List.of(rejected(a, b, ScreeningOutcome.LOW_CORRELATION, overlap.size(), correlation, null,
                        String.format("|corr| %.4f <= %.4f", correlation, settings.getMinCorrelation())));
            }

            double[] priceA = midPrices(prices, a, overlap);
            double[] priceB = midPrices(prices, b, overlap);

            if (settings.getDirectionPolicy() == DirectionPolicy.LEXICOGRAPHIC) {
                return List.of(evaluateDirection(a, b, priceA, priceB, correlation, overlap.size(), settings));
            }

            PairEvaluation forward = evaluateDirection(a, b, priceA, priceB, correlation, overlap.size(), settings);
            PairEvaluation backward = evaluateDirection(b, a, priceB, priceA, correlation, overlap.size(), settings);
            if (settings.getDirectionPolicy() == DirectionPolicy.BOTH) {
                return List.of(forward, backward);
            }
            return List.of(chooseDirection(forward, backward));

        } catch (DegenerateStatisticException e) {
            log.debug("Пара {}/{}: вырожденная статистика - {}", a, b, e.getMessage());
            return List.of(rejected(a, b, ScreeningOutcome.DEGENERATE, overlap.size(), null, null, e.getMessage()));
        } catch (Exception e) {
            log.error("❌ Пара {}/{} исключена: {} (наблюдений {}, период {})", a, b, e.getMessage(),
                    overlap.size(), StringUtils.range(overlap.get(0), overlap.get(overlap.size() - 1)), e);
            return List.of(rejected(a, b, ScreeningOutcome.FAILED, overlap.size(), null, null, e.getMessage()));
        }
    }

    public Comparator<PairCandidate> rankingComparator(RankingType ranking) {
        Comparator<PairCandidate> byCorrelation = Comparator.comparingDouble((PairCandidate c) -> Math.abs(c.getCorrelation())).reversed();
        Comparator<PairCandidate> byPValue = Comparator.comparingDouble(PairCandidate::getPValue);
        Comparator<PairCandidate> primary = ranking == RankingType.P_VALUE
                ? byPValue.thenComparing(byCorrelation)
                : byCorrelation.thenComparing(byPValue);
        return primary
                .thenComparing(PairCandidate::getInstrumentA)
                .thenComparing(PairCandidate::getInstrumentB);
    }

    private List<PairEvaluation> evaluateInParallel(List<String[]> pairs, ReturnMatrix returns,
                                                    Map<String, PriceSeries> prices, Settings settings) {
        ExecutorService executorService = Executors.newFixedThreadPool(settings.getScreeningParallelism());
        try {
            List<CompletableFuture<List<PairEvaluation>>> futures = pairs.stream()
                    .map(p -> CompletableFuture.supplyAsync(() -> evaluatePair(p[0], p[1], returns, prices, settings), executorService))
                    .collect(Collectors.toList());
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            List<PairEvaluation> result = new ArrayList<>();
            futures.forEach(f -> result.addAll(f.join()));
            return result;
        } finally {
            executorService.shutdown();
        }
    }

    private PairEvaluation evaluateDirection(String y, String x, double[] priceY, double[] priceX,
                                             double correlation, int overlapCount, Settings settings) {
        try {
            CointegrationResult result = cointegrationService.testCointegration(priceY, priceX);
            double pValue = result.getPValue();
            if (pValue >= settings.getSignificanceLevel()) {
                return rejected(y, x, ScreeningOutcome.NOT_COINTEGRATED, overlapCount, correlation, pValue,
                        String.format("p-value %.4f >= %.4f", pValue, settings.getSignificanceLevel()));
            }

            PairCandidate candidate = PairCandidate.builder()
                    .instrumentA(y)
                    .instrumentB(x)
                    .correlation(correlation)
                    .alpha(result.getAlpha())
                    .hedgeRatio(result.getBeta())
                    .residualStd(result.getRegression().getResidualStd())
                    .adfStatistic(result.getAdf().getTestStatistic())
                    .pValue(pValue)
                    .usedLag(result.getAdf().getUsedLag())
                    .overlapCount(overlapCount)
                    .build();

            return PairEvaluation.builder()
                    .instrumentA(y)
                    .instrumentB(x)
                    .outcome(ScreeningOutcome.ACCEPTED)
                    .overlapCount(overlapCount)
                    .correlation(correlation)
                    .pValue(pValue)
                    .candidate(candidate)
                    .build();
        } catch (DegenerateStatisticException e) {
            return rejected(y, x, ScreeningOutcome.DEGENERATE, overlapCount, correlation, null, e.getMessage());
        }
    }

    /**
     * Направление с меньшим p-value; при равенстве - прямое (A < B)
     */
    private PairEvaluation chooseDirection(PairEvaluation forward, PairEvaluation backward) {
        if (backward.getPValue() == null) {
            return forward;
        }
        if (forward.getPValue() == null) {
            return backward;
        }
        return backward.getPValue() < forward.getPValue() ? backward : forward;
    }

    private double[] midPrices(Map<String, PriceSeries> prices, String instrumentId, List<Instant> timestamps) {
        PriceSeries series = prices.get(instrumentId);
        if (series == null) {
            throw new DataException("Нет ценового ряда для инструмента " + instrumentId);
        }
        double[] result = new double[timestamps.size()];
        for (int i = 0; i < timestamps.size(); i++) {
            PriceBar bar = series.get(timestamps.get(i));
            if (bar == null) {
                throw new DataException("Инструмент " + instrumentId + ": нет цены в " + timestamps.get(i));
            }
            result[i] = bar.getMid();
        }
        return result;
    }

    private PairEvaluation rejected(String a, String b, ScreeningOutcome outcome, int overlapCount,
                                    Double correlation, Double pValue, String message) {
        return PairEvaluation.builder()
                .instrumentA(a)
                .instrumentB(b)
                .outcome(outcome)
                .overlapCount(overlapCount)
                .correlation(correlation)
                .pValue(pValue)
                .message(message)
                .build();
    }

    private void logReport(ScreeningReport report, Settings settings, long startTime) {
        log.info("📊 Итоги скрининга: {}", report.countByOutcome());
        List<PairCandidate> candidates = report.getCandidates();
        if (candidates.isEmpty()) {
            log.warn("⚠️ Коинтегрированные пары не найдены");
        } else {
            log.info("🏆 Топ коинтегрированных пар:");
            candidates.stream().limit(5).forEach(c -> log.info("   {} | corr={} | beta={} | p-value={} | наблюдений {}",
                    c.getPairName(), FormatUtil.number(c.getCorrelation()), c.getHedgeRatio(),
                    FormatUtil.color(c.getPValue(), settings.getSignificanceLevel()), c.getOverlapCount()));
        }
        long duration = System.currentTimeMillis() - startTime;
        log.info("⏱️ Скрининг закончил работу за {} сек. Найдено {} пар", duration / 1000.0, candidates.size());
    }
}
