package com.example.backtesting.service;

import com.example.backtesting.dto.SelectedPair;
import com.example.cointegration.dto.RegressionResult;
import com.example.cointegration.service.CointegrationService;
import com.example.shared.exceptions.DataException;
import com.example.shared.models.PairCandidate;
import com.example.shared.models.PriceSeries;
import com.example.shared.models.ScreeningReport;
import com.example.shared.models.Settings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class PairSelectionService {

    private final CointegrationService cointegrationService;
    private final SignalService signalService;

    /**
     * Пара из настроек (beta берется из скрининга, если там есть то же направление, иначе считается заново),
     * либо лучшая пара скрининга.
     */
    public Optional<SelectedPair> select(ScreeningReport report, Map<String, PriceSeries> prices, Settings settings) {
        if (!settings.hasConfiguredPair()) {
            Optional<PairCandidate> top = report.getTopCandidate();
            top.ifPresent(c -> log.info("🎯 Выбрана лучшая пара скрининга {} (beta={}, p-value={})",
                    c.getPairName(), c.getHedgeRatio(), c.getPValue()));
            return top.map(this::fromCandidate);
        }

        String a = settings.getPairA();
        String b = settings.getPairB();
        Optional<PairCandidate> screened = report.getCandidates().stream()
                .filter(c -> c.getInstrumentA().equals(a) && c.getInstrumentB().equals(b))
                .findFirst();
        if (screened.isPresent()) {
            log.info("🎯 Пара из настроек {}/{} найдена среди коинтегрированных", a, b);
            return screened.map(this::fromCandidate);
        }

        boolean reversed = report.getCandidates().stream()
                .anyMatch(c -> c.getInstrumentA().equals(b) && c.getInstrumentB().equals(a));
        if (reversed) {
            log.warn("⚠️ Пара из настроек {}/{} коинтегрирована в обратном направлении {}/{}, hedge ratio рассчитывается заново для {}/{}",
                    a, b, b, a, a, b);
        } else {
            log.warn("⚠️ Пара из настроек {}/{} не прошла скрининг, hedge ratio рассчитывается по ценам", a, b);
        }
        return Optional.of(fitPair(prices, a, b));
    }

    public SelectedPair fitPair(Map<String, PriceSeries> prices, String a, String b) {
        PriceSeries seriesA = prices.get(a);
        PriceSeries seriesB = prices.get(b);
        if (seriesA == null || seriesB == null) {
            throw new DataException("Нет ценового ряда для пары " + a + "/" + b
                    + ": инструмент " + (seriesA == null ? a : b) + " отсутствует во входных данных или исключен из-за ошибок");
        }

        List<Instant> aligned = signalService.alignedTimestamps(seriesA, seriesB);
        if (aligned.size() < 3) {
            throw new DataException("Пара " + a + "/" + b + ": общих наблюдений " + aligned.size() + ", регрессия невозможна");
        }
        double[] y = new double[aligned.size()];
        double[] x = new double[aligned.size()];
        for (int i = 0; i < aligned.size(); i++) {
            y[i] = seriesA.get(aligned.get(i)).getMid();
            x[i] = seriesB.get(aligned.get(i)).getMid();
        }

        RegressionResult regression = cointegrationService.fitRegression(y, x);
        return SelectedPair.builder()
                .instrumentA(a)
                .instrumentB(b)
                .alpha(regression.getAlpha())
                .hedgeRatio(regression.getBeta())
                .fromScreening(false)
                .build();
    }

    private SelectedPair fromCandidate(PairCandidate candidate) {
        return SelectedPair.builder()
                .instrumentA(candidate.getInstrumentA())
                .instrumentB(candidate.getInstrumentB())
                .alpha(candidate.getAlpha())
                .hedgeRatio(candidate.getHedgeRatio())
                .fromScreening(true)
                .build();
    }
}
