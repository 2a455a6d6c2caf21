package com.example.backtesting.service;

import com.example.shared.exceptions.DataException;
import com.example.shared.models.PriceBar;
import com.example.shared.models.PriceSeries;
import com.example.shared.models.SignalPoint;
import com.example.shared.models.SignalSeries;
import com.example.shared.utils.StringUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
public class SignalService {

    /**
     * Спред и скользящий Z-скор пары на общих метках времени.
     * Окно только по прошлым и текущей точке; пока окно не заполнено или std == 0, zscore = null.
     */
    public SignalSeries buildSignal(PriceSeries seriesA, PriceSeries seriesB, double alpha, double hedgeRatio, int window) {
        if (window < 2) {
            throw new IllegalArgumentException("Окно должно быть >= 2: " + window);
        }
        List<Instant> aligned = alignedTimestamps(seriesA, seriesB);
        if (aligned.size() < window) {
            throw new DataException(String.format("Пара %s/%s: общих наблюдений %d меньше окна %d, период %s",
                    seriesA.getInstrumentId(), seriesB.getInstrumentId(), aligned.size(), window,
                    StringUtils.range(seriesA.getFirstTimestamp(), seriesA.getLastTimestamp())));
        }

        DescriptiveStatistics rolling = new DescriptiveStatistics(window);
        List<SignalPoint> points = new ArrayList<>(aligned.size());
        int undefinedByStd = 0;

        for (Instant timestamp : aligned) {
            PriceBar barA = seriesA.get(timestamp);
            PriceBar barB = seriesB.get(timestamp);
            double spread = barA.getMid() - hedgeRatio * barB.getMid();
            rolling.addValue(spread);

            Double mean = null;
            Double std = null;
            Double zscore = null;
            if (rolling.getN() == window) {
                mean = rolling.getMean();
                std = rolling.getStandardDeviation();
                if (std > 0.0) {
                    zscore = (spread - mean) / std;
                } else {
                    undefinedByStd++;
                }
            }

            points.add(SignalPoint.builder()
                    .timestamp(timestamp)
                    .priceA(barA.getMid())
                    .priceB(barB.getMid())
                    .bidA(barA.getBid())
                    .askA(barA.getAsk())
                    .bidB(barB.getBid())
                    .askB(barB.getAsk())
                    .spread(spread)
                    .rollingMean(mean)
                    .rollingStd(std)
                    .zscore(zscore)
                    .build());
        }

        if (undefinedByStd > 0) {
            log.warn("⚠️ Пара {}/{}: {} точек без сигнала из-за нулевого std спреда",
                    seriesA.getInstrumentId(), seriesB.getInstrumentId(), undefinedByStd);
        }

        SignalSeries signal = SignalSeries.builder()
                .instrumentA(seriesA.getInstrumentId())
                .instrumentB(seriesB.getInstrumentId())
                .alpha(alpha)
                .hedgeRatio(hedgeRatio)
                .window(window)
                .points(points)
                .build();
        log.info("📉 Сигнал {}: точек {}, с Z-скором {}, beta={}, окно {}",
                signal.getPairName(), points.size(), signal.countDefinedZScores(), hedgeRatio, window);
        return signal;
    }

    public List<Instant> alignedTimestamps(PriceSeries seriesA, PriceSeries seriesB) {
        return seriesA.getBars().keySet().stream()
                .filter(seriesB::contains)
                .collect(Collectors.toList());
    }
}
