package com.example.backtesting.processors;

import com.example.backtesting.dto.BacktestResult;
import com.example.backtesting.dto.SelectedPair;
import com.example.backtesting.service.CsvExportService;
import com.example.backtesting.service.MetricsService;
import com.example.backtesting.service.PairSelectionService;
import com.example.backtesting.service.PriceDataService;
import com.example.backtesting.service.ReportService;
import com.example.backtesting.service.SignalService;
import com.example.backtesting.service.StrategyService;
import com.example.cointegration.service.PairScreenerService;
import com.example.cointegration.service.ReturnService;
import com.example.shared.models.MetricsSummary;
import com.example.shared.models.PriceBar;
import com.example.shared.models.PriceSeries;
import com.example.shared.models.ReturnMatrix;
import com.example.shared.models.ScreeningReport;
import com.example.shared.models.Settings;
import com.example.shared.models.SignalSeries;
import com.example.shared.models.TradeLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestProcessor {

    private final PriceDataService priceDataService;
    private final ReturnService returnService;
    private final PairScreenerService pairScreenerService;
    private final PairSelectionService pairSelectionService;
    private final SignalService signalService;
    private final StrategyService strategyService;
    private final MetricsService metricsService;
    private final CsvExportService csvExportService;
    private final ReportService reportService;

    public BacktestResult run(Path pricesFile, Path outputDir, Settings settings) {
        long start = System.currentTimeMillis();
        log.info("🚀 Запуск бэктеста: вход={}, выход={}", pricesFile, outputDir);

        BacktestResult result = process(priceDataService.load(pricesFile), settings);
        export(result, outputDir);

        log.info("🏁 Бэктест завершен за {} мс", System.currentTimeMillis() - start);
        return result;
    }

    /**
     * Расчетная часть без файлового вывода. Одинаковые входы дают одинаковый результат.
     */
    public BacktestResult process(List<PriceBar> bars, Settings settings) {
        Map<String, PriceSeries> prices = returnService.buildPriceSeries(bars);
        ReturnMatrix returns = returnService.computeReturns(prices);
        ScreeningReport report = pairScreenerService.screen(returns, prices, settings);

        Optional<SelectedPair> selected = pairSelectionService.select(report, prices, settings);
        if (selected.isEmpty()) {
            log.warn("⚠️ Нет пары для бэктеста: коинтегрированных пар не найдено и пара не задана в настройках");
            return BacktestResult.builder().screeningReport(report).build();
        }

        SelectedPair pair = selected.get();
        SignalSeries signal = signalService.buildSignal(
                prices.get(pair.getInstrumentA()), prices.get(pair.getInstrumentB()),
                pair.getAlpha(), pair.getHedgeRatio(), settings.getRollingWindow());
        TradeLedger ledger = strategyService.run(signal, settings);
        MetricsSummary summary = metricsService.calculate(ledger, pair.getPairName(), settings);

        return BacktestResult.builder()
                .screeningReport(report)
                .pair(pair)
                .signal(signal)
                .ledger(ledger)
                .summary(summary)
                .build();
    }

    public void export(BacktestResult result, Path outputDir) {
        csvExportService.writeCandidates(outputDir, result.getScreeningReport().getCandidates());
        if (!result.hasPair()) {
            return;
        }
        String a = result.getPair().getInstrumentA();
        String b = result.getPair().getInstrumentB();
        csvExportService.writeSignals(outputDir, result.getSignal());
        csvExportService.writeTrades(outputDir, a, b, result.getLedger());
        csvExportService.writeEquityCurve(outputDir, a, b, result.getSummary().getEquityCurve());
        reportService.writeSummaryJson(outputDir, a, b, result.getSummary());
        reportService.logSummary(a, b, result.getSummary());
    }
}
