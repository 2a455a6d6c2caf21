package com.example.backtesting.runners;

import com.example.backtesting.processors.BacktestProcessor;
import com.example.shared.models.Settings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "backtest.runner.enabled", havingValue = "true")
public class BacktestRunner {

    private final BacktestProcessor backtestProcessor;
    private final Settings settings;

    @Value("${backtest.input.prices-file:prices.csv}")
    private String pricesFile;
    @Value("${backtest.output.dir:output}")
    private String outputDir;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("▶️ Приложение готово, запускаем бэктест по {}", pricesFile);
        backtestProcessor.run(Path.of(pricesFile), Path.of(outputDir), settings);
    }
}
