package com.example.backtesting.service;

import com.example.shared.exceptions.DataException;
import com.example.shared.models.MetricsSummary;
import com.example.shared.utils.FormatUtil;
import com.example.shared.utils.StringUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
@Service
public class ReportService {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public void logSummary(String instrumentA, String instrumentB, MetricsSummary summary) {
        log.info("");
        log.info("==== Trade Statistics for {} vs {} ====", instrumentA, instrumentB);
        log.info("Total trades  : {}", summary.getTotalTrades());
        log.info("Win rate      : {}", FormatUtil.percent(summary.getWinRate()));
        log.info("Average PnL   : {}", FormatUtil.usd(summary.getAveragePnl()));
        log.info("Total PnL     : {}", FormatUtil.usd(summary.getTotalPnl()));
        log.info("Max drawdown  : {}", FormatUtil.usd(summary.getMaxDrawdown()));
        log.info("Sharpe ratio  : {}", FormatUtil.number(summary.getSharpeRatio()));
    }

    public Path writeSummaryJson(Path dir, String instrumentA, String instrumentB, MetricsSummary summary) {
        Path file = dir.resolve("summary_" + StringUtils.pairFileSuffix(instrumentA, instrumentB) + ".json");
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), summary);
            log.info("✅ Сводка сохранена: {}", file);
            return file;
        } catch (IOException e) {
            log.error("❌ Ошибка при записи {}: {}", file, e.getMessage(), e);
            throw new DataException("Не удалось записать " + file, e);
        }
    }
}
