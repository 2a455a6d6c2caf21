package com.example.backtesting.service;

import com.example.shared.exceptions.DataException;
import com.example.shared.models.PriceBar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Загрузка нормализованной таблицы цен (timestamp,id,bid,ask,mid), подготовленной внешним нормализатором
 */
@Slf4j
@Service
public class PriceDataService {

    private static final List<String> REQUIRED_COLUMNS = List.of("timestamp", "id", "bid", "ask");

    public List<PriceBar> load(Path path) {
        if (!Files.exists(path)) {
            throw new DataException("Файл цен не найден: " + path.toAbsolutePath());
        }
        log.info("📂 Загружаем цены из {}", path.toAbsolutePath());
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<PriceBar> bars = read(reader);
            log.info("✅ Загружено {} строк цен", bars.size());
            return bars;
        } catch (IOException e) {
            throw new DataException("Ошибка чтения файла цен " + path + ": " + e.getMessage(), e);
        }
    }

    public List<PriceBar> read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source);
        String header = reader.readLine();
        if (header == null) {
            throw new DataException("Пустой файл цен");
        }
        Map<String, Integer> columns = parseHeader(header);

        List<PriceBar> bars = new ArrayList<>();
        String line;
        int lineNumber = 1;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            bars.add(parseLine(line, columns, lineNumber));
        }
        return bars;
    }

    private Map<String, Integer> parseHeader(String header) {
        String[] names = header.replace("\uFEFF", "").split(",", -1);
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < names.length; i++) {
            columns.put(names[i].trim().toLowerCase(Locale.ROOT), i);
        }
        for (String required : REQUIRED_COLUMNS) {
            if (!columns.containsKey(required)) {
                throw new DataException("В файле цен нет колонки " + required + ", заголовок: " + header);
            }
        }
        return columns;
    }

    private PriceBar parseLine(String line, Map<String, Integer> columns, int lineNumber) {
        String[] values = line.split(",", -1);
        try {
            String id = value(values, columns.get("id"));
            Instant timestamp = parseTimestamp(value(values, columns.get("timestamp")));
            double bid = Double.parseDouble(value(values, columns.get("bid")));
            double ask = Double.parseDouble(value(values, columns.get("ask")));
            String midValue = columns.containsKey("mid") ? value(values, columns.get("mid")) : "";
            double mid = midValue.isEmpty() ? (bid + ask) / 2.0 : Double.parseDouble(midValue);

            return PriceBar.builder()
                    .timestamp(timestamp)
                    .instrumentId(id)
                    .bid(bid)
                    .ask(ask)
                    .mid(mid)
                    .build();
        } catch (NumberFormatException | DateTimeParseException | ArrayIndexOutOfBoundsException e) {
            throw new DataException("Строка " + lineNumber + " файла цен некорректна: '" + line + "' (" + e.getMessage() + ")", e);
        }
    }

    private String value(String[] values, int index) {
        return values[index].trim();
    }

    /**
     * ISO-8601 (Instant или со смещением), локальное время трактуется как UTC, либо epoch millis
     */
    Instant parseTimestamp(String value) {
        if (value.isEmpty()) {
            throw new DateTimeParseException("пустой timestamp", value, 0);
        }
        if (value.chars().allMatch(Character::isDigit)) {
            return Instant.ofEpochMilli(Long.parseLong(value));
        }
        String normalized = value.replace(' ', 'T');
        try {
            return OffsetDateTime.parse(normalized).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(normalized).toInstant(ZoneOffset.UTC);
        }
    }
}
