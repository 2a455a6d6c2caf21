package com.example.backtesting.service;

import com.example.shared.exceptions.DataException;
import com.example.shared.models.PriceBar;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PriceDataServiceTest {

    private final PriceDataService priceDataService = new PriceDataService();

    @Test
    void testReadNormalizedTable() throws Exception {
        String csv = "timestamp,id,bid,ask,mid\n"
                + "2024-01-01T00:00:00Z,lme_cu,8000.0,8002.0,8001.0\n"
                + "2024-01-01 00:01:00,shfe_cu,69000,69010,\n"
                + "\n"
                + "1704067320000,lme_cu,8001,8003,8002\n";

        List<PriceBar> bars = priceDataService.read(new StringReader(csv));

        assertEquals(3, bars.size());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), bars.get(0).getTimestamp());
        assertEquals("lme_cu", bars.get(0).getInstrumentId());
        assertEquals(8001.0, bars.get(0).getMid());

        // пустой mid = (bid + ask) / 2, локальное время как UTC
        assertEquals(69005.0, bars.get(1).getMid());
        assertEquals(Instant.parse("2024-01-01T00:01:00Z"), bars.get(1).getTimestamp());

        assertEquals(Instant.parse("2024-01-01T00:02:00Z"), bars.get(2).getTimestamp());
    }

    @Test
    void testColumnOrderAndMissingMidColumn() throws Exception {
        String csv = "\uFEFFID,Ask,Bid,Timestamp\n"
                + "x,11,9,2024-01-01T00:00:00+03:00\n";

        PriceBar bar = priceDataService.read(new StringReader(csv)).get(0);

        assertEquals("x", bar.getInstrumentId());
        assertEquals(9.0, bar.getBid());
        assertEquals(11.0, bar.getAsk());
        assertEquals(10.0, bar.getMid());
        assertEquals(Instant.parse("2023-12-31T21:00:00Z"), bar.getTimestamp());
    }

    @Test
    void testMissingRequiredColumn() {
        String csv = "timestamp,id,bid\n2024-01-01T00:00:00Z,x,1\n";

        DataException e = assertThrows(DataException.class, () -> priceDataService.read(new StringReader(csv)));
        assertTrue(e.getMessage().contains("ask"));
    }

    @Test
    void testMalformedLineReportsLineNumber() {
        String csv = "timestamp,id,bid,ask\n"
                + "2024-01-01T00:00:00Z,x,1,2\n"
                + "not-a-date,x,1,2\n";

        DataException e = assertThrows(DataException.class, () -> priceDataService.read(new StringReader(csv)));
        assertTrue(e.getMessage().contains("Строка 3"));
    }

    @Test
    void testEmptyFile() {
        assertThrows(DataException.class, () -> priceDataService.read(new StringReader("")));
    }

    @Test
    void testLoadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("prices.csv");
        Files.writeString(file, "timestamp,id,bid,ask,mid\n2024-01-01T00:00:00Z,x,1,3,2\n");

        assertEquals(1, priceDataService.load(file).size());
        assertThrows(DataException.class, () -> priceDataService.load(dir.resolve("missing.csv")));
    }
}
