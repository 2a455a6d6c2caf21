package com.example.backtesting.service;

import com.example.backtesting.TestPriceData;
import com.example.backtesting.dto.SelectedPair;
import com.example.cointegration.service.ADFService;
import com.example.cointegration.service.CointegrationService;
import com.example.cointegration.service.ReturnService;
import com.example.shared.exceptions.DataException;
import com.example.shared.models.PairCandidate;
import com.example.shared.models.PriceSeries;
import com.example.shared.models.ScreeningReport;
import com.example.shared.models.Settings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PairSelectionServiceTest {

    private PairSelectionService selectionService;
    private Map<String, PriceSeries> prices;

    @BeforeEach
    void setUp() {
        selectionService = new PairSelectionService(new CointegrationService(new ADFService()), new SignalService());
        prices = new ReturnService().buildPriceSeries(TestPriceData.cointegratedMarket(300));
    }

    private ScreeningReport report(PairCandidate... candidates) {
        return ScreeningReport.builder()
                .instrumentCount(3)
                .evaluatedPairs(3)
                .candidates(List.of(candidates))
                .evaluations(List.of())
                .build();
    }

    private PairCandidate candidate(String a, String b, double beta) {
        return PairCandidate.builder().instrumentA(a).instrumentB(b).alpha(1.0).hedgeRatio(beta).pValue(0.01).correlation(0.9).build();
    }

    @Test
    void testTopCandidateSelectedWhenNoPairConfigured() {
        Optional<SelectedPair> pair = selectionService.select(
                report(candidate("lme_cu", "shfe_cu", 0.5), candidate("a", "b", 3.0)), prices, Settings.builder().build());

        assertTrue(pair.isPresent());
        assertEquals("lme_cu/shfe_cu", pair.get().getPairName());
        assertEquals(0.5, pair.get().getHedgeRatio());
        assertTrue(pair.get().isFromScreening());
    }

    @Test
    void testNothingSelectedWithoutCandidates() {
        assertTrue(selectionService.select(report(), prices, Settings.builder().build()).isEmpty());
    }

    @Test
    void testConfiguredPairUsesScreenedHedgeRatio() {
        Settings settings = Settings.builder().pairA("lme_cu").pairB("shfe_cu").build();

        SelectedPair pair = selectionService.select(
                report(candidate("a", "b", 3.0), candidate("lme_cu", "shfe_cu", 0.49)), prices, settings).orElseThrow();

        assertEquals(0.49, pair.getHedgeRatio());
        assertTrue(pair.isFromScreening());
    }

    @Test
    void testConfiguredPairFittedWhenNotScreened() {
        Settings settings = Settings.builder().pairA("lme_cu").pairB("shfe_cu").build();

        SelectedPair pair = selectionService.select(report(), prices, settings).orElseThrow();

        assertFalse(pair.isFromScreening());
        assertEquals(0.5, pair.getHedgeRatio(), 0.02);
    }

    @Test
    void testConfiguredPairScreenedOnlyInReverseDirection() {
        Settings settings = Settings.builder().pairA("shfe_cu").pairB("lme_cu").build();

        SelectedPair pair = selectionService.select(report(candidate("lme_cu", "shfe_cu", 0.5)), prices, settings).orElseThrow();

        // beta screening для lme_cu/shfe_cu не подходит, считается для shfe_cu/lme_cu
        assertFalse(pair.isFromScreening());
        assertEquals("shfe_cu/lme_cu", pair.getPairName());
        assertEquals(2.0, pair.getHedgeRatio(), 0.1);
    }

    @Test
    void testConfiguredPairWithUnknownInstrument() {
        Settings settings = Settings.builder().pairA("lme_cu").pairB("nope").build();

        assertThrows(DataException.class, () -> selectionService.select(report(), prices, settings));
    }
}
