package com.example.shared.models;

import com.example.shared.enums.ExitReasonType;
import com.example.shared.enums.PositionState;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TradeLedgerTest {

    @Test
    void testAppendOnly() {
        TradeLedger ledger = new TradeLedger();
        Trade trade = Trade.builder()
                .entryTimestamp(Instant.EPOCH)
                .exitTimestamp(Instant.EPOCH.plusSeconds(60))
                .direction(PositionState.LONG_SPREAD)
                .realizedPnl(5.0)
                .exitReason(ExitReasonType.EXIT_REASON_BY_Z_EXIT)
                .build();

        ledger.append(trade);

        assertEquals(1, ledger.size());
        assertTrue(trade.isWin());
        assertThrows(UnsupportedOperationException.class, () -> ledger.getTrades().clear());
        assertThrows(IllegalArgumentException.class, () -> ledger.append(null));
    }

    @Test
    void testPositionStates() {
        assertFalse(PositionState.FLAT.isOpen());
        assertTrue(PositionState.LONG_SPREAD.isOpen());
        assertTrue(PositionState.SHORT_SPREAD.isOpen());
    }
}
