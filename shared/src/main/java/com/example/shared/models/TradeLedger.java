package com.example.shared.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Журнал закрытых сделок, только добавление
 */
public class TradeLedger {

    private final List<Trade> trades = new ArrayList<>();

    public void append(Trade trade) {
        if (trade == null) {
            throw new IllegalArgumentException("trade is null");
        }
        trades.add(trade);
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    public int size() {
        return trades.size();
    }

    public boolean isEmpty() {
        return trades.isEmpty();
    }
}
