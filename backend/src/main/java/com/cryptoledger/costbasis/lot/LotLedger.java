package com.cryptoledger.costbasis.lot;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-symbol lot queues for one processing pass. Symbols keep first-seen order so snapshots are deterministic.
 * A ledger is created by the matching engine for each pass and never shared between passes.
 */
public class LotLedger {

    private final Map<String, LotQueue> queues = new LinkedHashMap<>();

    /** Registers a symbol without adding a lot (used for symbols seen only in disposals or exchanges). */
    public void track(String symbol) {
        queues.computeIfAbsent(symbol, s -> new LotQueue());
    }

    public void append(String symbol, BigDecimal quantity, BigDecimal price, Instant acquiredAt, String sourceTransactionId) {
        queues.computeIfAbsent(symbol, s -> new LotQueue()).append(quantity, price, acquiredAt, sourceTransactionId);
    }

    public Consumption consume(String symbol, BigDecimal quantity) {
        return queues.computeIfAbsent(symbol, s -> new LotQueue()).consume(quantity);
    }

    public LotSnapshot snapshot(String symbol) {
        LotQueue queue = queues.get(symbol);
        return queue == null ? LotSnapshot.EMPTY : queue.snapshot();
    }

    public Inventory inventory() {
        Map<String, List<Lot>> copy = new LinkedHashMap<>();
        queues.forEach((symbol, queue) -> copy.put(symbol, queue.lots()));
        return new Inventory(copy);
    }
}
