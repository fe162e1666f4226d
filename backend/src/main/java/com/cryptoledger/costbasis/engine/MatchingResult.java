package com.cryptoledger.costbasis.engine;

import com.cryptoledger.costbasis.lot.Inventory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one FIFO pass: realized gains per symbol (in processing order), residual open lots, and shortfalls.
 */
public record MatchingResult(
        Map<String, List<RealizedGain>> realizedGainsBySymbol,
        Inventory residualInventory,
        List<InventoryShortfall> shortfalls
) {

    public MatchingResult {
        Map<String, List<RealizedGain>> copy = new LinkedHashMap<>();
        realizedGainsBySymbol.forEach((symbol, gains) -> copy.put(symbol, List.copyOf(gains)));
        realizedGainsBySymbol = Collections.unmodifiableMap(copy);
        shortfalls = List.copyOf(shortfalls);
    }

    /** All realized gains, symbol by symbol in first-seen order. */
    public List<RealizedGain> allRealizedGains() {
        return realizedGainsBySymbol.values().stream()
                .flatMap(List::stream)
                .toList();
    }

    public boolean hasShortfalls() {
        return !shortfalls.isEmpty();
    }
}
