package com.cryptoledger.costbasis.gains;

import com.cryptoledger.costbasis.engine.InventoryShortfall;
import com.cryptoledger.costbasis.engine.RealizedGain;

import java.math.BigDecimal;
import java.util.List;

/**
 * Realized gains split by term, with the contributing gain records and any shortfalls seen during the pass.
 */
public record RealizedGainsSummary(
        BigDecimal shortTermTotal,
        BigDecimal longTermTotal,
        BigDecimal total,
        List<RealizedGain> transactions,
        List<InventoryShortfall> shortfalls
) {

    public RealizedGainsSummary {
        transactions = List.copyOf(transactions);
        shortfalls = List.copyOf(shortfalls);
    }
}
