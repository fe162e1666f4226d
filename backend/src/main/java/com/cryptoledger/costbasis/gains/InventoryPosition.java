package com.cryptoledger.costbasis.gains;

import com.cryptoledger.costbasis.lot.Lot;

import java.math.BigDecimal;
import java.util.List;

/**
 * Open holding of one symbol: total quantity, average lot price and the open lots oldest first.
 */
public record InventoryPosition(String symbol, BigDecimal quantity, BigDecimal averageCost, List<Lot> lots) {

    public InventoryPosition {
        lots = List.copyOf(lots);
    }
}
