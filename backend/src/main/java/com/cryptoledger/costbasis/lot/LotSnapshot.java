package com.cryptoledger.costbasis.lot;

import java.math.BigDecimal;

/**
 * Total open quantity of a symbol and the quantity-weighted average price of its open lots.
 */
public record LotSnapshot(BigDecimal quantity, BigDecimal averageCost) {

    public static final LotSnapshot EMPTY = new LotSnapshot(BigDecimal.ZERO, BigDecimal.ZERO);

    public BigDecimal costBasis() {
        return quantity.multiply(averageCost);
    }
}
