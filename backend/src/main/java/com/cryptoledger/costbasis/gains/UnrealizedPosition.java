package com.cryptoledger.costbasis.gains;

import java.math.BigDecimal;

/**
 * Paper gain on the open lots of one symbol at the given current price.
 */
public record UnrealizedPosition(
        String symbol,
        BigDecimal quantity,
        BigDecimal averageCost,
        BigDecimal currentPrice,
        BigDecimal marketValue,
        BigDecimal costBasis,
        BigDecimal unrealizedGain
) {
}
