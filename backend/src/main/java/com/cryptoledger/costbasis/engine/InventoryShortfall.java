package com.cryptoledger.costbasis.engine;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Disposal that asked for more units than were held. The matched part still produced realized gains;
 * {@code unmatchedQuantity} is what no lot covered.
 */
public record InventoryShortfall(
        String symbol,
        String sellTransactionId,
        Instant sellDate,
        BigDecimal requestedQuantity,
        BigDecimal unmatchedQuantity
) {
}
