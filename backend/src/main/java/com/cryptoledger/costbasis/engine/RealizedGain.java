package com.cryptoledger.costbasis.engine;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Gain or loss realized when a disposal consumed (part of) one lot. gain = proceeds - costBasis.
 */
public record RealizedGain(
        String symbol,
        Instant buyDate,
        Instant sellDate,
        BigDecimal buyPrice,
        BigDecimal sellPrice,
        BigDecimal quantity,
        BigDecimal costBasis,
        BigDecimal proceeds,
        BigDecimal gain,
        GainTerm term,
        long holdingPeriodDays,
        String buyTransactionId,
        String sellTransactionId
) {
}
