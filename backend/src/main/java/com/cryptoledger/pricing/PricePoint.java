package com.cryptoledger.pricing;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One sample of a market chart.
 */
public record PricePoint(Instant timestamp, BigDecimal price) {
}
