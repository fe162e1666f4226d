package com.cryptoledger.costbasis.lot;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Slice of a lot taken by one consumption: quantity taken plus the lot's price, date and source transaction.
 */
public record ConsumedLot(BigDecimal quantity, BigDecimal lotPrice, Instant lotDate, String lotSourceTransactionId) {
}
