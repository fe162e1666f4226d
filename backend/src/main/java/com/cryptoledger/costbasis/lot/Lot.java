package com.cryptoledger.costbasis.lot;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Open purchase lot: a quantity acquired at one unit price and date, tagged with the acquiring transaction.
 * Immutable; a partial consumption replaces the head lot with {@link #withQuantity(BigDecimal)}.
 */
public record Lot(BigDecimal quantity, BigDecimal price, Instant acquiredAt, String sourceTransactionId) {

    public Lot {
        Objects.requireNonNull(quantity, "lot quantity must not be null");
        Objects.requireNonNull(price, "lot price must not be null");
        Objects.requireNonNull(acquiredAt, "lot date must not be null");
    }

    public Lot withQuantity(BigDecimal remaining) {
        return new Lot(remaining, price, acquiredAt, sourceTransactionId);
    }

    public BigDecimal cost() {
        return quantity.multiply(price);
    }
}
