package com.cryptoledger.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of ledger transaction. Wire value is the lowercase name (buy, sell, exchange, transfer_in, transfer_out).
 */
public enum TransactionType {
    BUY,
    SELL,
    /** Recorded but has no cost-basis effect. */
    EXCHANGE,
    TRANSFER_IN,
    TRANSFER_OUT;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the wire value or enum name, case-insensitive.
     *
     * @throws IllegalArgumentException for unknown or blank values
     */
    @JsonCreator
    public static TransactionType fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Transaction type is required");
        }
        String normalized = value.strip().toUpperCase(Locale.ROOT);
        for (TransactionType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown transaction type: " + value);
    }
}
