package com.cryptoledger.transaction;

import com.cryptoledger.domain.TransactionType;

import java.time.Instant;

/**
 * Optional criteria for listing transactions; null fields do not filter. Date bounds are inclusive.
 */
public record TransactionFilter(String walletId, String symbol, TransactionType type, Instant from, Instant to) {

    public static TransactionFilter all() {
        return new TransactionFilter(null, null, null, null, null);
    }

    public static TransactionFilter forWallet(String walletId) {
        return new TransactionFilter(walletId, null, null, null, null);
    }
}
