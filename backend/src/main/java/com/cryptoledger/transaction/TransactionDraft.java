package com.cryptoledger.transaction;

import com.cryptoledger.domain.TransactionType;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Field values for a new transaction or a partial update; null means "not provided".
 */
public record TransactionDraft(
        String walletId,
        TransactionType type,
        String symbol,
        BigDecimal quantity,
        BigDecimal pricePerUnit,
        String fiatCurrency,
        BigDecimal fee,
        Instant transactionDate,
        String notes
) {
}
