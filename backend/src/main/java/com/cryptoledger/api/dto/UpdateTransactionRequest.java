package com.cryptoledger.api.dto;

import com.cryptoledger.domain.TransactionType;
import com.cryptoledger.transaction.TransactionDraft;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * PUT /api/v1/transactions/{id} request body. Only non-null fields are changed.
 */
public record UpdateTransactionRequest(
        String walletId,
        TransactionType type,
        String symbol,

        @Positive(message = "INVALID_TRANSACTION")
        BigDecimal quantity,

        @PositiveOrZero(message = "INVALID_TRANSACTION")
        BigDecimal pricePerUnit,

        String fiatCurrency,

        @PositiveOrZero(message = "INVALID_TRANSACTION")
        BigDecimal fee,

        Instant transactionDate,
        String notes
) {

    public TransactionDraft toDraft() {
        return new TransactionDraft(walletId, type, symbol, quantity, pricePerUnit, fiatCurrency, fee,
                transactionDate, notes);
    }
}
