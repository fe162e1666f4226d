package com.cryptoledger.api.dto;

import com.cryptoledger.domain.TransactionType;
import com.cryptoledger.transaction.TransactionDraft;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * POST /api/v1/transactions request body. Omitted date means now; omitted currency means USD.
 */
public record CreateTransactionRequest(
        String walletId,

        @NotNull(message = "INVALID_TRANSACTION")
        TransactionType type,

        @NotBlank(message = "INVALID_TRANSACTION")
        String symbol,

        @NotNull(message = "INVALID_TRANSACTION")
        @Positive(message = "INVALID_TRANSACTION")
        BigDecimal quantity,

        @NotNull(message = "INVALID_TRANSACTION")
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
