package com.cryptoledger.api.dto;

import com.cryptoledger.domain.Transaction;
import com.cryptoledger.domain.TransactionType;

import java.math.BigDecimal;
import java.time.Instant;

public record TransactionResponse(
        String id,
        String walletId,
        TransactionType type,
        String symbol,
        BigDecimal quantity,
        BigDecimal pricePerUnit,
        String fiatCurrency,
        BigDecimal fee,
        BigDecimal totalCost,
        Instant transactionDate,
        String notes,
        Instant createdAt
) {

    public static TransactionResponse from(Transaction tx) {
        return new TransactionResponse(
                tx.getId(),
                tx.getWalletId(),
                tx.getType(),
                tx.getSymbol(),
                tx.getQuantity(),
                tx.getPricePerUnit(),
                tx.getFiatCurrency(),
                tx.getFee(),
                tx.getTotalCost(),
                tx.getTransactionDate(),
                tx.getNotes(),
                tx.getCreatedAt());
    }
}
