package com.cryptoledger.domain;

import java.time.Instant;
import java.util.List;

/**
 * Filtered queries over transactions that derived queries cannot express (all filters optional).
 */
public interface TransactionRepositoryCustom {

    List<Transaction> findFiltered(String walletId, String symbol, TransactionType type, Instant from, Instant to);

    List<String> findDistinctSymbols();
}
