package com.cryptoledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for transactions. Used by the transaction store service and by the gains/report read path.
 */
public interface TransactionRepository extends MongoRepository<Transaction, String>, TransactionRepositoryCustom {

    List<Transaction> findAllByOrderByTransactionDateAsc();

    List<Transaction> findByWalletIdOrderByTransactionDateAsc(String walletId);
}
