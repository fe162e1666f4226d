package com.cryptoledger.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed custom queries for transactions.
 */
@Repository
@RequiredArgsConstructor
public class TransactionRepositoryImpl implements TransactionRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<Transaction> findFiltered(String walletId, String symbol, TransactionType type, Instant from, Instant to) {
        Criteria criteria = new Criteria();
        if (walletId != null && !walletId.isBlank()) {
            criteria = criteria.and("walletId").is(walletId);
        }
        if (symbol != null && !symbol.isBlank()) {
            criteria = criteria.and("symbol").is(symbol.strip().toUpperCase(Locale.ROOT));
        }
        if (type != null) {
            criteria = criteria.and("type").is(type);
        }
        if (from != null && to != null) {
            criteria = criteria.and("transactionDate").gte(from).lte(to);
        } else if (from != null) {
            criteria = criteria.and("transactionDate").gte(from);
        } else if (to != null) {
            criteria = criteria.and("transactionDate").lte(to);
        }
        Query query = new Query(criteria).with(Sort.by(Sort.Direction.ASC, "transactionDate"));
        return mongoTemplate.find(query, Transaction.class);
    }

    @Override
    public List<String> findDistinctSymbols() {
        return mongoTemplate.findDistinct(new Query(where("symbol").ne(null)), "symbol", Transaction.class, String.class);
    }
}
