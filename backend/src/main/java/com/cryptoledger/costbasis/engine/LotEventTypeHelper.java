package com.cryptoledger.costbasis.engine;

import com.cryptoledger.domain.TransactionType;

/**
 * Classifies transaction types for FIFO lot matching.
 * ACQUISITION opens a lot; DISPOSAL consumes lots and realizes gains; EXCHANGE has no cost-basis effect.
 */
public final class LotEventTypeHelper {

    private LotEventTypeHelper() {
    }

    /** Types that open a new lot at the transaction's unit price. */
    public static boolean isAcquisition(TransactionType type) {
        return type == TransactionType.BUY || type == TransactionType.TRANSFER_IN;
    }

    /** Types that consume lots oldest-first and realize gain against the transaction's unit price. */
    public static boolean isDisposal(TransactionType type) {
        return type == TransactionType.SELL || type == TransactionType.TRANSFER_OUT;
    }

    /**
     * Exchanges are recorded but neither open nor consume lots, so no gain or loss is realized for them.
     * Known limitation kept until exchange legs carry both sides of the trade.
     */
    public static boolean isIgnored(TransactionType type) {
        return type == TransactionType.EXCHANGE;
    }
}
