package com.cryptoledger.costbasis.engine;

import com.cryptoledger.costbasis.lot.ConsumedLot;
import com.cryptoledger.costbasis.lot.Consumption;
import com.cryptoledger.costbasis.lot.LotLedger;
import com.cryptoledger.domain.Transaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * FIFO lot-matching engine. Replays the full transaction history in date order against a fresh
 * {@link LotLedger} on every call: acquisitions open lots, disposals consume the oldest lots and emit one
 * {@link RealizedGain} per consumed slice. Holds no state between calls, so concurrent use is safe.
 * <p>
 * Inputs are assumed validated (positive quantity, non-negative price); a missing date is rejected.
 */
@Component
@Slf4j
public class FifoMatchingEngine {

    /**
     * Process all transactions. The input list is not modified; ties on date keep input order.
     */
    public MatchingResult processTransactions(List<Transaction> transactions) {
        List<Transaction> timeline = new ArrayList<>(transactions);
        for (Transaction tx : timeline) {
            if (tx.getTransactionDate() == null) {
                throw new IllegalArgumentException("Transaction " + tx.getId() + " has no transaction date");
            }
        }
        timeline.sort(Comparator.comparing(Transaction::getTransactionDate));

        LotLedger ledger = new LotLedger();
        Map<String, List<RealizedGain>> realized = new LinkedHashMap<>();
        List<InventoryShortfall> shortfalls = new ArrayList<>();

        for (Transaction tx : timeline) {
            String symbol = tx.getSymbol();
            ledger.track(symbol);
            List<RealizedGain> symbolGains = realized.computeIfAbsent(symbol, s -> new ArrayList<>());

            if (LotEventTypeHelper.isAcquisition(tx.getType())) {
                ledger.append(symbol, tx.getQuantity(), tx.getPricePerUnit(), tx.getTransactionDate(), tx.getId());
            } else if (LotEventTypeHelper.isDisposal(tx.getType())) {
                Consumption consumption = ledger.consume(symbol, tx.getQuantity());
                for (ConsumedLot slice : consumption.consumed()) {
                    symbolGains.add(toRealizedGain(symbol, tx, slice));
                }
                if (consumption.hasShortfall()) {
                    log.warn("Disposal {} of {} {} exceeds holdings; {} unmatched",
                            tx.getId(), tx.getQuantity(), symbol, consumption.shortfall());
                    shortfalls.add(new InventoryShortfall(symbol, tx.getId(), tx.getTransactionDate(),
                            tx.getQuantity(), consumption.shortfall()));
                }
            } else if (LotEventTypeHelper.isIgnored(tx.getType())) {
                log.debug("Exchange {} for {} has no cost-basis effect", tx.getId(), symbol);
            }
        }

        return new MatchingResult(realized, ledger.inventory(), shortfalls);
    }

    static long holdingPeriodDays(Instant buyDate, Instant sellDate) {
        return ChronoUnit.DAYS.between(buyDate, sellDate);
    }

    private static RealizedGain toRealizedGain(String symbol, Transaction sell, ConsumedLot slice) {
        BigDecimal costBasis = slice.quantity().multiply(slice.lotPrice());
        BigDecimal proceeds = slice.quantity().multiply(sell.getPricePerUnit());
        long days = holdingPeriodDays(slice.lotDate(), sell.getTransactionDate());
        return new RealizedGain(
                symbol,
                slice.lotDate(),
                sell.getTransactionDate(),
                slice.lotPrice(),
                sell.getPricePerUnit(),
                slice.quantity(),
                costBasis,
                proceeds,
                proceeds.subtract(costBasis),
                GainTerm.forHoldingPeriod(days),
                days,
                slice.lotSourceTransactionId(),
                sell.getId());
    }
}
