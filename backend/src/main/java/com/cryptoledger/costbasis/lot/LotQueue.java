package com.cryptoledger.costbasis.lot;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * FIFO queue of open lots for one symbol. Head is the oldest lot. Not thread-safe: owned by a single
 * matching pass.
 */
public class LotQueue {

    static final int SCALE = 18;
    static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private final Deque<Lot> lots = new ArrayDeque<>();

    public void append(BigDecimal quantity, BigDecimal price, Instant acquiredAt, String sourceTransactionId) {
        lots.addLast(new Lot(quantity, price, acquiredAt, sourceTransactionId));
    }

    /**
     * Takes {@code quantity} units from the head. A head lot larger than the remainder is split (it stays at
     * the head with reduced quantity); fully used lots are removed. Stops when the queue is empty and reports
     * the uncovered remainder as shortfall.
     */
    public Consumption consume(BigDecimal quantity) {
        List<ConsumedLot> consumed = new ArrayList<>();
        BigDecimal remaining = quantity;
        while (remaining.signum() > 0 && !lots.isEmpty()) {
            Lot head = lots.pollFirst();
            BigDecimal used;
            if (head.quantity().compareTo(remaining) <= 0) {
                used = head.quantity();
            } else {
                used = remaining;
                lots.addFirst(head.withQuantity(head.quantity().subtract(remaining)));
            }
            consumed.add(new ConsumedLot(used, head.price(), head.acquiredAt(), head.sourceTransactionId()));
            remaining = remaining.subtract(used);
        }
        return new Consumption(consumed, remaining.max(BigDecimal.ZERO));
    }

    public BigDecimal totalQuantity() {
        return lots.stream().map(Lot::quantity).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public LotSnapshot snapshot() {
        BigDecimal quantity = totalQuantity();
        if (quantity.signum() <= 0) {
            return LotSnapshot.EMPTY;
        }
        BigDecimal cost = lots.stream().map(Lot::cost).reduce(BigDecimal.ZERO, BigDecimal::add);
        return new LotSnapshot(quantity, cost.divide(quantity, SCALE, ROUNDING));
    }

    public List<Lot> lots() {
        return List.copyOf(lots);
    }

    public boolean isEmpty() {
        return lots.isEmpty();
    }
}
