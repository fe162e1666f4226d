package com.cryptoledger.costbasis.lot;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of {@link LotQueue#consume(BigDecimal)}: consumed slices oldest first, and the part of the
 * request no lot could cover (zero when fully matched).
 */
public record Consumption(List<ConsumedLot> consumed, BigDecimal shortfall) {

    public Consumption {
        consumed = List.copyOf(consumed);
        shortfall = shortfall == null ? BigDecimal.ZERO : shortfall;
    }

    public boolean hasShortfall() {
        return shortfall.signum() > 0;
    }

    public BigDecimal consumedQuantity() {
        return consumed.stream()
                .map(ConsumedLot::quantity)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
