package com.cryptoledger.costbasis.lot;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of open lots per symbol at the end of a pass. Recomputable from the transaction log,
 * never persisted.
 */
public final class Inventory {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private final Map<String, List<Lot>> lotsBySymbol;

    public Inventory(Map<String, List<Lot>> lotsBySymbol) {
        Map<String, List<Lot>> copy = new LinkedHashMap<>();
        lotsBySymbol.forEach((symbol, lots) -> copy.put(symbol, List.copyOf(lots)));
        this.lotsBySymbol = Collections.unmodifiableMap(copy);
    }

    public static Inventory empty() {
        return new Inventory(Map.of());
    }

    public Set<String> symbols() {
        return lotsBySymbol.keySet();
    }

    public List<Lot> lots(String symbol) {
        return lotsBySymbol.getOrDefault(symbol, List.of());
    }

    public BigDecimal quantity(String symbol) {
        return lots(symbol).stream().map(Lot::quantity).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /** Quantity-weighted mean lot price; zero when nothing is held. */
    public BigDecimal averageCost(String symbol) {
        BigDecimal quantity = quantity(symbol);
        if (quantity.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal cost = lots(symbol).stream().map(Lot::cost).reduce(BigDecimal.ZERO, BigDecimal::add);
        return cost.divide(quantity, SCALE, ROUNDING);
    }

    public Map<String, List<Lot>> asMap() {
        return lotsBySymbol;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return lotsBySymbol.equals(((Inventory) o).lotsBySymbol);
    }

    @Override
    public int hashCode() {
        return lotsBySymbol.hashCode();
    }

    @Override
    public String toString() {
        return "Inventory" + lotsBySymbol;
    }
}
