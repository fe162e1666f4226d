package com.cryptoledger.pricing;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Market prices by ticker symbol. Lookups never throw for missing data: unknown symbols are absent from
 * the result.
 */
public interface PriceProvider {

    /**
     * Current price per uppercase symbol in {@code fiatCurrency}. Symbols without a price are not in the map.
     */
    Map<String, BigDecimal> currentPrices(Collection<String> symbols, String fiatCurrency);

    Optional<BigDecimal> historicalPrice(String symbol, LocalDate date, String fiatCurrency);

    /**
     * Daily prices for the last {@code days} days, oldest first; empty when unavailable.
     */
    List<PricePoint> marketChart(String symbol, int days, String fiatCurrency);
}
