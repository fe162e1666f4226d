package com.cryptoledger.portfolio;

import java.math.BigDecimal;
import java.util.List;

/**
 * Total value counts only items with a known price.
 */
public record PortfolioValuation(BigDecimal totalValue, String fiatCurrency, List<PortfolioItem> items) {
}
