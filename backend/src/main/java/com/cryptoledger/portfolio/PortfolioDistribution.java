package com.cryptoledger.portfolio;

import java.math.BigDecimal;
import java.util.List;

/**
 * Share of portfolio value per symbol, largest first.
 */
public record PortfolioDistribution(BigDecimal totalValue, String fiatCurrency, List<DistributionEntry> distribution) {
}
