package com.cryptoledger.portfolio;

import java.math.BigDecimal;

/**
 * Current holding of one symbol. {@code currentPrice} and {@code currentValue} are null when no price is known.
 */
public record PortfolioItem(String symbol, BigDecimal quantity, BigDecimal currentPrice, String fiatCurrency,
                            BigDecimal currentValue) {

    public static PortfolioItem of(String symbol, BigDecimal quantity, BigDecimal currentPrice, String fiatCurrency) {
        BigDecimal value = currentPrice != null ? quantity.multiply(currentPrice) : null;
        return new PortfolioItem(symbol, quantity, currentPrice, fiatCurrency, value);
    }
}
