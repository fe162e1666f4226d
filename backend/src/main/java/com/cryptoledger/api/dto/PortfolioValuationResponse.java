package com.cryptoledger.api.dto;

import com.cryptoledger.common.CurrencyFormatter;
import com.cryptoledger.portfolio.PortfolioItem;
import com.cryptoledger.portfolio.PortfolioValuation;

import java.math.BigDecimal;
import java.util.List;

public record PortfolioValuationResponse(
        BigDecimal totalValue,
        String formattedTotalValue,
        String fiatCurrency,
        List<PortfolioItem> items
) {

    public static PortfolioValuationResponse from(PortfolioValuation valuation) {
        return new PortfolioValuationResponse(
                valuation.totalValue(),
                CurrencyFormatter.format(valuation.totalValue(), valuation.fiatCurrency()),
                valuation.fiatCurrency(),
                valuation.items());
    }
}
