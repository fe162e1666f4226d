package com.cryptoledger.portfolio;

import java.math.BigDecimal;

public record DistributionEntry(String symbol, BigDecimal value, BigDecimal percentage) {
}
