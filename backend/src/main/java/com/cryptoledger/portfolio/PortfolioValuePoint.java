package com.cryptoledger.portfolio;

import java.math.BigDecimal;
import java.time.LocalDate;

public record PortfolioValuePoint(LocalDate date, BigDecimal value) {
}
