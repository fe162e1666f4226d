package com.cryptoledger.costbasis.report;

import java.math.BigDecimal;
import java.util.List;

/**
 * Descriptive statistics over the realized gains of a report.
 */
public record TransactionSummary(
        int transactionCount,
        List<String> symbols,
        BigDecimal largestGain,
        BigDecimal largestLoss,
        BigDecimal averageGain,
        BigDecimal averageHoldingPeriodDays
) {

    public static TransactionSummary empty() {
        return new TransactionSummary(0, List.of(), BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }
}
