package com.cryptoledger.api.dto;

import com.cryptoledger.common.CurrencyFormatter;
import com.cryptoledger.costbasis.engine.InventoryShortfall;
import com.cryptoledger.costbasis.engine.RealizedGain;
import com.cryptoledger.costbasis.report.TaxReport;

import java.math.BigDecimal;
import java.util.List;

/**
 * GET /api/v1/tax-reports/{year} response. Totals come raw and formatted for display.
 */
public record TaxReportResponse(
        int year,
        String fiatCurrency,
        BigDecimal shortTermGains,
        BigDecimal longTermGains,
        BigDecimal totalGains,
        String formattedShortTermGains,
        String formattedLongTermGains,
        String formattedTotalGains,
        List<RealizedGain> transactions,
        List<InventoryShortfall> shortfalls
) {

    public static TaxReportResponse from(TaxReport report) {
        String ccy = report.getFiatCurrency();
        return new TaxReportResponse(
                report.getYear(),
                ccy,
                report.getShortTermGains(),
                report.getLongTermGains(),
                report.getTotalGains(),
                CurrencyFormatter.format(report.getShortTermGains(), ccy),
                CurrencyFormatter.format(report.getLongTermGains(), ccy),
                CurrencyFormatter.format(report.getTotalGains(), ccy),
                report.getTransactions(),
                report.getShortfalls());
    }
}
