package com.cryptoledger.costbasis.report;

import com.cryptoledger.costbasis.engine.InventoryShortfall;
import com.cryptoledger.costbasis.engine.RealizedGain;
import com.cryptoledger.costbasis.gains.GainAggregator;
import com.cryptoledger.costbasis.gains.RealizedGainsSummary;
import com.cryptoledger.domain.Transaction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;

/**
 * Shapes aggregated realized gains into a {@link TaxReport}. File output belongs to a {@link TaxReportExporter}.
 */
@Service
@RequiredArgsConstructor
public class TaxReportFormatter {

    private static final int SCALE = 18;

    private final GainAggregator gainAggregator;

    public TaxReport generateTaxReport(List<Transaction> transactions, int year, String fiatCurrency) {
        RealizedGainsSummary gains = gainAggregator.calculateRealizedGains(transactions, year);
        List<InventoryShortfall> shortfalls = gains.shortfalls().stream()
                .filter(s -> s.sellDate().atZone(ZoneOffset.UTC).getYear() == year)
                .toList();
        return new TaxReport(year, fiatCurrency, gains.shortTermTotal(), gains.longTermTotal(), gains.transactions(),
                shortfalls);
    }

    /**
     * Count, symbols, extremes and averages of the report's realized gains. "Largest loss" is the minimum gain,
     * which is positive when every disposal was profitable.
     */
    public TransactionSummary generateTransactionSummary(TaxReport report) {
        List<RealizedGain> gains = report.getTransactions();
        if (gains.isEmpty()) {
            return TransactionSummary.empty();
        }
        BigDecimal count = BigDecimal.valueOf(gains.size());
        BigDecimal gainSum = gains.stream().map(RealizedGain::gain).reduce(BigDecimal.ZERO, BigDecimal::add);
        long holdingSum = gains.stream().mapToLong(RealizedGain::holdingPeriodDays).sum();
        return new TransactionSummary(
                gains.size(),
                gains.stream().map(RealizedGain::symbol).distinct().sorted().toList(),
                gains.stream().map(RealizedGain::gain).max(Comparator.naturalOrder()).orElse(BigDecimal.ZERO),
                gains.stream().map(RealizedGain::gain).min(Comparator.naturalOrder()).orElse(BigDecimal.ZERO),
                gainSum.divide(count, SCALE, RoundingMode.HALF_UP),
                BigDecimal.valueOf(holdingSum).divide(count, SCALE, RoundingMode.HALF_UP));
    }
}
