package com.cryptoledger.costbasis.query;

import com.cryptoledger.costbasis.gains.GainAggregator;
import com.cryptoledger.costbasis.gains.InventoryPosition;
import com.cryptoledger.costbasis.gains.RealizedGainsSummary;
import com.cryptoledger.costbasis.gains.UnrealizedGainsSummary;
import com.cryptoledger.costbasis.report.TaxReport;
import com.cryptoledger.costbasis.report.TaxReportFormatter;
import com.cryptoledger.costbasis.report.TransactionSummary;
import com.cryptoledger.domain.Transaction;
import com.cryptoledger.pricing.PriceProvider;
import com.cryptoledger.transaction.TransactionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Read side for gains and tax reports: loads the stored history (all wallets or one), fetches prices where
 * needed, and hands both to the pure cost-basis components.
 */
@Service
@RequiredArgsConstructor
public class GainsQueryService {

    private final TransactionService transactionService;
    private final GainAggregator gainAggregator;
    private final TaxReportFormatter taxReportFormatter;
    private final PriceProvider priceProvider;

    public RealizedGainsSummary realizedGains(String walletId, Integer year) {
        return gainAggregator.calculateRealizedGains(transactionService.history(walletId), year);
    }

    /**
     * Prices are fetched in {@code fiatCurrency} for the symbols still held; symbols without a price are left out.
     */
    public UnrealizedGainsSummary unrealizedGains(String walletId, String fiatCurrency) {
        List<Transaction> history = transactionService.history(walletId);
        List<String> held = gainAggregator.currentInventory(history).stream()
                .map(InventoryPosition::symbol)
                .toList();
        Map<String, BigDecimal> prices = held.isEmpty() ? Map.of() : priceProvider.currentPrices(held, fiatCurrency);
        return gainAggregator.calculateUnrealizedGains(history, prices);
    }

    public List<InventoryPosition> inventory(String walletId) {
        return gainAggregator.currentInventory(transactionService.history(walletId));
    }

    public TaxReport taxReport(String walletId, int year, String fiatCurrency) {
        return taxReportFormatter.generateTaxReport(transactionService.history(walletId), year, fiatCurrency);
    }

    public TransactionSummary taxReportSummary(String walletId, int year, String fiatCurrency) {
        return taxReportFormatter.generateTransactionSummary(taxReport(walletId, year, fiatCurrency));
    }
}
