package com.cryptoledger.costbasis.report;

import com.cryptoledger.costbasis.engine.FifoMatchingEngine;
import com.cryptoledger.costbasis.engine.InventoryShortfall;
import com.cryptoledger.costbasis.gains.GainAggregator;
import com.cryptoledger.domain.Transaction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.cryptoledger.costbasis.TestTransactions.buy;
import static com.cryptoledger.costbasis.TestTransactions.sell;
import static org.assertj.core.api.Assertions.assertThat;

class TaxReportFormatterTest {

    private final TaxReportFormatter formatter = new TaxReportFormatter(new GainAggregator(new FifoMatchingEngine()));

    private static List<Transaction> history() {
        return List.of(
                buy("b1", "BTC", "1", "10000", "2021-01-01"),
                buy("b2", "ETH", "10", "1000", "2022-11-01"),
                sell("s1", "BTC", "1", "16000", "2022-06-01"),
                sell("s2", "ETH", "5", "800", "2022-12-01"));
    }

    @Test
    @DisplayName("report carries year, uppercased currency, term totals and the year's gains")
    void generatesReport() {
        TaxReport report = formatter.generateTaxReport(history(), 2022, "eur");

        assertThat(report.getYear()).isEqualTo(2022);
        assertThat(report.getFiatCurrency()).isEqualTo("EUR");
        assertThat(report.getLongTermGains()).isEqualByComparingTo("6000");
        assertThat(report.getShortTermGains()).isEqualByComparingTo("-1000");
        assertThat(report.getTotalGains()).isEqualByComparingTo("5000");
        assertThat(report.getTransactions()).hasSize(2);
    }

    @Test
    @DisplayName("year without sales produces an empty report with zero totals")
    void emptyYear() {
        TaxReport report = formatter.generateTaxReport(history(), 2020, "USD");

        assertThat(report.getTransactions()).isEmpty();
        assertThat(report.getTotalGains()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("report lists the year's oversold disposals next to their matched gains")
    void reportCarriesShortfalls() {
        List<Transaction> oversold = List.of(
                buy("b1", "ETH", "3", "1000", "2021-01-01"),
                sell("s1", "ETH", "5", "1500", "2021-06-01"),
                sell("s2", "ETH", "1", "1600", "2022-06-01"));

        TaxReport report = formatter.generateTaxReport(oversold, 2021, "USD");

        assertThat(report.getTransactions()).hasSize(1);
        assertThat(report.getShortTermGains()).isEqualByComparingTo("1500");
        assertThat(report.getShortfalls()).singleElement().satisfies(s -> {
            assertThat(s.sellTransactionId()).isEqualTo("s1");
            assertThat(s.unmatchedQuantity()).isEqualByComparingTo("2");
        });
        assertThat(formatter.generateTaxReport(oversold, 2022, "USD").getShortfalls())
                .extracting(InventoryShortfall::sellTransactionId).containsExactly("s2");
    }

    @Test
    @DisplayName("summary reports count, sorted symbols, extremes and averages")
    void summary() {
        TransactionSummary summary = formatter.generateTransactionSummary(
                formatter.generateTaxReport(history(), 2022, "USD"));

        assertThat(summary.transactionCount()).isEqualTo(2);
        assertThat(summary.symbols()).containsExactly("BTC", "ETH");
        assertThat(summary.largestGain()).isEqualByComparingTo("6000");
        assertThat(summary.largestLoss()).isEqualByComparingTo("-1000");
        assertThat(summary.averageGain()).isEqualByComparingTo("2500");
        // BTC held 516 days, ETH 30 days
        assertThat(summary.averageHoldingPeriodDays()).isEqualByComparingTo("273");
    }

    @Test
    @DisplayName("summary of an empty report is all zero")
    void emptySummary() {
        TransactionSummary summary = formatter.generateTransactionSummary(
                new TaxReport(2022, "USD", null, null, List.of()));

        assertThat(summary).isEqualTo(TransactionSummary.empty());
    }
}
