package com.cryptoledger.portfolio;

import com.cryptoledger.costbasis.engine.FifoMatchingEngine;
import com.cryptoledger.costbasis.gains.GainAggregator;
import com.cryptoledger.pricing.PricePoint;
import com.cryptoledger.pricing.PriceProvider;
import com.cryptoledger.transaction.TransactionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.cryptoledger.costbasis.TestTransactions.buy;
import static com.cryptoledger.costbasis.TestTransactions.sell;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PortfolioServiceTest {

    @Mock
    TransactionService transactionService;
    @Mock
    PriceProvider priceProvider;

    PortfolioService portfolioService;

    @BeforeEach
    void setUp() {
        portfolioService = new PortfolioService(transactionService, new GainAggregator(new FifoMatchingEngine()),
                priceProvider);
    }

    private void holdings() {
        when(transactionService.history("w1")).thenReturn(List.of(
                buy("b1", "BTC", "1", "20000", "2023-01-01"),
                buy("b2", "ETH", "10", "1000", "2023-01-01"),
                sell("s1", "ETH", "6", "1500", "2023-02-01"),
                buy("b3", "DOGE", "1000", "0.1", "2023-01-01")));
    }

    @Test
    @DisplayName("items come from open lots; unpriced symbols have no value")
    void items() {
        holdings();
        when(priceProvider.currentPrices(List.of("BTC", "ETH", "DOGE"), "EUR"))
                .thenReturn(Map.of("BTC", new BigDecimal("30000"), "ETH", new BigDecimal("2000")));

        List<PortfolioItem> items = portfolioService.getPortfolioItems("w1", "eur");

        assertThat(items).extracting(PortfolioItem::symbol).containsExactly("BTC", "ETH", "DOGE");
        assertThat(items.get(1).quantity()).isEqualByComparingTo("4");
        assertThat(items.get(1).currentValue()).isEqualByComparingTo("8000");
        assertThat(items.get(2).currentPrice()).isNull();
        assertThat(items.get(2).currentValue()).isNull();
        assertThat(items).allSatisfy(i -> assertThat(i.fiatCurrency()).isEqualTo("EUR"));
    }

    @Test
    @DisplayName("portfolio value sums priced items only")
    void value() {
        holdings();
        when(priceProvider.currentPrices(any(), anyString()))
                .thenReturn(Map.of("BTC", new BigDecimal("30000"), "ETH", new BigDecimal("2000")));

        PortfolioValuation valuation = portfolioService.getPortfolioValue("w1", "USD");

        assertThat(valuation.totalValue()).isEqualByComparingTo("38000");
        assertThat(valuation.items()).hasSize(3);
    }

    @Test
    @DisplayName("distribution is sorted by value with percentages of the total")
    void distribution() {
        holdings();
        when(priceProvider.currentPrices(any(), anyString())).thenReturn(Map.of(
                "BTC", new BigDecimal("30000"), "ETH", new BigDecimal("2500"), "DOGE", new BigDecimal("0.1")));

        PortfolioDistribution distribution = portfolioService.getPortfolioDistribution("w1", "USD");

        assertThat(distribution.totalValue()).isEqualByComparingTo("40100");
        assertThat(distribution.distribution()).extracting(DistributionEntry::symbol)
                .containsExactly("BTC", "ETH", "DOGE");
        assertThat(distribution.distribution().get(1).percentage()).isEqualByComparingTo("24.9377");
        BigDecimal sum = distribution.distribution().stream()
                .map(DistributionEntry::percentage)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(sum).isBetween(new BigDecimal("99.99"), new BigDecimal("100.01"));
    }

    @Test
    @DisplayName("distribution is empty when nothing has a value")
    void emptyDistribution() {
        holdings();
        when(priceProvider.currentPrices(any(), anyString())).thenReturn(Map.of());

        PortfolioDistribution distribution = portfolioService.getPortfolioDistribution("w1", "USD");

        assertThat(distribution.totalValue()).isEqualByComparingTo("0");
        assertThat(distribution.distribution()).isEmpty();
    }

    @Test
    @DisplayName("empty history needs no prices")
    void noHoldings() {
        when(transactionService.history(null)).thenReturn(List.of());

        assertThat(portfolioService.getPortfolioItems(null, "USD")).isEmpty();
        verify(priceProvider, never()).currentPrices(any(), anyString());
    }

    @Test
    @DisplayName("historical value sums quantity times daily price across symbols")
    void history() {
        holdings();
        Instant day1 = Instant.parse("2023-03-01T00:00:00Z");
        Instant day2 = Instant.parse("2023-03-02T00:00:00Z");
        when(priceProvider.marketChart("BTC", 2, "USD")).thenReturn(List.of(
                new PricePoint(day1, new BigDecimal("20000")), new PricePoint(day2, new BigDecimal("21000"))));
        when(priceProvider.marketChart("ETH", 2, "USD")).thenReturn(List.of(
                new PricePoint(day1, new BigDecimal("1000")), new PricePoint(day2, new BigDecimal("1100"))));
        when(priceProvider.marketChart("DOGE", 2, "USD")).thenReturn(List.of());

        List<PortfolioValuePoint> points = portfolioService.getHistoricalPortfolioValue("w1", 2, "USD");

        assertThat(points).hasSize(2);
        assertThat(points.get(0).date()).isEqualTo(LocalDate.of(2023, 3, 1));
        assertThat(points.get(0).value()).isEqualByComparingTo("24000");
        assertThat(points.get(1).value()).isEqualByComparingTo("25400");
    }

    @Test
    @DisplayName("an intraday sample replaces that day's midnight price instead of adding to it")
    void historyKeepsLastSamplePerDay() {
        when(transactionService.history("w1")).thenReturn(List.of(buy("b1", "BTC", "1", "20000", "2023-01-01")));
        when(priceProvider.marketChart("BTC", 2, "USD")).thenReturn(List.of(
                new PricePoint(Instant.parse("2023-03-01T00:00:00Z"), new BigDecimal("20000")),
                new PricePoint(Instant.parse("2023-03-02T00:00:00Z"), new BigDecimal("21000")),
                new PricePoint(Instant.parse("2023-03-02T14:05:00Z"), new BigDecimal("21500"))));

        List<PortfolioValuePoint> points = portfolioService.getHistoricalPortfolioValue("w1", 2, "USD");

        assertThat(points).extracting(PortfolioValuePoint::date)
                .containsExactly(LocalDate.of(2023, 3, 1), LocalDate.of(2023, 3, 2));
        assertThat(points.get(0).value()).isEqualByComparingTo("20000");
        assertThat(points.get(1).value()).isEqualByComparingTo("21500");
    }
}
