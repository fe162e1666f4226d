package com.cryptoledger.portfolio;

import com.cryptoledger.costbasis.gains.GainAggregator;
import com.cryptoledger.costbasis.gains.InventoryPosition;
import com.cryptoledger.pricing.PricePoint;
import com.cryptoledger.pricing.PriceProvider;
import com.cryptoledger.transaction.TransactionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Holdings valued at market prices. Holdings are the open FIFO lots after replaying the wallet's history,
 * so they always agree with the gains endpoints.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PortfolioService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int PERCENT_SCALE = 4;

    private final TransactionService transactionService;
    private final GainAggregator gainAggregator;
    private final PriceProvider priceProvider;

    public List<PortfolioItem> getPortfolioItems(String walletId, String fiatCurrency) {
        String fiat = normalize(fiatCurrency);
        List<InventoryPosition> holdings = holdings(walletId);
        if (holdings.isEmpty()) {
            return List.of();
        }
        Map<String, BigDecimal> prices = priceProvider.currentPrices(
                holdings.stream().map(InventoryPosition::symbol).toList(), fiat);
        List<PortfolioItem> items = new ArrayList<>();
        for (InventoryPosition holding : holdings) {
            items.add(PortfolioItem.of(holding.symbol(), holding.quantity(), prices.get(holding.symbol()), fiat));
        }
        return items;
    }

    public PortfolioValuation getPortfolioValue(String walletId, String fiatCurrency) {
        String fiat = normalize(fiatCurrency);
        List<PortfolioItem> items = getPortfolioItems(walletId, fiat);
        BigDecimal total = items.stream()
                .map(PortfolioItem::currentValue)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new PortfolioValuation(total, fiat, items);
    }

    /**
     * Percentage per priced symbol, sorted by value descending. Empty when the total value is not positive.
     */
    public PortfolioDistribution getPortfolioDistribution(String walletId, String fiatCurrency) {
        PortfolioValuation valuation = getPortfolioValue(walletId, fiatCurrency);
        BigDecimal total = valuation.totalValue();
        if (total.signum() <= 0) {
            return new PortfolioDistribution(BigDecimal.ZERO, valuation.fiatCurrency(), List.of());
        }
        List<DistributionEntry> entries = valuation.items().stream()
                .filter(item -> item.currentValue() != null && item.currentValue().signum() != 0)
                .map(item -> new DistributionEntry(item.symbol(), item.currentValue(),
                        item.currentValue().multiply(HUNDRED).divide(total, PERCENT_SCALE, RoundingMode.HALF_UP)))
                .sorted(Comparator.comparing(DistributionEntry::value).reversed())
                .toList();
        return new PortfolioDistribution(total, valuation.fiatCurrency(), entries);
    }

    /**
     * Daily value of the current holdings over the last {@code days} days (current quantity × that day's price).
     * Symbols without chart data are left out.
     */
    public List<PortfolioValuePoint> getHistoricalPortfolioValue(String walletId, int days, String fiatCurrency) {
        String fiat = normalize(fiatCurrency);
        Map<LocalDate, BigDecimal> valueByDay = new TreeMap<>();
        for (InventoryPosition holding : holdings(walletId)) {
            List<PricePoint> chart = priceProvider.marketChart(holding.symbol(), days, fiat);
            if (chart.isEmpty()) {
                log.debug("No market chart for {}; excluded from history", holding.symbol());
                continue;
            }
            // Last sample of each UTC day; the daily chart ends with an intraday "now" sample.
            Map<LocalDate, BigDecimal> closeByDay = new TreeMap<>();
            for (PricePoint point : chart) {
                closeByDay.put(point.timestamp().atZone(ZoneOffset.UTC).toLocalDate(), point.price());
            }
            closeByDay.forEach((day, price) ->
                    valueByDay.merge(day, price.multiply(holding.quantity()), BigDecimal::add));
        }
        return valueByDay.entrySet().stream()
                .map(e -> new PortfolioValuePoint(e.getKey(), e.getValue()))
                .toList();
    }

    private List<InventoryPosition> holdings(String walletId) {
        return gainAggregator.currentInventory(transactionService.history(walletId));
    }

    private static String normalize(String fiatCurrency) {
        return fiatCurrency == null || fiatCurrency.isBlank() ? "USD" : fiatCurrency.strip().toUpperCase(Locale.ROOT);
    }
}
