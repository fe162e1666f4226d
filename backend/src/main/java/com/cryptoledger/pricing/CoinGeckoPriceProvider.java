package com.cryptoledger.pricing;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link PriceProvider} backed by CoinGecko /simple/price, /coins/{id}/history and /coins/{id}/market_chart.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CoinGeckoPriceProvider implements PriceProvider {

    private static final DateTimeFormatter HISTORY_DATE = DateTimeFormatter.ofPattern("dd-MM-yyyy");

    private final CoinGeckoClient coinGeckoClient;
    private final CoinIdResolver coinIdResolver;
    private final Cache<String, BigDecimal> spotPriceCache;

    @Override
    public Map<String, BigDecimal> currentPrices(Collection<String> symbols, String fiatCurrency) {
        String fiat = fiat(fiatCurrency);
        Map<String, BigDecimal> result = new LinkedHashMap<>();
        Set<String> missing = new LinkedHashSet<>();
        for (String raw : symbols) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String symbol = raw.strip().toUpperCase(Locale.ROOT);
            BigDecimal cached = spotPriceCache.getIfPresent(spotKey(symbol, fiat));
            if (cached != null) {
                result.put(symbol, cached);
            } else {
                missing.add(symbol);
            }
        }
        if (missing.isEmpty()) {
            return result;
        }

        Map<String, String> symbolByCoinId = new LinkedHashMap<>();
        for (String symbol : missing) {
            coinIdResolver.resolve(symbol).ifPresent(id -> symbolByCoinId.putIfAbsent(id, symbol));
        }
        if (symbolByCoinId.isEmpty()) {
            return result;
        }
        Optional<JsonNode> response = coinGeckoClient.get("/simple/price",
                Map.of("ids", String.join(",", symbolByCoinId.keySet()), "vs_currencies", fiat));
        response.ifPresent(root -> symbolByCoinId.forEach((coinId, symbol) -> {
            JsonNode price = root.path(coinId).path(fiat);
            if (price.isNumber()) {
                BigDecimal value = price.decimalValue();
                spotPriceCache.put(spotKey(symbol, fiat), value);
                result.put(symbol, value);
            } else {
                log.debug("No {} spot price for {} ({})", fiat, symbol, coinId);
            }
        }));
        return result;
    }

    @Override
    @Cacheable(cacheNames = "historicalPriceCache",
            key = "#symbol.toUpperCase() + '-' + #date + '-' + #fiatCurrency.toLowerCase()")
    public Optional<BigDecimal> historicalPrice(String symbol, LocalDate date, String fiatCurrency) {
        if (date == null) {
            return Optional.empty();
        }
        String fiat = fiat(fiatCurrency);
        return coinIdResolver.resolve(symbol)
                .flatMap(coinId -> coinGeckoClient.get("/coins/" + coinId + "/history",
                        Map.of("date", date.format(HISTORY_DATE), "localization", "false")))
                .flatMap(root -> parseHistoricalPrice(root, fiat));
    }

    @Override
    @Cacheable(cacheNames = "marketChartCache",
            key = "#symbol.toUpperCase() + '-' + #days + '-' + #fiatCurrency.toLowerCase()")
    public List<PricePoint> marketChart(String symbol, int days, String fiatCurrency) {
        if (days <= 0) {
            return List.of();
        }
        String fiat = fiat(fiatCurrency);
        return coinIdResolver.resolve(symbol)
                .flatMap(coinId -> coinGeckoClient.get("/coins/" + coinId + "/market_chart",
                        Map.of("vs_currency", fiat, "days", String.valueOf(days), "interval", "daily")))
                .map(CoinGeckoPriceProvider::parseMarketChart)
                .orElse(List.of());
    }

    static Optional<BigDecimal> parseHistoricalPrice(JsonNode root, String fiat) {
        JsonNode price = root.path("market_data").path("current_price").path(fiat);
        return price.isNumber() ? Optional.of(price.decimalValue()) : Optional.empty();
    }

    static List<PricePoint> parseMarketChart(JsonNode root) {
        List<PricePoint> points = new ArrayList<>();
        for (JsonNode sample : root.path("prices")) {
            if (!sample.isArray() || sample.size() < 2 || !sample.get(1).isNumber()) {
                continue;
            }
            points.add(new PricePoint(Instant.ofEpochMilli(sample.get(0).asLong()), sample.get(1).decimalValue()));
        }
        return List.copyOf(points);
    }

    private static String fiat(String fiatCurrency) {
        return fiatCurrency == null || fiatCurrency.isBlank() ? "usd" : fiatCurrency.strip().toLowerCase(Locale.ROOT);
    }

    private static String spotKey(String symbol, String fiat) {
        return symbol + "_" + fiat;
    }
}
