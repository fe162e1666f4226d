package com.cryptoledger.pricing;

import com.cryptoledger.pricing.config.PricingProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves a ticker symbol to a CoinGecko coin id. Order: configured overrides, the /coins/list index
 * (first id listed for a symbol wins), then /search with an exact symbol match.
 */
@Component
@Slf4j
public class CoinIdResolver {

    private static final String CACHE_KEY = "coins-list";

    private final CoinGeckoClient coinGeckoClient;
    private final Cache<String, Map<String, String>> coinsListCache;
    private final Map<String, String> overrides;
    private final Map<String, String> searchHits = new ConcurrentHashMap<>();

    public CoinIdResolver(CoinGeckoClient coinGeckoClient,
                          Cache<String, Map<String, String>> coinsListCache,
                          PricingProperties pricingProperties) {
        this.coinGeckoClient = coinGeckoClient;
        this.coinsListCache = coinsListCache;
        Map<String, String> normalized = new HashMap<>();
        pricingProperties.getSymbolToCoinGeckoId()
                .forEach((symbol, id) -> normalized.put(symbol.strip().toUpperCase(Locale.ROOT), id.strip()));
        this.overrides = Collections.unmodifiableMap(normalized);
    }

    public Optional<String> resolve(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return Optional.empty();
        }
        String key = symbol.strip().toUpperCase(Locale.ROOT);
        String override = overrides.get(key);
        if (override != null && !override.isBlank()) {
            return Optional.of(override);
        }
        Map<String, String> index = coinsListIndex();
        if (index.containsKey(key)) {
            return Optional.of(index.get(key));
        }
        String hit = searchHits.get(key);
        if (hit != null) {
            return Optional.of(hit);
        }
        Optional<String> searched = search(key);
        searched.ifPresent(id -> searchHits.put(key, id));
        if (searched.isEmpty()) {
            log.debug("No CoinGecko id for symbol {}", key);
        }
        return searched;
    }

    private Map<String, String> coinsListIndex() {
        // A failed fetch is not cached, the next lookup tries again.
        Map<String, String> index = coinsListCache.get(CACHE_KEY,
                k -> coinGeckoClient.get("/coins/list", Map.of()).map(CoinIdResolver::parseCoinsList).orElse(null));
        return index != null ? index : Map.of();
    }

    private Optional<String> search(String symbol) {
        return coinGeckoClient.get("/search", Map.of("query", symbol))
                .flatMap(root -> parseSearch(root, symbol));
    }

    static Map<String, String> parseCoinsList(JsonNode root) {
        Map<String, String> index = new HashMap<>();
        if (root == null || !root.isArray()) {
            return index;
        }
        for (JsonNode coin : root) {
            String id = coin.path("id").asText("");
            String symbol = coin.path("symbol").asText("");
            if (id.isBlank() || symbol.isBlank()) {
                continue;
            }
            index.putIfAbsent(symbol.strip().toUpperCase(Locale.ROOT), id);
        }
        return index;
    }

    static Optional<String> parseSearch(JsonNode root, String symbol) {
        for (JsonNode coin : root.path("coins")) {
            if (symbol.equalsIgnoreCase(coin.path("symbol").asText(""))) {
                String id = coin.path("id").asText("");
                if (!id.isBlank()) {
                    return Optional.of(id);
                }
            }
        }
        return Optional.empty();
    }
}
