package com.cryptoledger.pricing;

import com.cryptoledger.common.RateLimiter;
import com.cryptoledger.pricing.config.PricingProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CoinIdResolverTest {

    private static final String COINS_LIST = """
            [
              {"id": "bitcoin", "symbol": "btc", "name": "Bitcoin"},
              {"id": "batcat", "symbol": "btc", "name": "Batcat"},
              {"id": "cardano", "symbol": "ada", "name": "Cardano"}
            ]
            """;

    private static CoinIdResolver resolver(CoinGeckoStub stub, Map<String, String> overrides) {
        PricingProperties props = new PricingProperties();
        props.setSymbolToCoinGeckoId(overrides);
        CoinGeckoClient client = new CoinGeckoClient(stub.webClient(), new RateLimiter(60_000));
        return new CoinIdResolver(client, Caffeine.newBuilder().build(), props);
    }

    @Test
    @DisplayName("configured override wins without any HTTP call")
    void overrideFirst() {
        CoinGeckoStub stub = new CoinGeckoStub();
        CoinIdResolver resolver = resolver(stub, Map.of("eth", "ethereum"));

        assertThat(resolver.resolve("ETH")).contains("ethereum");
        assertThat(stub.requests).isEmpty();
    }

    @Test
    @DisplayName("coins list is fetched once and the first id per symbol wins")
    void coinsListIndex() {
        CoinGeckoStub stub = new CoinGeckoStub().respond("/coins/list", COINS_LIST);
        CoinIdResolver resolver = resolver(stub, Map.of());

        assertThat(resolver.resolve("btc")).contains("bitcoin");
        assertThat(resolver.resolve("ADA")).contains("cardano");
        assertThat(stub.requestsTo("/coins/list")).isEqualTo(1);
    }

    @Test
    @DisplayName("search is the fallback and requires an exact symbol match")
    void searchFallback() {
        CoinGeckoStub stub = new CoinGeckoStub()
                .respond("/coins/list", "[]")
                .respond("/search", """
                        {"coins": [
                          {"id": "pepe-token-x", "symbol": "PEPEX"},
                          {"id": "pepe", "symbol": "PEPE"}
                        ]}
                        """);
        CoinIdResolver resolver = resolver(stub, Map.of());

        assertThat(resolver.resolve("pepe")).contains("pepe");
        assertThat(resolver.resolve("PEPE")).contains("pepe");
        assertThat(stub.requestsTo("/search")).isEqualTo(1);
    }

    @Test
    @DisplayName("unknown symbol and failing API resolve to empty")
    void unresolvable() {
        CoinGeckoStub stub = new CoinGeckoStub()
                .fail("/coins/list", HttpStatus.TOO_MANY_REQUESTS)
                .respond("/search", "{\"coins\": []}");
        CoinIdResolver resolver = resolver(stub, Map.of());

        assertThat(resolver.resolve("NOPE")).isEmpty();
        assertThat(resolver.resolve(" ")).isEmpty();
        assertThat(resolver.resolve(null)).isEmpty();
    }

    @Test
    @DisplayName("parseCoinsList ignores entries without id or symbol")
    void parseCoinsList() throws Exception {
        Map<String, String> index = CoinIdResolver.parseCoinsList(new ObjectMapper().readTree("""
                [{"id": "", "symbol": "x"}, {"id": "solana", "symbol": "sol"}, {"symbol": "y"}]
                """));

        assertThat(index).containsExactly(Map.entry("SOL", "solana"));
    }
}
