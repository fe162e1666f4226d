package com.cryptoledger.pricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Pricing configuration, bound from application.yml under cryptoledger.pricing.
 */
@ConfigurationProperties(prefix = "cryptoledger.pricing")
@Getter
@Setter
public class PricingProperties {

    /**
     * CoinGecko API base URL (free: https://api.coingecko.com/api/v3).
     */
    private String coingeckoBaseUrl = "https://api.coingecko.com/api/v3";

    /**
     * Optional demo/pro API key, sent as x-cg-api-key when non-blank.
     */
    private String apiKey;

    /**
     * Requests per minute across all CoinGecko calls.
     */
    private int requestsPerMinute = 30;

    private int connectTimeoutSeconds = 10;

    private int readTimeoutSeconds = 15;

    /**
     * Map: uppercase symbol -> CoinGecko coin id. Checked before the coins list, which maps popular
     * tickers ambiguously.
     */
    private Map<String, String> symbolToCoinGeckoId = new HashMap<>();

    /** TTL in hours for the /coins/list symbol index. */
    private int coinsListCacheTtlHours = 24;

    /** TTL in minutes for spot prices. */
    private int spotCacheTtlMinutes = 5;
}
