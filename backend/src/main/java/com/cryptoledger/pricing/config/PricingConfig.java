package com.cryptoledger.pricing.config;

import com.cryptoledger.common.RateLimiter;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.netty.channel.ChannelOption;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Pricing module configuration: properties, the CoinGecko WebClient and shared caches.
 */
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class PricingConfig {

    public static final String API_KEY_HEADER = "x-cg-api-key";

    @Bean
    public RateLimiter coingeckoRateLimiter(PricingProperties pricingProperties) {
        return new RateLimiter(pricingProperties.getRequestsPerMinute());
    }

    @Bean
    public WebClient coingeckoWebClient(WebClient.Builder webClientBuilder, PricingProperties pricingProperties) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, pricingProperties.getConnectTimeoutSeconds() * 1000)
                .responseTimeout(Duration.ofSeconds(pricingProperties.getReadTimeoutSeconds()));
        WebClient.Builder builder = webClientBuilder.clone()
                .baseUrl(pricingProperties.getCoingeckoBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.USER_AGENT, "crypto-ledger");
        String apiKey = pricingProperties.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(API_KEY_HEADER, apiKey.strip());
        }
        return builder.build();
    }

    /** Key: SYMBOL_fiat. */
    @Bean
    public Cache<String, BigDecimal> spotPriceCache(PricingProperties pricingProperties) {
        return Caffeine.newBuilder()
                .expireAfterWrite(pricingProperties.getSpotCacheTtlMinutes(), TimeUnit.MINUTES)
                .maximumSize(5_000)
                .build();
    }

    @Bean
    public Cache<String, Map<String, String>> coinsListCache(PricingProperties pricingProperties) {
        return Caffeine.newBuilder()
                .expireAfterWrite(pricingProperties.getCoinsListCacheTtlHours(), TimeUnit.HOURS)
                .maximumSize(1)
                .build();
    }
}
