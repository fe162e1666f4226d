package com.cryptoledger.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches for @Cacheable price lookups. Spot prices and the coins list use
 * dedicated Caffeine beans from PricingConfig because they are read in batches.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String HISTORICAL_PRICE_CACHE = "historicalPriceCache";
    public static final String MARKET_CHART_CACHE = "marketChartCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(HISTORICAL_PRICE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(24, TimeUnit.HOURS)
                .maximumSize(10_000)
                .build());
        manager.registerCustomCache(MARKET_CHART_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(15, TimeUnit.MINUTES)
                .maximumSize(500)
                .build());
        return manager;
    }
}
