package com.portfolioradar.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. Cache names are repeated as literals in the @Cacheable sites of the pricing and
 * portfolio modules, which must not depend on config.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String SPOT_PRICE_CACHE = "spotPriceCache";
    public static final String HISTORICAL_PRICE_CACHE = "historicalPriceCache";
    public static final String SNAPSHOT_SERIES_CACHE = "snapshotSeriesCache";
    public static final String ASSET_SEARCH_CACHE = "assetSearchCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(SPOT_PRICE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .maximumSize(500)
                .build());
        manager.registerCustomCache(HISTORICAL_PRICE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(24, TimeUnit.HOURS)
                .maximumSize(10_000)
                .build());
        manager.registerCustomCache(SNAPSHOT_SERIES_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(60, TimeUnit.MINUTES)
                .maximumSize(200)
                .build());
        manager.registerCustomCache(ASSET_SEARCH_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(1_000)
                .build());
        return manager;
    }
}
