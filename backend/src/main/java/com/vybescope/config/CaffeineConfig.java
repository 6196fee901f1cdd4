package com.vybescope.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches for provider passthrough reads. Alert polling never goes through these.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String TOKEN_STATS_CACHE = "tokenStatsCache";
    public static final String WALLET_SNAPSHOT_CACHE = "walletSnapshotCache";
    public static final String TOP_HOLDERS_CACHE = "topHoldersCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(TOKEN_STATS_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .maximumSize(1_000)
                .build());
        manager.registerCustomCache(WALLET_SNAPSHOT_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(1, TimeUnit.MINUTES)
                .maximumSize(500)
                .build());
        manager.registerCustomCache(TOP_HOLDERS_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(500)
                .build());
        return manager;
    }
}
