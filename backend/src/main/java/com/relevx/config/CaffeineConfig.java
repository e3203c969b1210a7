package com.relevx.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches behind Spring's cache abstraction. The per-user active project snapshots live in
 * {@link com.relevx.cache.ActiveProjectListCache}, which owns its own Caffeine instance.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String PLAN_CACHE = "planCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(PLAN_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(50)
                .build());
        return manager;
    }
}
