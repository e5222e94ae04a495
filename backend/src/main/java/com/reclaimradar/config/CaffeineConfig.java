package com.reclaimradar.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. Access tokens live 55 minutes (LWA tokens expire after 60).
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String LWA_TOKEN_CACHE = "lwaTokenCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(LWA_TOKEN_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(55, TimeUnit.MINUTES)
                .maximumSize(10)
                .build());
        return manager;
    }
}
