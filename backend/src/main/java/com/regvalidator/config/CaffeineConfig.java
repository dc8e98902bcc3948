package com.regvalidator.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.regvalidator.catalog.CatalogProperties;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. Parsed catalogs are immutable, so cached instances are shared across requests.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String CATALOG_CACHE = "catalogCache";

    @Bean
    public CacheManager caffeineCacheManager(CatalogProperties catalogProperties) {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(CATALOG_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(catalogProperties.getCacheTtlMinutes(), TimeUnit.MINUTES)
                .maximumSize(catalogProperties.getCacheMaxSize())
                .build());
        return manager;
    }
}
