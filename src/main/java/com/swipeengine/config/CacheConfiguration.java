package com.swipeengine.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Cache configuration for Caffeine.
 */
@Configuration
public class CacheConfiguration {

    /**
     * Latest persisted clustering result, keyed by entity type.
     */
    public static final String LATEST_CLUSTERING_CACHE = "latestClustering";

    private final SwipeEngineProperties properties;

    public CacheConfiguration(SwipeEngineProperties properties) {
        this.properties = properties;
    }

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(LATEST_CLUSTERING_CACHE);
        cacheManager.setCaffeine(caffeineCacheBuilder());
        return cacheManager;
    }

    private Caffeine<Object, Object> caffeineCacheBuilder() {
        return Caffeine.newBuilder()
                .maximumSize(properties.getCache().getMaxSize())
                .expireAfterWrite(properties.getCache().getExpireAfterWrite())
                .recordStats();
    }
}
