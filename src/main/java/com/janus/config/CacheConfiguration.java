package com.janus.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.janus.model.ModelInfo;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Caffeine cache for the aggregated model catalog.
 */
@Configuration
public class CacheConfiguration {

    private final JanusProperties properties;

    public CacheConfiguration(JanusProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Cache<String, List<ModelInfo>> modelCatalogCache() {
        return Caffeine.newBuilder()
                .maximumSize(64)
                .expireAfterWrite(properties.getModels().getCacheTtl())
                .recordStats()
                .build();
    }
}
