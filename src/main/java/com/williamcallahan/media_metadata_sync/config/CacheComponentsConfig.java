/**
 * Configuration class for cache-related components and beans
 * It handles:
 * - Defining the run-scoped catalog response cache (Caffeine, no eviction)
 * - Defining the keyed lock table guarding identifier cache read-modify-write
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.media_metadata_sync.service.cache.KeyedLockRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheComponentsConfig {

    /**
     * Response cache lives for one process run; the number of distinct requests bounds it
     */
    @Bean
    public Cache<String, JsonNode> catalogResponseCache() {
        return Caffeine.newBuilder()
                .recordStats() // Enable statistics recording for metrics
                .build();
    }

    @Bean
    public KeyedLockRegistry identifierLockRegistry() {
        return new KeyedLockRegistry();
    }
}
