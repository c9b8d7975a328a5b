package com.episcope.trends.config;

import com.episcope.trends.model.CacheEntry;
import com.episcope.trends.repository.CacheEntryRepository;
import com.episcope.trends.repository.RequestLogRepository;
import com.episcope.trends.service.cache.CacheStore;
import com.episcope.trends.service.cache.CaffeineCacheStore;
import com.episcope.trends.service.cache.FreshnessPolicy;
import com.episcope.trends.service.cache.JpaCacheStore;
import com.episcope.trends.service.log.InMemoryRequestLog;
import com.episcope.trends.service.log.JpaRequestLog;
import com.episcope.trends.service.log.RequestLog;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Cache store and request log wiring, selected by {@code trends.store.type}.
 */
@Configuration
public class CacheConfiguration {

    /**
     * PostgreSQL-backed store (default).
     */
    @Configuration
    @ConditionalOnProperty(prefix = "trends.store", name = "type", havingValue = "jpa", matchIfMissing = true)
    static class JpaStoreConfiguration {

        @Bean
        public CacheStore cacheStore(CacheEntryRepository repository, FreshnessPolicy freshnessPolicy) {
            return new JpaCacheStore(repository, freshnessPolicy);
        }

        @Bean
        public RequestLog requestLog(RequestLogRepository repository) {
            return new JpaRequestLog(repository);
        }
    }

    /**
     * Caffeine-backed store for single-process deployments and local runs.
     */
    @Configuration
    @ConditionalOnProperty(prefix = "trends.store", name = "type", havingValue = "memory")
    static class MemoryStoreConfiguration {

        private final TrendsProperties properties;

        MemoryStoreConfiguration(TrendsProperties properties) {
            this.properties = properties;
        }

        @Bean
        public Cache<String, CacheEntry> trendsCache() {
            // No time-based expiry: expired entries are still served as stale fallbacks
            return Caffeine.newBuilder()
                    .maximumSize(properties.getStore().getMaxSize())
                    .recordStats()
                    .build();
        }

        @Bean
        public CacheStore cacheStore(Cache<String, CacheEntry> trendsCache, FreshnessPolicy freshnessPolicy) {
            return new CaffeineCacheStore(trendsCache, freshnessPolicy);
        }

        @Bean
        public RequestLog requestLog() {
            return new InMemoryRequestLog(properties.getStore().getRequestLogCapacity());
        }
    }
}
