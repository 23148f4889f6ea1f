package com.synapse.x.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.synapse.x.cache.CacheEntry;
import com.synapse.x.cache.FeatureCacheKey;
import com.synapse.x.cache.RankingCacheKey;
import com.synapse.x.dto.RecommendResponse;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class CacheConfig {

    @Bean(name = "onlineFeatureCache")
    public Cache<FeatureCacheKey, CacheEntry> onlineFeatureCache(
            MeterRegistry meterRegistry,
            @Value("${synapse.cache.ttl:30s}") Duration ttl,
            @Value("${synapse.cache.max-size:100000}") long maxSize) {
        Cache<FeatureCacheKey, CacheEntry> cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .recordStats()
                .build();
        return CaffeineCacheMetrics.monitor(meterRegistry, cache, "feature_cache_online");
    }

    @Bean(name = "fallbackFeatureCache")
    public Cache<FeatureCacheKey, CacheEntry> fallbackFeatureCache(
            MeterRegistry meterRegistry,
            @Value("${synapse.cache.fallback-ttl:1h}") Duration ttl,
            @Value("${synapse.cache.max-size:100000}") long maxSize) {
        Cache<FeatureCacheKey, CacheEntry> cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .recordStats()
                .build();
        return CaffeineCacheMetrics.monitor(meterRegistry, cache, "feature_cache_fallback");
    }

    @Bean(name = "rankingResultCache")
    public Cache<RankingCacheKey, RecommendResponse> rankingResultCache(
            MeterRegistry meterRegistry,
            @Value("${synapse.cache.ranking-ttl:15s}") Duration ttl) {
        Cache<RankingCacheKey, RecommendResponse> cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(10_000)
                .recordStats()
                .build();
        return CaffeineCacheMetrics.monitor(meterRegistry, cache, "ranking_result_cache");
    }
}
