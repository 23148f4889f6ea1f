package com.synapse.x.cache;

import com.synapse.x.dto.FeatureRecord;
import com.synapse.x.dto.RecommendResponse;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * In-process serving cache in front of the feature store.
 * <p>
 * Readers call {@link #generation(String, String)} before reading the store and hand the token
 * to {@link #putIfCurrent(String, FeatureRecord, long)}. Writers call {@link #invalidate}
 * after commit. A store read that raced a write therefore never re-inserts the older value.
 * </p>
 */
public interface FeatureCache {

    Optional<CacheEntry> get(String view, String companyId);

    long generation(String view, String companyId);

    boolean putIfCurrent(String view, FeatureRecord record, long generation);

    void invalidate(String view, Collection<String> companyIds);

    /**
     * Last-known-good snapshot, kept longer than online entries. Only for degraded serving.
     */
    Optional<CacheEntry> getFallback(String view, String companyId);

    List<String> fallbackCompanyIds(String view);

    long viewGeneration(String view);

    Optional<RecommendResponse> getRanking(RankingCacheKey key);

    void putRanking(RankingCacheKey key, RecommendResponse response);
}
