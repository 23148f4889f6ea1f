package com.synapse.x.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.synapse.x.dto.FeatureRecord;
import com.synapse.x.dto.RecommendResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongArray;


@Slf4j
@Component
public class FeatureCacheImpl implements FeatureCache {

    private static final int GENERATION_STRIPES = 4096;
    private static final int STRIPE_MASK = GENERATION_STRIPES - 1;

    private final Cache<FeatureCacheKey, CacheEntry> online;
    private final Cache<FeatureCacheKey, CacheEntry> fallback;
    private final Cache<RankingCacheKey, RecommendResponse> rankings;
    private final Clock clock;
    private final AtomicLongArray stripeGenerations = new AtomicLongArray(GENERATION_STRIPES);
    private final ConcurrentMap<String, AtomicLong> viewGenerations = new ConcurrentHashMap<>();

    public FeatureCacheImpl(@Qualifier("onlineFeatureCache") Cache<FeatureCacheKey, CacheEntry> online,
                            @Qualifier("fallbackFeatureCache") Cache<FeatureCacheKey, CacheEntry> fallback,
                            @Qualifier("rankingResultCache") Cache<RankingCacheKey, RecommendResponse> rankings,
                            Clock clock) {
        this.online = online;
        this.fallback = fallback;
        this.rankings = rankings;
        this.clock = clock;
    }

    static int stripe(String view, String companyId) {
        int h = view.hashCode() * 31 + companyId.hashCode();
        h ^= (h >>> 16);
        h *= 0x27d4eb2d;
        h ^= (h >>> 15);
        return h & STRIPE_MASK;
    }

    @Override
    public Optional<CacheEntry> get(String view, String companyId) {
        return Optional.ofNullable(online.getIfPresent(new FeatureCacheKey(view, companyId)));
    }

    @Override
    public long generation(String view, String companyId) {
        return stripeGenerations.get(stripe(view, companyId));
    }

    @Override
    public boolean putIfCurrent(String view, FeatureRecord record, long generation) {
        int stripe = stripe(view, record.getCompanyId());
        FeatureCacheKey key = new FeatureCacheKey(view, record.getCompanyId());
        CacheEntry entry = new CacheEntry(record, clock.instant());
        boolean[] stored = {false};

        // the generation check and the insert happen under the map's per-key lock, which
        // invalidate() also takes when it removes the entry after bumping the generation
        online.asMap().compute(key, (k, existing) -> {
            if (stripeGenerations.get(stripe) != generation) {
                return existing;
            }
            stored[0] = true;
            return entry;
        });
        if (stored[0]) {
            fallback.asMap().compute(key, (k, existing) ->
                    stripeGenerations.get(stripe) == generation ? entry : existing);
        } else {
            log.debug("Skipped cache insert for company_id={} view={}: concurrent write", record.getCompanyId(), view);
        }
        return stored[0];
    }

    @Override
    public void invalidate(String view, Collection<String> companyIds) {
        viewGenerations.computeIfAbsent(view, v -> new AtomicLong()).incrementAndGet();
        for (String companyId : companyIds) {
            stripeGenerations.incrementAndGet(stripe(view, companyId));
            online.invalidate(new FeatureCacheKey(view, companyId));
        }
    }

    @Override
    public Optional<CacheEntry> getFallback(String view, String companyId) {
        FeatureCacheKey key = new FeatureCacheKey(view, companyId);
        CacheEntry hit = online.getIfPresent(key);
        return Optional.ofNullable(hit != null ? hit : fallback.getIfPresent(key));
    }

    @Override
    public List<String> fallbackCompanyIds(String view) {
        return fallback.asMap().keySet().stream()
                .filter(k -> k.getView().equals(view))
                .map(FeatureCacheKey::getCompanyId)
                .sorted()
                .toList();
    }

    @Override
    public long viewGeneration(String view) {
        AtomicLong gen = viewGenerations.get(view);
        return gen == null ? 0L : gen.get();
    }

    @Override
    public Optional<RecommendResponse> getRanking(RankingCacheKey key) {
        return Optional.ofNullable(rankings.getIfPresent(key));
    }

    @Override
    public void putRanking(RankingCacheKey key, RecommendResponse response) {
        rankings.put(key, response);
    }
}
