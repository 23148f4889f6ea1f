package com.synapse.x.service;

import com.synapse.x.cache.CacheEntry;
import com.synapse.x.cache.FeatureCache;
import com.synapse.x.dto.CandidateListing;
import com.synapse.x.dto.CompanyPointer;
import com.synapse.x.dto.FeatureLookup;
import com.synapse.x.dto.FeatureRecord;
import com.synapse.x.dto.OnlineFeatures;
import com.synapse.x.dto.RequestDeadline;
import com.synapse.x.exceptions.RequestTimeoutException;
import com.synapse.x.exceptions.StoreUnavailableException;
import com.synapse.x.metrics.FeatureStoreMetrics;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Feature reads issued by the ranking engine.
 * <p>
 * Store failures are retried with exponential backoff. Once retries are exhausted, or while
 * the circuit is open, reads are answered from last-known-good cache snapshots and flagged so
 * the response can be marked degraded.
 * </p>
 */
@Slf4j
@Service
public class FeatureLookupService {

    public static final String RESILIENCE_INSTANCE = "featureLookup";

    private final FeatureServingService servingService;
    private final FeatureStore featureStore;
    private final FeatureCache featureCache;
    private final FeatureStoreMetrics metrics;
    private final Clock clock;

    public FeatureLookupService(FeatureServingService servingService,
                                FeatureStore featureStore,
                                FeatureCache featureCache,
                                FeatureStoreMetrics metrics,
                                Clock clock) {
        this.servingService = servingService;
        this.featureStore = featureStore;
        this.featureCache = featureCache;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Retry(name = RESILIENCE_INSTANCE, fallbackMethod = "lookupFromSnapshots")
    @CircuitBreaker(name = RESILIENCE_INSTANCE)
    public FeatureLookup lookup(String view, List<String> companyIds, RequestDeadline deadline) {
        requireTimeLeft(deadline);
        OnlineFeatures online = servingService.getOnlineFeatures(view, companyIds);
        FeatureLookup.FeatureLookupBuilder out = FeatureLookup.builder().fromFallback(false);
        online.getFound().forEach(r -> out.record(r.getCompanyId(), r));
        online.getStale().forEach(out::stale);
        return out.build();
    }

    @Retry(name = RESILIENCE_INSTANCE, fallbackMethod = "listFromSnapshots")
    @CircuitBreaker(name = RESILIENCE_INSTANCE)
    public CandidateListing listCandidates(String view, RequestDeadline deadline) {
        requireTimeLeft(deadline);
        return new CandidateListing(featureStore.listCompanies(view), false, null);
    }

    private FeatureLookup lookupFromSnapshots(String view, List<String> companyIds, RequestDeadline deadline,
                                              StoreUnavailableException e) {
        log.warn("Feature store unavailable for view={}, serving {} ids from cache snapshots: {}",
                view, companyIds.size(), e.getMessage());
        return snapshotLookup(view, companyIds);
    }

    private FeatureLookup lookupFromSnapshots(String view, List<String> companyIds, RequestDeadline deadline,
                                              CallNotPermittedException e) {
        log.debug("Feature lookup circuit open for view={}, serving cache snapshots", view);
        return snapshotLookup(view, companyIds);
    }

    private CandidateListing listFromSnapshots(String view, RequestDeadline deadline, StoreUnavailableException e) {
        log.warn("Feature store unavailable while listing view={}, using cached company ids: {}", view, e.getMessage());
        return snapshotListing(view);
    }

    private CandidateListing listFromSnapshots(String view, RequestDeadline deadline, CallNotPermittedException e) {
        return snapshotListing(view);
    }

    private FeatureLookup snapshotLookup(String view, List<String> companyIds) {
        Instant now = clock.instant();
        FeatureLookup.FeatureLookupBuilder out = FeatureLookup.builder().fromFallback(true);
        long oldest = -1;
        for (String id : companyIds) {
            Optional<CacheEntry> entry = featureCache.getFallback(view, id);
            if (entry.isEmpty()) continue;
            FeatureRecord record = entry.get().getRecord();
            out.record(id, record);
            if (servingService.isStale(record)) out.stale(id);
            oldest = Math.max(oldest, entry.get().ageSeconds(now));
        }
        FeatureLookup lookup = out.stalenessSeconds(oldest < 0 ? null : oldest).build();
        metrics.recordFallbackServed(lookup.getRecords().size());
        return lookup;
    }

    private CandidateListing snapshotListing(String view) {
        Instant now = clock.instant();
        List<CompanyPointer> companies = new ArrayList<>();
        long oldest = -1;
        for (String id : featureCache.fallbackCompanyIds(view)) {
            Optional<CacheEntry> entry = featureCache.getFallback(view, id);
            if (entry.isEmpty()) continue;
            companies.add(new CompanyPointer(id, entry.get().getRecord().getTimestamp()));
            oldest = Math.max(oldest, entry.get().ageSeconds(now));
        }
        return new CandidateListing(companies, true, oldest < 0 ? null : oldest);
    }

    private static void requireTimeLeft(RequestDeadline deadline) {
        if (deadline != null && deadline.isExpired()) {
            throw new RequestTimeoutException("request deadline exceeded before feature lookup");
        }
    }
}
