package com.synapse.x.service;

import com.synapse.x.cache.CacheEntry;
import com.synapse.x.cache.FeatureCache;
import com.synapse.x.dto.FeatureRecord;
import com.synapse.x.dto.FeatureStats;
import com.synapse.x.dto.FeatureView;
import com.synapse.x.dto.OnlineFeatures;
import com.synapse.x.dto.WriteResult;
import com.synapse.x.exceptions.TooLargeException;
import com.synapse.x.metrics.FeatureStoreMetrics;
import com.synapse.x.validation.FeatureViewValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class FeatureServingServiceImpl implements FeatureServingService {

    private final FeatureStore featureStore;
    private final FeatureCache featureCache;
    private final FeatureStoreMetrics metrics;
    private final Clock clock;
    private final int maxOnlineBatch;
    private final Duration stalenessBound;

    public FeatureServingServiceImpl(FeatureStore featureStore,
                                     FeatureCache featureCache,
                                     FeatureStoreMetrics metrics,
                                     Clock clock,
                                     @Value("${synapse.store.max-online-batch:1000}") int maxOnlineBatch,
                                     @Value("${synapse.store.staleness-bound:24h}") Duration stalenessBound) {
        this.featureStore = featureStore;
        this.featureCache = featureCache;
        this.metrics = metrics;
        this.clock = clock;
        this.maxOnlineBatch = maxOnlineBatch;
        this.stalenessBound = stalenessBound;
    }

    @Override
    public WriteResult writeFeatures(String view, List<FeatureRecord> records) {
        WriteResult result = featureStore.write(view, records);
        if (result.getAcceptedCount() > 0) {
            featureCache.invalidate(view, new LinkedHashSet<>(result.getAcceptedCompanyIds()));
        }
        return result;
    }

    @Override
    public OnlineFeatures getOnlineFeatures(String view, List<String> companyIds) {
        FeatureViewValidator.requireValid(view);
        LinkedHashSet<String> ids = new LinkedHashSet<>(companyIds);
        if (ids.size() > maxOnlineBatch) {
            throw new TooLargeException("company_ids", ids.size(), maxOnlineBatch);
        }

        Map<String, FeatureRecord> found = new LinkedHashMap<>();
        Map<String, Long> generations = new HashMap<>();
        List<String> misses = new ArrayList<>();
        for (String id : ids) {
            Optional<CacheEntry> cached = featureCache.get(view, id);
            if (cached.isPresent()) {
                found.put(id, cached.get().getRecord());
            } else {
                generations.put(id, featureCache.generation(view, id));
                misses.add(id);
            }
        }
        metrics.recordCacheHits(found.size());
        metrics.recordCacheMisses(misses.size());

        if (!misses.isEmpty()) {
            Map<String, FeatureRecord> loaded = featureStore.readLatest(view, misses);
            loaded.forEach((id, record) -> {
                found.put(id, record);
                featureCache.putIfCurrent(view, record, generations.get(id));
            });
        }

        OnlineFeatures.OnlineFeaturesBuilder out = OnlineFeatures.builder();
        int stale = 0;
        for (String id : ids) {
            FeatureRecord record = found.get(id);
            if (record == null) {
                out.missing(id);
                continue;
            }
            out.found(record);
            if (isStale(record)) {
                out.stale(id);
                stale++;
            }
        }
        if (stale > 0) {
            metrics.recordStale(stale);
            log.debug("Online read view={} flagged {} stale records", view, stale);
        }
        return out.build();
    }

    @Override
    public List<FeatureRecord> getHistoricalFeatures(String view, List<String> companyIds, Instant start, Instant end) {
        return featureStore.readHistorical(view, companyIds, start, end);
    }

    @Override
    public FeatureStats getFeatureStats(String view) {
        return featureStore.stats(view);
    }

    @Override
    public FeatureView registerFeatureView(String view, int embeddingDim) {
        return featureStore.registerView(view, embeddingDim);
    }

    @Override
    public boolean isStale(FeatureRecord record) {
        return record.getTimestamp().plus(stalenessBound).isBefore(clock.instant());
    }
}
