package com.synapse.x.service;

import com.synapse.x.dto.FeatureRecord;
import com.synapse.x.dto.FeatureStats;
import com.synapse.x.dto.FeatureView;
import com.synapse.x.dto.OnlineFeatures;
import com.synapse.x.dto.WriteResult;

import java.time.Instant;
import java.util.List;

/**
 * Feature store operations as served to callers: the online path goes through the serving
 * cache, writes invalidate it, historical reads bypass it.
 */
public interface FeatureServingService {

    WriteResult writeFeatures(String view, List<FeatureRecord> records);

    OnlineFeatures getOnlineFeatures(String view, List<String> companyIds);

    List<FeatureRecord> getHistoricalFeatures(String view, List<String> companyIds, Instant start, Instant end);

    FeatureStats getFeatureStats(String view);

    FeatureView registerFeatureView(String view, int embeddingDim);

    boolean isStale(FeatureRecord record);
}
