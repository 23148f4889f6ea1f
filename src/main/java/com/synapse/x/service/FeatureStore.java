package com.synapse.x.service;

import com.synapse.x.dto.CompanyPointer;
import com.synapse.x.dto.FeatureRecord;
import com.synapse.x.dto.FeatureStats;
import com.synapse.x.dto.FeatureView;
import com.synapse.x.dto.WriteResult;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable, versioned storage of company feature records grouped into feature views.
 * <p>
 * Every read sees one committed snapshot. Writes of one call become visible together.
 * For each (view, company) timestamps only ever increase.
 * </p>
 */
public interface FeatureStore {

    WriteResult write(String view, List<FeatureRecord> records);

    /**
     * Latest record per requested id. Ids without a record are absent from the map.
     */
    Map<String, FeatureRecord> readLatest(String view, Collection<String> companyIds);

    /**
     * Records with {@code start <= timestamp <= end}, ordered by company id then timestamp.
     */
    List<FeatureRecord> readHistorical(String view, Collection<String> companyIds, Instant start, Instant end);

    FeatureStats stats(String view);

    List<CompanyPointer> listCompanies(String view);

    FeatureView registerView(String view, int embeddingDim);

    Optional<FeatureView> findView(String view);

    List<FeatureView> listViews();

    Optional<Instant> lastWriteTime();

    /**
     * Opens and closes a read transaction.
     */
    boolean isReadable();
}
