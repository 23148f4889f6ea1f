package com.synapse.x.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Catalog entry of a feature view: its declared embedding dimensionality plus the running
 * counters maintained by the write path.
 */
@Value
@Builder(toBuilder = true)
public class FeatureView {
    String name;
    int embeddingDim;
    Instant createdAt;
    long companyCount;
    long recordCount;
    Instant lastUpdated;
    long storageBytes;
}
