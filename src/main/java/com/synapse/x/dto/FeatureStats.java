package com.synapse.x.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class FeatureStats {
    String featureView;
    long totalCompanies;
    long featureCount;
    Instant lastUpdated;
    long storageSizeBytes;
    int embeddingDim;
}
