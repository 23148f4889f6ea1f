package com.synapse.x.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class BatchRecommendResponse {
    Map<String, BatchRecommendEntry> results;
    int processedCount;
    int failedCount;
    long latencyMs;
}
