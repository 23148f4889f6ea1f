package com.synapse.x.dto;

import com.synapse.x.dto.enums.DegradedReason;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

@Value
@Builder(toBuilder = true)
public class RecommendResponse {
    String queryCompanyId;
    String featureView;
    List<RankedResult> results;
    boolean degraded;
    Set<DegradedReason> degradedReasons;
    Long stalenessSeconds;
    int poolSizeTotal;
    int poolSizeUsed;
    boolean poolTruncated;
    int timedOutCandidates;
    int excludedCandidates;
    int staleCandidates;
    boolean partial;
    String modelVersion;
    long latencyMs;
}
