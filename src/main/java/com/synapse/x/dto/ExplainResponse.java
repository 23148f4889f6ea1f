package com.synapse.x.dto;

import com.synapse.x.dto.enums.CompatibilityFactor;
import com.synapse.x.dto.enums.DegradedReason;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

@Value
@Builder
public class ExplainResponse {
    String queryCompanyId;
    String candidateId;
    String featureView;
    double score;
    double confidence;
    boolean eligible;
    String ineligibleReason;
    Double cosineSimilarity;
    List<FactorContribution> factors;
    List<CompatibilityFactor> missingFactors;
    boolean degraded;
    Set<DegradedReason> degradedReasons;
    Long stalenessSeconds;
    String modelVersion;
}
