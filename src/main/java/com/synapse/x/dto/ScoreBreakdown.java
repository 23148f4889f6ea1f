package com.synapse.x.dto;

import com.synapse.x.dto.enums.CompatibilityFactor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Output of a compatibility evaluation for one (query, candidate) pair.
 * {@code cosineSimilarity} is the raw cosine before clamping, null when either side lacks
 * a culture vector.
 */
@Value
@Builder
public class ScoreBreakdown {
    double score;
    double confidence;
    Double cosineSimilarity;
    List<FactorContribution> factors;
    List<CompatibilityFactor> missingFactors;
}
