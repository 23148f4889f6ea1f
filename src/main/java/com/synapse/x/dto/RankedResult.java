package com.synapse.x.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class RankedResult {
    String candidateId;
    double score;
    double confidence;
    int rank;
    boolean stale;
    List<FactorContribution> breakdown;
}
