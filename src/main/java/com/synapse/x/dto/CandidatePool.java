package com.synapse.x.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CandidatePool {
    List<String> candidateIds;
    int totalSize;
    boolean truncated;
    boolean fromFallback;
    Long stalenessSeconds;
}
