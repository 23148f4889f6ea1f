package com.synapse.x.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Aggregated outcome of the chunked candidate lookups of one request.
 */
@Value
@Builder
public class CandidateFetch {
    Map<String, FeatureRecord> records;
    /** Fetched candidates whose record is older than the staleness bound. */
    Set<String> staleCandidates;
    int timedOutCandidates;
    boolean partial;
    boolean fromFallback;
    Long stalenessSeconds;
}
