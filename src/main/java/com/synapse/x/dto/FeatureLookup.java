package com.synapse.x.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Features resolved for the ranking path. When {@code fromFallback} is set the records come
 * from last-known-good cache snapshots and {@code stalenessSeconds} is the age of the oldest
 * snapshot used.
 */
@Value
@Builder
public class FeatureLookup {
    @Singular("record")
    Map<String, FeatureRecord> records;
    @Singular("stale")
    Set<String> stale;
    boolean fromFallback;
    Long stalenessSeconds;
}
