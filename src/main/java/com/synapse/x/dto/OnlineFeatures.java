package com.synapse.x.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of an online lookup. Ids in {@code stale} are also present in {@code found}; their
 * latest record is older than the configured staleness bound.
 */
@Value
@Builder
public class OnlineFeatures {
    @Singular("found")
    List<FeatureRecord> found;
    @Singular("missing")
    List<String> missing;
    @Singular("stale")
    List<String> stale;
}
